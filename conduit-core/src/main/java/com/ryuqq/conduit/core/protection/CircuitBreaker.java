package com.ryuqq.conduit.core.protection;

import com.ryuqq.conduit.core.model.RequestDescriptor;

import java.time.Duration;
import java.util.Optional;

/**
 * Circuit Breaker SPI.
 *
 * <p>업스트림 호출의 실패율을 추적하고, 임계값 초과 시 빠르게 실패(Fail-Fast)하여
 * 장애가 호출자에게 전파되는 것을 방지합니다.</p>
 *
 * <p>상태는 파이프라인 인스턴스(= 설정된 클라이언트 하나)가 소유합니다.
 * 여러 클라이언트가 같은 프로세스에 있어도 서로의 상태에 영향을 주지 않습니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 실패율 추적</li>
 *   <li>OPEN: 요청 차단, 빠른 실패</li>
 *   <li>HALF_OPEN: 단 하나의 시험 호출로 복구 확인</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Optional<CircuitPermit> permit = cb.tryAcquire(request);
 * if (permit.isEmpty()) {
 *     return TransportFailure.circuitOpen(cb.getName());
 * }
 * PipelineOutcome<T> outcome = call();
 * if (cancelled) {
 *     cb.releasePermission(permit.get());
 * } else if (classifier.isBreakerFailure(outcome)) {
 *     cb.recordFailure(permit.get(), elapsed, failure.toException());
 * } else {
 *     cb.recordSuccess(permit.get(), elapsed);
 * }
 * }</pre>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 허가</li>
     *   <li>OPEN: break duration 경과 전이면 차단, 경과했으면 HALF_OPEN으로 전이 후 허가</li>
     *   <li>HALF_OPEN: 진행 중인 시험 호출이 없을 때만 허가</li>
     * </ul>
     *
     * <p>반환된 허가는 결과 기록 시 그대로 돌려줘야 합니다.</p>
     *
     * @param request 요청 (로깅용)
     * @return 통과 허가, 차단이면 empty
     */
    Optional<CircuitPermit> tryAcquire(RequestDescriptor request);

    /**
     * 실행 성공 기록.
     *
     * <p>HALF_OPEN 시험 호출의 허가면 CLOSED로 전이하고 카운터를 초기화합니다.
     * 허가 발급 이후 상태가 바뀌었다면 결과는 무시됩니다.</p>
     *
     * @param permit tryAcquire가 발급한 허가
     * @param elapsed 호출 소요 시간
     */
    void recordSuccess(CircuitPermit permit, Duration elapsed);

    /**
     * 실행 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 실패율 계산 후 임계값 초과 시 OPEN으로 전이</li>
     *   <li>HALF_OPEN: 즉시 OPEN으로 전이, break 타이머 재시작</li>
     * </ul>
     *
     * <p>허가 발급 이후 상태가 바뀌었다면 결과는 무시됩니다.</p>
     *
     * @param permit tryAcquire가 발급한 허가
     * @param elapsed 호출 소요 시간
     * @param throwable 실패를 나타내는 예외
     */
    void recordFailure(CircuitPermit permit, Duration elapsed, Throwable throwable);

    /**
     * 결과를 기록하지 않고 허가만 반납.
     *
     * <p>호출자 취소나 전체 타임아웃처럼 업스트림 상태와 무관하게 호출이 끝났을 때 사용합니다.
     * HALF_OPEN 시험 호출이었다면 다음 호출이 다시 시험할 수 있게 됩니다.</p>
     *
     * @param permit tryAcquire가 발급한 허가
     */
    void releasePermission(CircuitPermit permit);

    /**
     * 현재 Circuit Breaker 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();

    /**
     * Circuit Breaker 이름 (로그, 오류 메시지용).
     *
     * @return 이름
     */
    String getName();
}
