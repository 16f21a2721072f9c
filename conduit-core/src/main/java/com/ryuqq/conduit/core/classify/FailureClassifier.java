package com.ryuqq.conduit.core.classify;

import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.outcome.FailureKind;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;
import com.ryuqq.conduit.core.outcome.TransportFailure;

/**
 * 실패 분류기.
 *
 * <p>결과가 재시도 가능한 일시적 실패인지, Circuit Breaker가 집계할 실패인지 판정합니다.</p>
 *
 * <p><strong>재시도 규칙 (순서대로 적용):</strong></p>
 * <ol>
 *   <li>attemptNumber &gt;= maxAttempts → false</li>
 *   <li>비멱등 요청 (POST, PATCH) → 무조건 false</li>
 *   <li>연결 예외 또는 시도 타임아웃 → true</li>
 *   <li>HTTP 408 또는 5xx → true</li>
 *   <li>HTTP 429 → rate-limit 재시도가 켜져 있을 때만 true</li>
 *   <li>그 외 (ApplicationFailure, 형식 오류, 요청 구성 오류, 파이프라인 내부 거부, 나머지 4xx) → false</li>
 * </ol>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class FailureClassifier {

    private static final int REQUEST_TIMEOUT = 408;
    private static final int TOO_MANY_REQUESTS = 429;
    private static final int SERVER_ERROR_MIN = 500;

    private final boolean rateLimitRetryEnabled;

    /**
     * 생성자.
     *
     * @param rateLimitRetryEnabled 429 응답을 재시도할지 여부
     */
    public FailureClassifier(boolean rateLimitRetryEnabled) {
        this.rateLimitRetryEnabled = rateLimitRetryEnabled;
    }

    /**
     * 재시도 여부 판정.
     *
     * @param outcome 직전 시도의 결과
     * @param request 원래 요청
     * @param attemptNumber 직전 시도 번호 (1부터 시작)
     * @param maxAttempts 최대 시도 횟수 (최초 1회 + 재시도)
     * @return 재시도해야 하면 true
     */
    public boolean shouldRetry(PipelineOutcome<?> outcome, RequestDescriptor request, int attemptNumber, int maxAttempts) {
        if (attemptNumber >= maxAttempts) {
            return false;
        }
        if (!request.isIdempotent()) {
            return false;
        }
        if (!(outcome instanceof TransportFailure<?> failure)) {
            return false;
        }
        if (failure.kind().isTransientTransport()) {
            return true;
        }
        if (failure.kind() != FailureKind.HTTP_STATUS) {
            return false;
        }
        return isRetryableStatus(failure.statusCode());
    }

    /**
     * 재시도 대상 HTTP 상태 코드인지 확인.
     *
     * @param statusCode HTTP 상태 코드
     * @return 408, 5xx, (활성화 시) 429이면 true
     */
    public boolean isRetryableStatus(int statusCode) {
        if (statusCode == REQUEST_TIMEOUT || statusCode >= SERVER_ERROR_MIN) {
            return true;
        }
        return statusCode == TOO_MANY_REQUESTS && rateLimitRetryEnabled;
    }

    /**
     * Circuit Breaker가 실패로 집계할 결과인지 확인.
     *
     * <p>전송 실패와 408/429/5xx 상태만 실패로 집계합니다.
     * ApplicationFailure와 형식 오류는 업스트림이 살아있다는 신호이므로 제외합니다.</p>
     *
     * @param outcome 호출 결과
     * @return 실패로 집계해야 하면 true
     */
    public boolean isBreakerFailure(PipelineOutcome<?> outcome) {
        if (!(outcome instanceof TransportFailure<?> failure)) {
            return false;
        }
        if (failure.kind().isTransientTransport()) {
            return true;
        }
        if (failure.kind() != FailureKind.HTTP_STATUS) {
            return false;
        }
        int status = failure.statusCode();
        return status == REQUEST_TIMEOUT || status == TOO_MANY_REQUESTS || status >= SERVER_ERROR_MIN;
    }

    public boolean isRateLimitRetryEnabled() {
        return rateLimitRetryEnabled;
    }
}
