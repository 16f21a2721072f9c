package com.ryuqq.conduit.core.cancel;

import java.util.ArrayList;
import java.util.List;

/**
 * 파이프라인 전체를 관통하는 협조적 취소 신호.
 *
 * <p>하나의 논리적 호출에 하나의 토큰이 전달되며, 모든 대기 지점
 * (Rate Limiter 대기열, 재시도 backoff, 타임아웃, 네트워크 I/O)이 이 토큰을 관찰합니다.</p>
 *
 * <p><strong>토큰 계층:</strong></p>
 * <pre>
 * caller token
 *   └─ operation token (Total Timeout이 생성)
 *        └─ attempt token (Attempt Timeout이 시도마다 생성)
 * </pre>
 *
 * <p>부모가 취소되면 자식도 같은 사유로 취소됩니다. 자식의 취소는 부모에 영향을 주지 않습니다.</p>
 *
 * <p><strong>Thread-safety:</strong> 모든 메서드는 스레드 안전합니다.
 * 리스너는 {@link #cancel(String)}을 호출한 스레드에서 잠금 밖에서 실행됩니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private final Object lock = new Object();
    private final List<Runnable> listeners = new ArrayList<>();
    private volatile String reason;
    private Registration parentLink = Registration.NONE;

    /**
     * 취소 리스너 등록 해제 핸들.
     */
    @FunctionalInterface
    public interface Registration {

        /** 아무 것도 하지 않는 핸들. */
        Registration NONE = () -> { };

        /**
         * 리스너 등록 해제. 여러 번 호출해도 안전합니다.
         */
        void remove();
    }

    /**
     * 취소되지 않은 새 토큰 생성.
     *
     * @return 새 CancellationToken
     */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * 취소할 일이 없는 호출을 위한 새 토큰 생성.
     *
     * @return 새 CancellationToken
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * 이 토큰에 연결된 자식 토큰 생성.
     *
     * <p>이 토큰이 이미 취소된 경우 자식도 즉시 취소된 상태로 반환됩니다.
     * 자식 사용이 끝나면 {@link #detach()}로 부모와의 연결을 해제해야 합니다.</p>
     *
     * @return 자식 토큰
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        child.parentLink = onCancel(() -> child.cancel(reason));
        return child;
    }

    /**
     * 부모 토큰과의 연결 해제. 취소 상태는 바꾸지 않습니다.
     */
    public void detach() {
        Registration link;
        synchronized (lock) {
            link = parentLink;
            parentLink = Registration.NONE;
        }
        link.remove();
    }

    /**
     * 취소 요청.
     *
     * <p>처음 호출만 효과가 있으며, 등록된 모든 리스너를 실행합니다.
     * 리스너가 예외를 던지면 나머지 리스너를 모두 실행한 뒤 첫 예외를 다시 던집니다.</p>
     *
     * @param why 취소 사유
     * @return 이번 호출로 취소되었으면 true, 이미 취소된 상태였으면 false
     */
    public boolean cancel(String why) {
        List<Runnable> toRun;
        synchronized (lock) {
            if (reason != null) {
                return false;
            }
            reason = why == null || why.isBlank() ? "cancelled" : why;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }

        RuntimeException first = null;
        for (Runnable listener : toRun) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null) {
            throw first;
        }
        return true;
    }

    /**
     * 취소 리스너 등록.
     *
     * <p>이미 취소된 토큰이면 리스너를 즉시 현재 스레드에서 실행합니다.</p>
     *
     * @param listener 취소 시 실행할 작업
     * @return 등록 해제 핸들
     */
    public Registration onCancel(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        synchronized (lock) {
            if (reason == null) {
                listeners.add(listener);
                return () -> {
                    synchronized (lock) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        listener.run();
        return Registration.NONE;
    }

    public boolean isCancelled() {
        return reason != null;
    }

    /**
     * 취소 사유 조회.
     *
     * @return 취소 사유 (취소되지 않았으면 null)
     */
    public String reason() {
        return reason;
    }

    int listenerCount() {
        synchronized (lock) {
            return listeners.size();
        }
    }
}
