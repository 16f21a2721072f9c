package com.ryuqq.conduit.adapter.pipeline.protection;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.protection.Bulkhead;
import com.ryuqq.conduit.core.protection.BulkheadConfig;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 대기열이 있는 동시성 제한기.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>진입 중인 호출이 permitLimit 미만이면 즉시 진입</li>
 *   <li>아니면 대기열(최대 queueLimit)에 FIFO로 대기</li>
 *   <li>대기열도 가득 차면 즉시 거부 (false)</li>
 *   <li>{@link #release()} 시 대기열 맨 앞 호출에 슬롯을 바로 넘김</li>
 *   <li>대기 중 토큰이 취소되면 대기열에서 제거하고 {@link CancellationException}으로 완료</li>
 * </ul>
 *
 * <p>대기는 비블로킹입니다. 어떤 스레드도 슬롯을 기다리며 멈추지 않습니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class QueueingBulkhead implements Bulkhead {

    private final BulkheadConfig config;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private int active;

    public QueueingBulkhead(BulkheadConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public CompletableFuture<Boolean> acquire(CancellationToken token) {
        if (token.isCancelled()) {
            return CompletableFuture.failedFuture(new CancellationException(token.reason()));
        }

        Waiter waiter;
        lock.lock();
        try {
            if (active < config.permitLimit()) {
                active++;
                return CompletableFuture.completedFuture(true);
            }
            if (waiters.size() >= config.queueLimit()) {
                return CompletableFuture.completedFuture(false);
            }
            waiter = new Waiter();
            waiters.addLast(waiter);
        } finally {
            lock.unlock();
        }

        // 취소 리스너는 lock 밖에서 등록 (이미 취소됐으면 즉시 실행됨)
        CancellationToken.Registration registration = token.onCancel(() -> abandon(waiter, token.reason()));
        waiter.future.whenComplete((admitted, error) -> registration.remove());
        return waiter.future;
    }

    @Override
    public void release() {
        Waiter next;
        lock.lock();
        try {
            next = waiters.pollFirst();
            if (next == null) {
                if (active > 0) {
                    active--;
                }
                return;
            }
        } finally {
            lock.unlock();
        }
        // 슬롯은 그대로 다음 호출에 넘어가므로 active는 유지
        next.future.complete(true);
    }

    private void abandon(Waiter waiter, String reason) {
        boolean removed;
        lock.lock();
        try {
            removed = waiters.remove(waiter);
        } finally {
            lock.unlock();
        }
        if (removed) {
            waiter.future.completeExceptionally(new CancellationException(reason));
        }
    }

    @Override
    public int getCurrentConcurrency() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getQueuedCount() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public BulkheadConfig getConfig() {
        return config;
    }

    private static final class Waiter {
        private final CompletableFuture<Boolean> future = new CompletableFuture<>();
    }
}
