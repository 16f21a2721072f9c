package com.ryuqq.conduit.core.protection.noop;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.protection.Bulkhead;
import com.ryuqq.conduit.core.protection.BulkheadConfig;

import java.util.concurrent.CompletableFuture;

/**
 * Bulkhead NoOp 구현.
 *
 * <p>동시 실행 수를 제한하지 않고 모든 호출을 즉시 허용합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class NoOpBulkhead implements Bulkhead {

    private static final BulkheadConfig UNLIMITED = new BulkheadConfig(Integer.MAX_VALUE, 0);

    @Override
    public CompletableFuture<Boolean> acquire(CancellationToken token) {
        return CompletableFuture.completedFuture(true);
    }

    @Override
    public void release() {
        // NoOp
    }

    @Override
    public int getCurrentConcurrency() {
        return 0;
    }

    @Override
    public int getQueuedCount() {
        return 0;
    }

    @Override
    public BulkheadConfig getConfig() {
        return UNLIMITED;
    }
}
