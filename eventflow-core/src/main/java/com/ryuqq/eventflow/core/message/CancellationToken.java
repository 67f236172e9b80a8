package com.ryuqq.eventflow.core.message;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Command 취소 신호.
 *
 * <p>한 번 취소되면 되돌릴 수 없습니다. 여러 Command가 같은 토큰을 공유할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private final AtomicBoolean canceled = new AtomicBoolean(false);

    public void cancel() {
        canceled.set(true);
    }

    public boolean isCancellationRequested() {
        return canceled.get();
    }
}
