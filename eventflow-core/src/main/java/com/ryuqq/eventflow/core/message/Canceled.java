package com.ryuqq.eventflow.core.message;

import com.ryuqq.eventflow.core.exception.CommandCanceledException;

/**
 * Command 취소 응답.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Canceled extends Fail {

    public Canceled(Command sourceCommand, CommandCanceledException exception) {
        super(sourceCommand, exception);
    }
}
