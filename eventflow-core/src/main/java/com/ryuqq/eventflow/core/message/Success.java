package com.ryuqq.eventflow.core.message;

/**
 * Command 성공 응답.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Success extends CommandResponse {

    public Success(Command sourceCommand) {
        super(sourceCommand);
    }
}
