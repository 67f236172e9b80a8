package com.ryuqq.eventflow.core.exception;

import com.ryuqq.eventflow.core.message.Command;

/**
 * Command 완료 시간 초과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CommandTimedOutException extends CommandException {

    public CommandTimedOutException(Command command) {
        super("timed out", command);
    }

    public CommandTimedOutException(String message, Command command) {
        super(message, command);
    }
}
