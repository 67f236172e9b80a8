package com.ryuqq.eventflow.core.exception;

import com.ryuqq.eventflow.core.message.Command;

/**
 * Command 취소됨.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CommandCanceledException extends CommandException {

    public CommandCanceledException(Command command) {
        super("canceled", command);
    }

    public CommandCanceledException(String message, Command command) {
        super(message, command);
    }
}
