package com.ryuqq.eventflow.core.exception;

import com.ryuqq.eventflow.core.message.Command;

/**
 * Command Ack 시간 내 처리 핸들러 없음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CommandNotHandledException extends CommandException {

    public CommandNotHandledException(Command command) {
        super("not handled", command);
    }

    public CommandNotHandledException(String message, Command command) {
        super(message, command);
    }
}
