package com.ryuqq.eventflow.core.exception;

import com.ryuqq.eventflow.core.message.Command;

/**
 * Command 둘 이상의 핸들러가 Ack.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CommandOversubscribedException extends CommandException {

    public CommandOversubscribedException(Command command) {
        super("oversubscribed", command);
    }

    public CommandOversubscribedException(String message, Command command) {
        super(message, command);
    }
}
