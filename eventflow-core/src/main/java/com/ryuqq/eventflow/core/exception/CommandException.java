package com.ryuqq.eventflow.core.exception;

import com.ryuqq.eventflow.core.message.Command;

/**
 * Command 처리 실패.
 *
 * <p>메시지 형식: {@code "{CommandType}: {message}"}</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CommandException extends RuntimeException {

    private final transient Command command;

    public CommandException(String message, Command command) {
        this(message, command, null);
    }

    public CommandException(String message, Command command, Throwable cause) {
        super(format(message, command), cause);
        this.command = command;
    }

    private static String format(String message, Command command) {
        String type = command == null ? "Command" : command.getClass().getSimpleName();
        return type + ": " + message;
    }

    /**
     * @return 실패한 Command (null 가능)
     */
    public Command getCommand() {
        return command;
    }
}
