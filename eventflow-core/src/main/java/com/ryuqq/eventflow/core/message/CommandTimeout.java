package com.ryuqq.eventflow.core.message;

import java.util.UUID;

/**
 * Command 추적 타임아웃 신호의 공통 타입.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class CommandTimeout extends Message {

    private final UUID commandId;

    protected CommandTimeout(UUID commandId) {
        if (commandId == null) {
            throw new IllegalArgumentException("commandId cannot be null");
        }
        this.commandId = commandId;
    }

    public UUID getCommandId() {
        return commandId;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{commandId=" + commandId + "}";
    }
}
