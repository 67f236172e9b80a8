package com.ryuqq.eventflow.core.message;

import java.util.UUID;

/**
 * Command 처리 결과.
 *
 * <p>닫힌 계층: {@link Success} | {@link Fail} ({@link Canceled} 포함).
 * {@code Send}는 Success가 아니면 예외로 변환하고, {@code TrySend}는 이 값을 그대로 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract sealed class CommandResponse extends Message implements CorrelatedMessage
    permits Success, Fail {

    private final Command sourceCommand;
    private final UUID correlationId;
    private final UUID causationId;

    protected CommandResponse(Command sourceCommand) {
        if (sourceCommand == null) {
            throw new IllegalArgumentException("sourceCommand cannot be null");
        }
        this.sourceCommand = sourceCommand;
        this.correlationId = sourceCommand.getCorrelationId();
        this.causationId = sourceCommand.getMsgId();
    }

    public Command getSourceCommand() {
        return sourceCommand;
    }

    public UUID getCommandId() {
        return sourceCommand.getMsgId();
    }

    public Class<? extends Command> getCommandType() {
        return sourceCommand.getClass();
    }

    @Override
    public UUID getCorrelationId() {
        return correlationId;
    }

    @Override
    public UUID getCausationId() {
        return causationId;
    }

    public boolean isSuccess() {
        return this instanceof Success;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{commandId=" + getCommandId()
            + ", commandType=" + getCommandType().getSimpleName() + "}";
    }
}
