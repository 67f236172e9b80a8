package com.ryuqq.eventflow.core.message;

import java.util.UUID;

/**
 * 핸들러가 Command 처리를 시작했다는 신호.
 *
 * <p>하나의 Command에 대해 정확히 하나의 Ack만 허용됩니다. 두 번째 Ack는
 * oversubscription(중복 핸들러 구독)으로 간주됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AckCommand extends Message implements CorrelatedMessage {

    private final Command sourceCommand;

    public AckCommand(Command sourceCommand) {
        if (sourceCommand == null) {
            throw new IllegalArgumentException("sourceCommand cannot be null");
        }
        this.sourceCommand = sourceCommand;
    }

    public Command getSourceCommand() {
        return sourceCommand;
    }

    public UUID getCommandId() {
        return sourceCommand.getMsgId();
    }

    @Override
    public UUID getCorrelationId() {
        return sourceCommand.getCorrelationId();
    }

    @Override
    public UUID getCausationId() {
        return sourceCommand.getMsgId();
    }
}
