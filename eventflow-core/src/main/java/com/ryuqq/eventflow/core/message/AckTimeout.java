package com.ryuqq.eventflow.core.message;

import java.util.UUID;

/**
 * Ack 대기 시간 만료 (핸들러가 처리를 시작하지 않음).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AckTimeout extends CommandTimeout {

    public AckTimeout(UUID commandId) {
        super(commandId);
    }
}
