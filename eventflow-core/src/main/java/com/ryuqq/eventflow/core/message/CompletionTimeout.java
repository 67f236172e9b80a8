package com.ryuqq.eventflow.core.message;

import java.util.UUID;

/**
 * 완료 대기 시간 만료 (Ack 이후 응답 없음).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CompletionTimeout extends CommandTimeout {

    public CompletionTimeout(UUID commandId) {
        super(commandId);
    }
}
