package com.ryuqq.eventflow.core.exception;

import java.util.UUID;

/**
 * 요청한 버전과 재생된 버전이 일치하지 않음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AggregateVersionException extends AggregateException {

    private final long requestedVersion;
    private final long aggregateVersion;

    public AggregateVersionException(UUID id, Class<?> type, long requestedVersion, long aggregateVersion) {
        super(
            String.format("Requested version %d of aggregate '%s' (type %s) - aggregate version is %d",
                requestedVersion, id, nameOf(type), aggregateVersion),
            id, type
        );
        this.requestedVersion = requestedVersion;
        this.aggregateVersion = aggregateVersion;
    }

    public long getRequestedVersion() {
        return requestedVersion;
    }

    public long getAggregateVersion() {
        return aggregateVersion;
    }
}
