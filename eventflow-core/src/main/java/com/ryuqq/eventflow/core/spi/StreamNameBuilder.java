package com.ryuqq.eventflow.core.spi;

import java.util.UUID;

/**
 * Stream naming convention.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StreamNameBuilder {

    String generateForAggregate(Class<?> aggregateType, UUID id);

    String generateForCategory(Class<?> aggregateType);

    String generateForEventType(String eventTypeName);
}
