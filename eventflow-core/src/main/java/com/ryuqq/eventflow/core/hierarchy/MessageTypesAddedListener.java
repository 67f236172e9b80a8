package com.ryuqq.eventflow.core.hierarchy;

import java.util.Set;

/**
 * 새 메시지 타입 등록 통지.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageTypesAddedListener {

    void onMessageTypesAdded(Set<Class<?>> addedTypes);
}
