package com.ryuqq.eventflow.core.hierarchy;

import com.ryuqq.eventflow.core.message.Message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 메시지 타입 계층 레지스트리.
 *
 * <p>등록된 각 메시지 타입을 {@link Message}까지의 조상 체인에 매핑합니다.
 * "타입 T와 그 하위 타입 모두 구독"을 지원하기 위해 publish 시점이 아닌
 * 등록 시점에 계층을 계산합니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>처음 보는 타입은 {@link #register(Class)} 시점에 조상 체인과 함께 등록</li>
 *   <li>새 타입이 추가되면 {@link MessageTypesAddedListener}에 통지 (버스가 핸들러 맵을 재구성)</li>
 *   <li>한 번 등록된 타입의 조회 결과는 프로세스 수명 동안 변하지 않음</li>
 * </ul>
 *
 * <p>전역 싱글톤이 아닙니다. 버스마다 하나를 소유하거나 명시적으로 공유합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MessageHierarchy {

    private final Map<Class<?>, List<Class<?>>> ancestorsByType = new ConcurrentHashMap<>();
    private final List<MessageTypesAddedListener> listeners = new CopyOnWriteArrayList<>();
    private final Object registrationLock = new Object();

    public MessageHierarchy() {
        ancestorsByType.put(Message.class, List.of(Message.class));
    }

    /**
     * 타입과 그 조상들을 등록.
     *
     * @param type 메시지 타입
     * @return 새로 등록된 타입이 있으면 true
     * @throws IllegalArgumentException type이 null인 경우
     */
    public boolean register(Class<? extends Message> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (ancestorsByType.containsKey(type)) {
            return false;
        }

        Set<Class<?>> added = new LinkedHashSet<>();
        synchronized (registrationLock) {
            Class<?> current = type;
            while (current != null && Message.class.isAssignableFrom(current)) {
                if (!ancestorsByType.containsKey(current)) {
                    ancestorsByType.put(current, chainOf(current));
                    added.add(current);
                }
                current = current.getSuperclass();
            }
        }

        if (added.isEmpty()) {
            return false;
        }
        Set<Class<?>> snapshot = Collections.unmodifiableSet(added);
        for (MessageTypesAddedListener listener : listeners) {
            listener.onMessageTypesAdded(snapshot);
        }
        return true;
    }

    private static List<Class<?>> chainOf(Class<?> type) {
        List<Class<?>> chain = new ArrayList<>();
        Class<?> current = type;
        while (current != null && Message.class.isAssignableFrom(current)) {
            chain.add(current);
            current = current.getSuperclass();
        }
        return List.copyOf(chain);
    }

    public boolean isRegistered(Class<?> type) {
        return ancestorsByType.containsKey(type);
    }

    /**
     * 자기 자신부터 {@link Message}까지의 조상 체인.
     *
     * <p>등록되지 않은 타입이면 먼저 등록합니다.</p>
     *
     * @param type 메시지 타입
     * @return [type, super, ..., Message]
     */
    public List<Class<?>> ancestorsAndSelf(Class<? extends Message> type) {
        List<Class<?>> chain = ancestorsByType.get(type);
        if (chain == null) {
            register(type);
            chain = ancestorsByType.get(type);
        }
        return chain;
    }

    /**
     * 현재 알려진 타입 중 {@code type}의 하위 타입과 자기 자신.
     *
     * @param type 기준 타입
     * @return 하위 타입 집합 (등록 순서 무관)
     */
    public Set<Class<?>> descendantsAndSelf(Class<?> type) {
        Set<Class<?>> result = new LinkedHashSet<>();
        for (Map.Entry<Class<?>, List<Class<?>>> entry : ancestorsByType.entrySet()) {
            if (entry.getValue().contains(type)) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    public Set<Class<?>> knownTypes() {
        return Set.copyOf(ancestorsByType.keySet());
    }

    public void addListener(MessageTypesAddedListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    public void removeListener(MessageTypesAddedListener listener) {
        listeners.remove(listener);
    }
}
