package com.ryuqq.eventflow.core.aggregate;

import com.ryuqq.eventflow.core.spi.EventSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * 이벤트 라우팅/기록 기반 Aggregate 베이스.
 *
 * <p>하위 클래스는 생성자에서 {@link #register(Class, Consumer)}로 이벤트별 상태 적용 로직을 등록하고,
 * 행위 메서드에서 {@link #raise(Object)}로 이벤트를 발생시킵니다.</p>
 *
 * <p><strong>버전 규칙:</strong></p>
 * <ul>
 *   <li>새 인스턴스는 -1</li>
 *   <li>재생된 이벤트 하나마다 +1 (첫 이벤트는 0)</li>
 *   <li>{@link #takeEvents()}는 꺼낸 이벤트 수만큼 버전을 올림</li>
 * </ul>
 *
 * <p>등록되지 않은 타입의 이벤트는 상태 변경 없이 버전만 올립니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AggregateRoot implements EventSource {

    private final Map<Class<?>, Consumer<Object>> routes = new HashMap<>();
    private final List<Object> recorded = new ArrayList<>();
    private UUID id;
    private long version = -1;

    protected AggregateRoot() {
    }

    @Override
    public UUID getId() {
        return id;
    }

    protected void setId(UUID id) {
        this.id = id;
    }

    @Override
    public long getExpectedVersion() {
        return version;
    }

    public boolean hasRecordedEvents() {
        return !recorded.isEmpty();
    }

    @Override
    public void restoreFromEvents(Iterable<Object> events) {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        if (hasRecordedEvents()) {
            throw new IllegalStateException("Restoring from events is not possible when an instance has recorded events.");
        }
        for (Object event : events) {
            restoreFromEvent(event);
        }
    }

    @Override
    public void updateWithEvents(Iterable<Object> events, long expectedVersion) {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        if (hasRecordedEvents()) {
            throw new IllegalStateException("Cannot apply updates to an aggregate with pending events.");
        }
        if (expectedVersion != version) {
            throw new IllegalStateException(
                "Expected version mismatch when applying updates (expected: " + expectedVersion + ", current: " + version + ")");
        }
        for (Object event : events) {
            restoreFromEvent(event);
        }
    }

    private void restoreFromEvent(Object event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        version = version < 0 ? 0 : version + 1;
        route(event);
    }

    @Override
    public List<Object> takeEvents() {
        List<Object> taken = List.copyOf(recorded);
        recorded.clear();
        version += taken.size();
        return taken;
    }

    /**
     * 이벤트 타입별 상태 적용 로직을 등록합니다.
     *
     * @throws IllegalArgumentException 같은 타입이 이미 등록된 경우
     */
    @SuppressWarnings("unchecked")
    protected <E> void register(Class<E> eventType, Consumer<E> route) {
        if (eventType == null) {
            throw new IllegalArgumentException("eventType cannot be null");
        }
        if (route == null) {
            throw new IllegalArgumentException("route cannot be null");
        }
        if (routes.putIfAbsent(eventType, event -> route.accept((E) event)) != null) {
            throw new IllegalArgumentException("There is already a route registered for " + eventType.getName());
        }
    }

    /**
     * 이벤트를 적용하고 미커밋 이벤트로 기록합니다.
     */
    protected void raise(Object event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        route(event);
        recorded.add(event);
    }

    private void route(Object event) {
        Consumer<Object> handler = routes.get(event.getClass());
        if (handler != null) {
            handler.accept(event);
        }
    }
}
