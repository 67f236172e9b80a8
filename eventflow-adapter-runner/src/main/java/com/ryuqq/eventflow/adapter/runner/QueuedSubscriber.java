package com.ryuqq.eventflow.adapter.runner;

import com.ryuqq.eventflow.adapter.inmemory.bus.InMemoryBus;
import com.ryuqq.eventflow.core.message.Message;
import com.ryuqq.eventflow.core.spi.Handler;
import com.ryuqq.eventflow.core.spi.QueuedHandler;
import com.ryuqq.eventflow.core.spi.Subscriber;
import com.ryuqq.eventflow.core.spi.Subscription;

/**
 * 큐 뒤에 내부 버스를 둔 구독자.
 *
 * <p>외부에서 들어온 메시지({@link #handle(Message)})는 큐에 쌓이고, 소비 스레드가 하나씩 내부
 * 버스에 publish 합니다. 구독한 핸들러는 모두 같은 소비 스레드에서 순서대로 호출됩니다.</p>
 *
 * <pre>
 * handle(msg) → QueuedHandler → dispatch(msg) → InMemoryBus → 구독 핸들러들
 * </pre>
 *
 * <p>생성과 동시에 큐가 시작됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class QueuedSubscriber implements Subscriber, Handler<Message>, AutoCloseable {

    private final InMemoryBus bus;
    private final QueuedHandler queue;

    public QueuedSubscriber(String name) {
        this(name, new QueuedHandlerConfig(), null);
    }

    /**
     * 생성자.
     *
     * @param name 이름 (내부 버스와 큐 이름)
     * @param config 큐 설정
     * @param monitor 큐 모니터 (null 가능)
     */
    public QueuedSubscriber(String name, QueuedHandlerConfig config, QueueMonitor monitor) {
        this.bus = new InMemoryBus(name);
        this.queue = new SleepingQueuedHandler(name + "-queue", this::dispatch, config, monitor);
        this.queue.start();
    }

    /**
     * 큐에서 꺼낸 메시지를 내부 버스로 전달합니다.
     */
    protected void dispatch(Message message) {
        bus.publish(message);
    }

    @Override
    public void handle(Message message) {
        queue.publish(message);
    }

    @Override
    public <T extends Message> Subscription subscribe(Class<T> type, Handler<? super T> handler, boolean includeDerived) {
        return bus.subscribe(type, handler, includeDerived);
    }

    @Override
    public <T extends Message> void unsubscribe(Class<T> type, Handler<? super T> handler) {
        bus.unsubscribe(type, handler);
    }

    @Override
    public boolean hasSubscriberFor(Class<? extends Message> type, boolean includeDerived) {
        return bus.hasSubscriberFor(type, includeDerived);
    }

    /**
     * @return 큐가 비어 있고 처리 중인 메시지가 없으면 true
     */
    public boolean isIdle() {
        return queue.isIdle();
    }

    public int messageCount() {
        return queue.messageCount();
    }

    /**
     * 큐를 멈추고 내부 버스 구독을 모두 해제합니다.
     */
    @Override
    public void close() {
        try {
            queue.stop();
        } finally {
            bus.close();
        }
    }
}
