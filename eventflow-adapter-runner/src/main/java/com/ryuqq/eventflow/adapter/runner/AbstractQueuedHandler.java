package com.ryuqq.eventflow.adapter.runner;

import com.ryuqq.eventflow.core.message.Message;
import com.ryuqq.eventflow.core.spi.Handler;
import com.ryuqq.eventflow.core.spi.QueuedHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * QueuedHandler 공통 구현.
 *
 * <p>큐 보관, 메시지 디스패치, 처리 시간 측정, 예외 로깅을 담당하고
 * 소비 전략(전용 스레드, 스레드 풀, 폐기)은 하위 클래스가 결정합니다.</p>
 *
 * <p><strong>예외 처리:</strong></p>
 * <ul>
 *   <li>consumer 예외는 메시지 타입과 함께 ERROR로 기록하고 다음 메시지를 계속 처리</li>
 *   <li>소비 스레드는 consumer 예외로 종료되지 않음</li>
 * </ul>
 *
 * <p><strong>모니터링:</strong> {@link QueueMonitor}가 주어지면 start 시 등록, 중지 시 해제합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractQueuedHandler implements QueuedHandler {

    private static final Logger log = LoggerFactory.getLogger(AbstractQueuedHandler.class);

    private final String name;
    private final Handler<Message> consumer;
    private final QueuedHandlerConfig config;
    private final QueueMonitor monitor;
    private final AtomicLong processed = new AtomicLong();

    /**
     * 대기 중인 메시지. 하위 클래스가 구현체를 고릅니다.
     */
    protected final Queue<Message> queue;

    protected volatile boolean stopRequested;
    private volatile boolean dispatching;

    /**
     * 생성자.
     *
     * @param name 큐 이름 (스레드 이름, 로그에 사용)
     * @param consumer 메시지를 최종 처리할 핸들러
     * @param config 설정
     * @param queue 메시지 저장 큐
     * @param monitor 큐 모니터 (null 가능)
     * @throws IllegalArgumentException name, consumer, config, queue가 null인 경우
     */
    protected AbstractQueuedHandler(
        String name,
        Handler<Message> consumer,
        QueuedHandlerConfig config,
        Queue<Message> queue,
        QueueMonitor monitor
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (consumer == null) {
            throw new IllegalArgumentException("consumer cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        this.name = name;
        this.consumer = consumer;
        this.config = config;
        this.queue = queue;
        this.monitor = monitor;
    }

    @Override
    public String getName() {
        return name;
    }

    protected QueuedHandlerConfig getConfig() {
        return config;
    }

    @Override
    public void handle(Message message) {
        publish(message);
    }

    @Override
    public void publish(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        queue.offer(message);
        onEnqueued();
    }

    /**
     * 메시지가 큐에 들어간 직후 호출됩니다.
     */
    protected void onEnqueued() {
    }

    @Override
    public int messageCount() {
        return queue.size();
    }

    @Override
    public boolean isIdle() {
        return !dispatching && queue.isEmpty();
    }

    @Override
    public long processedCount() {
        return processed.get();
    }

    /**
     * 다음 메시지를 꺼냅니다. 꺼낸 메시지가 디스패치를 마칠 때까지 큐는 idle이 아닙니다.
     *
     * @return 다음 메시지, 비어 있으면 null
     */
    protected Message pollNext() {
        dispatching = true;
        Message message = queue.poll();
        if (message == null) {
            dispatching = false;
        }
        return message;
    }

    protected void markDispatching(boolean value) {
        dispatching = value;
    }

    /**
     * 메시지 한 건을 consumer에 전달합니다. consumer 예외는 ERROR로 기록합니다.
     */
    protected void dispatch(Message message) {
        dispatching = true;
        long start = System.nanoTime();
        try {
            consumer.handle(message);
        } catch (RuntimeException e) {
            log.error("Error while processing message {} in queued handler '{}'.",
                message.getClass().getSimpleName(), name, e);
        } finally {
            processed.incrementAndGet();
            dispatching = false;
        }
        if (config.watchSlowMsg()) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
            if (elapsedMs > config.slowMsgThreshold().toMillis()) {
                log.warn("SLOW QUEUE MSG [{}]: {} - {}ms. Q: {}.",
                    name, message.getClass().getSimpleName(), elapsedMs, queue.size());
                if (elapsedMs > config.verySlowMsgThreshold().toMillis()) {
                    log.error("---!!! VERY SLOW QUEUE MSG [{}]: {} - {}ms. Q: {}.",
                        name, message.getClass().getSimpleName(), elapsedMs, queue.size());
                }
            }
        }
    }

    protected void registerWithMonitor() {
        if (monitor != null) {
            monitor.register(this);
        }
    }

    protected void unregisterFromMonitor() {
        if (monitor != null) {
            monitor.unregister(this);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name + ", queued=" + queue.size() + "}";
    }
}
