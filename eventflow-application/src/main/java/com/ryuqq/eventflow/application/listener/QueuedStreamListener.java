package com.ryuqq.eventflow.application.listener;

import com.ryuqq.eventflow.adapter.runner.QueueMonitor;
import com.ryuqq.eventflow.adapter.runner.QueuedHandlerConfig;
import com.ryuqq.eventflow.adapter.runner.SleepingQueuedHandler;
import com.ryuqq.eventflow.core.message.CatchupSubscriptionBecameLive;
import com.ryuqq.eventflow.core.message.Message;
import com.ryuqq.eventflow.core.spi.EventSerializer;
import com.ryuqq.eventflow.core.spi.QueuedHandler;
import com.ryuqq.eventflow.core.spi.StreamNameBuilder;
import com.ryuqq.eventflow.core.spi.StreamStoreConnection;
import com.ryuqq.eventflow.core.spi.Subscription;

/**
 * 순서 보장 큐를 거쳐 전달하는 {@link StreamListener}.
 *
 * <p>저장소 구독 스레드는 메시지를 큐에 넣기만 하고, 큐의 소비 스레드 하나가 구독자에게 전달합니다.
 * live 전환 신호도 같은 큐를 통과하므로 전환 구간에 쌓인 이력을 모두 처리한 뒤에야
 * {@code LIVE}가 됩니다.</p>
 *
 * <pre>
 * 구독 스레드 → 큐 → (pause 중이면 대기) → 내부 버스 → 구독자
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class QueuedStreamListener extends StreamListener {

    private final QueuedHandler queue;
    private final Object pauseLock = new Object();
    private boolean paused;
    private volatile boolean queueStarted;

    public QueuedStreamListener(
        String name,
        StreamStoreConnection connection,
        StreamNameBuilder streamNameBuilder,
        EventSerializer serializer
    ) {
        this(name, connection, streamNameBuilder, serializer, new QueuedHandlerConfig(), null);
    }

    /**
     * @param config 내부 큐 설정
     * @param monitor 큐 모니터 (null 가능)
     */
    public QueuedStreamListener(
        String name,
        StreamStoreConnection connection,
        StreamNameBuilder streamNameBuilder,
        EventSerializer serializer,
        QueuedHandlerConfig config,
        QueueMonitor monitor
    ) {
        super(name, connection, streamNameBuilder, serializer);
        this.queue = new SleepingQueuedHandler(name + "-queue", this::handleQueued, config, monitor);
    }

    @Override
    protected void beforeSubscribe() {
        queue.start();
        queueStarted = true;
    }

    @Override
    protected void deliver(Message message) {
        queue.publish(message);
    }

    @Override
    protected void liveProcessingStarted() {
        queue.publish(new CatchupSubscriptionBecameLive());
    }

    private void handleQueued(Message message) {
        awaitResume();
        if (isClosed()) {
            return;
        }
        if (message instanceof CatchupSubscriptionBecameLive) {
            becomeLive();
            return;
        }
        super.deliver(message);
    }

    /**
     * 큐 전달을 멈춥니다. 구독 스레드는 계속 큐에 쌓습니다.
     *
     * @return 닫으면 전달을 재개하는 핸들
     */
    public Subscription pause() {
        synchronized (pauseLock) {
            paused = true;
        }
        return this::resume;
    }

    public void resume() {
        synchronized (pauseLock) {
            paused = false;
            pauseLock.notifyAll();
        }
    }

    public boolean isPaused() {
        synchronized (pauseLock) {
            return paused;
        }
    }

    /**
     * @return 아직 전달하지 않은 메시지 수
     */
    public int pendingCount() {
        return queue.messageCount();
    }

    private void awaitResume() {
        synchronized (pauseLock) {
            while (paused && !isClosed()) {
                try {
                    pauseLock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    @Override
    protected void onClose() {
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
        if (queueStarted) {
            queue.stop();
        }
    }
}
