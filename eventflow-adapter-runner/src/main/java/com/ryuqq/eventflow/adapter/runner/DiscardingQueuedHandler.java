package com.ryuqq.eventflow.adapter.runner;

import com.ryuqq.eventflow.core.exception.QueueStopTimeoutException;
import com.ryuqq.eventflow.core.message.Message;
import com.ryuqq.eventflow.core.spi.Handler;
import com.ryuqq.eventflow.core.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 가장 최근 메시지만 처리하는 QueuedHandler.
 *
 * <p>소비 스레드가 메시지를 꺼낼 때 큐에 여러 건이 쌓여 있으면 마지막 한 건만 남기고
 * 나머지는 버립니다. 지연보다 최신성이 중요한 상태 갱신 알림 등에 사용합니다.</p>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>마지막으로 publish된 메시지는 반드시 처리됨</li>
 *   <li>처리되는 메시지끼리는 publish 순서를 유지</li>
 *   <li>중간 메시지는 전달되지 않을 수 있음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DiscardingQueuedHandler extends AbstractQueuedHandler {

    private static final Logger log = LoggerFactory.getLogger(DiscardingQueuedHandler.class);

    private static final long WAIT_TIMEOUT_MS = 100;

    private final Object signal = new Object();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile Thread thread;
    private volatile long discardedCount;

    public DiscardingQueuedHandler(String name, Handler<Message> consumer) {
        this(name, consumer, new QueuedHandlerConfig(), null);
    }

    public DiscardingQueuedHandler(String name, Handler<Message> consumer, QueuedHandlerConfig config, QueueMonitor monitor) {
        super(name, consumer, config, new ConcurrentLinkedQueue<>(), monitor);
    }

    @Override
    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException("Already a thread running.");
        }
        registerWithMonitor();
        Thread consumerThread = new DaemonThreadFactory(getName()).newThread(this::run);
        thread = consumerThread;
        consumerThread.start();
    }

    @Override
    protected void onEnqueued() {
        synchronized (signal) {
            signal.notifyAll();
        }
    }

    @Override
    public void requestStop() {
        stopRequested = true;
        onEnqueued();
    }

    @Override
    public void stop() {
        requestStop();
        if (thread == null) {
            return;
        }
        try {
            if (!stopped.await(getConfig().stopTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                throw new QueueStopTimeoutException(getName());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueStopTimeoutException(getName());
        }
    }

    /**
     * @return 지금까지 버려진 메시지 수
     */
    public long discardedCount() {
        return discardedCount;
    }

    private void run() {
        try {
            while (!stopRequested) {
                Message latest = pollNext();
                if (latest == null) {
                    synchronized (signal) {
                        if (queue.isEmpty() && !stopRequested) {
                            signal.wait(WAIT_TIMEOUT_MS);
                        }
                    }
                    continue;
                }
                int discarded = 0;
                Message next;
                while ((next = queue.poll()) != null) {
                    latest = next;
                    discarded++;
                }
                if (discarded > 0) {
                    discardedCount += discarded;
                    log.debug("Discarding Messages: {} dropped in '{}'.", discarded, getName());
                }
                dispatch(latest);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            markDispatching(false);
            unregisterFromMonitor();
            stopped.countDown();
        }
    }
}
