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
 * 전용 스레드 하나로 큐를 소비하는 QueuedHandler.
 *
 * <p>큐가 비면 짧게 spin-wait 한 뒤 1ms씩 sleep 합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * loop (stop 요청 전까지)
 *   ↓
 * poll → 메시지 있음 → dispatch
 *      → 비어 있음  → spin (5000회) → sleep(1ms)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SleepingQueuedHandler extends AbstractQueuedHandler {

    private static final Logger log = LoggerFactory.getLogger(SleepingQueuedHandler.class);

    private static final int SPIN_ITERATIONS = 5000;

    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile Thread thread;

    public SleepingQueuedHandler(String name, Handler<Message> consumer) {
        this(name, consumer, new QueuedHandlerConfig(), null);
    }

    public SleepingQueuedHandler(String name, Handler<Message> consumer, QueuedHandlerConfig config) {
        this(name, consumer, config, null);
    }

    public SleepingQueuedHandler(String name, Handler<Message> consumer, QueuedHandlerConfig config, QueueMonitor monitor) {
        super(name, consumer, config, new ConcurrentLinkedQueue<>(), monitor);
    }

    /**
     * 소비 스레드 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
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
    public void requestStop() {
        stopRequested = true;
    }

    /**
     * 중지 요청 후 소비 스레드 종료를 stopTimeout까지 대기합니다.
     *
     * @throws QueueStopTimeoutException 제한 시간 안에 멈추지 않은 경우
     */
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

    private void run() {
        log.debug("Queued handler '{}' started.", getName());
        int spins = 0;
        try {
            while (!stopRequested) {
                Message message = pollNext();
                if (message != null) {
                    spins = 0;
                    dispatch(message);
                    continue;
                }
                if (spins < SPIN_ITERATIONS) {
                    spins++;
                    Thread.onSpinWait();
                } else {
                    Thread.sleep(1);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            unregisterFromMonitor();
            stopped.countDown();
            log.debug("Queued handler '{}' stopped.", getName());
        }
    }
}
