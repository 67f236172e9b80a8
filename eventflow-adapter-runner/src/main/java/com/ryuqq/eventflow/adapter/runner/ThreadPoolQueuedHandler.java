package com.ryuqq.eventflow.adapter.runner;

import com.ryuqq.eventflow.core.exception.QueueStopTimeoutException;
import com.ryuqq.eventflow.core.message.Message;
import com.ryuqq.eventflow.core.spi.Handler;

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 공유 스레드 풀에서 큐를 소비하는 QueuedHandler.
 *
 * <p>큐가 idle → non-idle로 바뀔 때만 풀에 작업을 하나 제출합니다. 작업은 큐가 빌 때까지
 * 처리한 뒤 실행 플래그를 내리고, 그 사이 새 메시지가 들어왔는지 다시 확인합니다.</p>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>CAS(isRunning)로 풀 작업의 중복 제출 방지</li>
 *   <li>한 시점에 최대 하나의 작업만 consumer를 호출 (FIFO 유지)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ThreadPoolQueuedHandler extends AbstractQueuedHandler {

    private static final long STOP_POLL_INTERVAL_MS = 1;

    private final Executor executor;
    private final AtomicBoolean isRunning = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);

    public ThreadPoolQueuedHandler(String name, Handler<Message> consumer) {
        this(name, consumer, new QueuedHandlerConfig(), ForkJoinPool.commonPool(), null);
    }

    /**
     * 생성자.
     *
     * @param name 큐 이름
     * @param consumer 최종 핸들러
     * @param config 설정
     * @param executor 작업을 실행할 풀
     * @param monitor 큐 모니터 (null 가능)
     * @throws IllegalArgumentException executor가 null인 경우
     */
    public ThreadPoolQueuedHandler(
        String name,
        Handler<Message> consumer,
        QueuedHandlerConfig config,
        Executor executor,
        QueueMonitor monitor
    ) {
        super(name, consumer, config, new ConcurrentLinkedQueue<>(), monitor);
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.executor = executor;
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Already a thread running.");
        }
        registerWithMonitor();
        schedule();
    }

    @Override
    protected void onEnqueued() {
        if (started.get()) {
            schedule();
        }
    }

    private void schedule() {
        if (!stopRequested && !queue.isEmpty() && isRunning.compareAndSet(false, true)) {
            executor.execute(this::drain);
        }
    }

    private void drain() {
        boolean proceed = true;
        while (proceed) {
            Message message;
            while (!stopRequested && (message = pollNext()) != null) {
                dispatch(message);
            }
            isRunning.set(false);
            proceed = !stopRequested && !queue.isEmpty() && isRunning.compareAndSet(false, true);
        }
    }

    @Override
    public boolean isIdle() {
        return !isRunning.get() && super.isIdle();
    }

    @Override
    public void requestStop() {
        stopRequested = true;
    }

    /**
     * @throws QueueStopTimeoutException 진행 중인 작업이 stopTimeout 안에 끝나지 않은 경우
     */
    @Override
    public void stop() {
        requestStop();
        long deadline = System.nanoTime() + getConfig().stopTimeout().toNanos();
        try {
            while (isRunning.get()) {
                if (System.nanoTime() - deadline > 0) {
                    throw new QueueStopTimeoutException(getName());
                }
                Thread.sleep(STOP_POLL_INTERVAL_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueStopTimeoutException(getName());
        } finally {
            if (!isRunning.get()) {
                unregisterFromMonitor();
            }
        }
    }
}
