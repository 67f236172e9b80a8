package com.ryuqq.eventflow.adapter.runner;

import com.ryuqq.eventflow.core.exception.QueueStopTimeoutException;
import com.ryuqq.eventflow.core.message.DelaySendEnvelope;
import com.ryuqq.eventflow.core.message.Message;
import com.ryuqq.eventflow.core.spi.Handler;
import com.ryuqq.eventflow.core.spi.Publisher;
import com.ryuqq.eventflow.core.time.TimePosition;
import com.ryuqq.eventflow.core.time.TimeSource;
import com.ryuqq.eventflow.core.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 지연 전송 스케줄러.
 *
 * <p>{@link DelaySendEnvelope}를 받아 지정 시각이 지나면 내부 메시지를 publisher로 보냅니다.</p>
 *
 * <p><strong>처리 흐름 (단일 백그라운드 스레드):</strong></p>
 * <pre>
 * loop
 *   1. 발송 시각이 지난 항목 모두 publish
 *   2. inbound 큐를 정렬 맵(발송 시각 → 메시지들)으로 이동
 *   3. 다음 발송 시각 또는 새 inbound 도착 중 먼저 오는 시점까지 대기
 * </pre>
 *
 * <p><strong>종료:</strong></p>
 * <ul>
 *   <li>{@link #stop(Duration)}: 제한 시간 안에 스레드가 끝나지 않으면 {@link QueueStopTimeoutException}</li>
 *   <li>{@link #close()}: 스레드를 멈추고 남은 예약을 발송하지 않고 버림</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class LaterService implements Handler<DelaySendEnvelope>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LaterService.class);

    private static final long IDLE_WAIT_MS = 1000;

    private final String name;
    private final Publisher publisher;
    private final TimeSource timeSource;
    private final Duration stopTimeout;

    private final ConcurrentLinkedQueue<DelaySendEnvelope> inbound = new ConcurrentLinkedQueue<>();
    private final TreeMap<TimePosition, List<Message>> scheduled = new TreeMap<>();
    private final Object signal = new Object();
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile boolean running;
    private volatile boolean wakeUp;
    private Thread thread;

    public LaterService(Publisher publisher, TimeSource timeSource) {
        this("later-service", publisher, timeSource, QueuedHandlerConfig.DEFAULT_STOP_TIMEOUT);
    }

    /**
     * 생성자.
     *
     * @param name 스레드 이름
     * @param publisher 발송 대상
     * @param timeSource 시계 (envelope 생성에 쓴 것과 같아야 함)
     * @param stopTimeout close() 시 대기 한도
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public LaterService(String name, Publisher publisher, TimeSource timeSource, Duration stopTimeout) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        if (stopTimeout == null || stopTimeout.isNegative() || stopTimeout.isZero()) {
            throw new IllegalArgumentException("stopTimeout must be positive (current: " + stopTimeout + ")");
        }
        this.name = name;
        this.publisher = publisher;
        this.timeSource = timeSource;
        this.stopTimeout = stopTimeout;
    }

    /**
     * 백그라운드 스레드 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException("Already started");
        }
        running = true;
        thread = new DaemonThreadFactory(name).newThread(this::run);
        thread.start();
    }

    /**
     * 예약 등록. 시작 전에 들어온 예약은 시작 후 처리됩니다.
     */
    @Override
    public void handle(DelaySendEnvelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        inbound.add(envelope);
        wake();
    }

    /**
     * @return 아직 발송되지 않은 예약 수
     */
    public int pendingCount() {
        int count = inbound.size();
        synchronized (scheduled) {
            for (List<Message> messages : scheduled.values()) {
                count += messages.size();
            }
        }
        return count;
    }

    public void stop(Duration timeout) {
        running = false;
        wake();
        Thread current = thread;
        if (current == null) {
            return;
        }
        try {
            if (!stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new QueueStopTimeoutException(name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueStopTimeoutException(name);
        }
    }

    @Override
    public void close() {
        try {
            stop(stopTimeout);
        } finally {
            inbound.clear();
            synchronized (scheduled) {
                scheduled.clear();
            }
        }
    }

    private void wake() {
        synchronized (signal) {
            wakeUp = true;
            signal.notifyAll();
        }
    }

    private void run() {
        log.debug("Later service '{}' started.", name);
        try {
            while (running) {
                publishDue(timeSource.now());
                drainInbound();
                waitForNext();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            stopped.countDown();
            log.debug("Later service '{}' stopped.", name);
        }
    }

    private void publishDue(TimePosition now) {
        while (running) {
            List<Message> due;
            synchronized (scheduled) {
                Map.Entry<TimePosition, List<Message>> first = scheduled.firstEntry();
                if (first == null || first.getKey().compareTo(now) > 0) {
                    return;
                }
                due = scheduled.pollFirstEntry().getValue();
            }
            for (Message message : due) {
                try {
                    publisher.publish(message);
                } catch (RuntimeException e) {
                    log.error("Error while publishing delayed message {} from '{}'.",
                        message.getClass().getSimpleName(), name, e);
                }
            }
        }
    }

    private void drainInbound() {
        DelaySendEnvelope envelope;
        while ((envelope = inbound.poll()) != null) {
            synchronized (scheduled) {
                scheduled.computeIfAbsent(envelope.getAt(), at -> new ArrayList<>()).add(envelope.getToSend());
            }
        }
    }

    private void waitForNext() throws InterruptedException {
        long waitMs;
        synchronized (scheduled) {
            if (scheduled.isEmpty()) {
                waitMs = IDLE_WAIT_MS;
            } else {
                long distance = timeSource.now().distanceUntil(scheduled.firstKey()).toMillis();
                waitMs = Math.max(0, distance);
            }
        }
        if (waitMs == 0) {
            return;
        }
        synchronized (signal) {
            if (!wakeUp && running) {
                signal.wait(waitMs);
            }
            wakeUp = false;
        }
    }
}
