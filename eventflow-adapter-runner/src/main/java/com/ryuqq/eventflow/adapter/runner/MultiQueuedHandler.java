package com.ryuqq.eventflow.adapter.runner;

import com.ryuqq.eventflow.core.exception.QueueStopTimeoutException;
import com.ryuqq.eventflow.core.message.Message;
import com.ryuqq.eventflow.core.message.QueueAffineMessage;
import com.ryuqq.eventflow.core.spi.Handler;
import com.ryuqq.eventflow.core.spi.QueuedHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;
import java.util.function.ToIntFunction;

/**
 * 고정 개수의 QueuedHandler로 메시지를 분배하는 파티션 큐.
 *
 * <p><strong>라우팅:</strong></p>
 * <ul>
 *   <li>{@link QueueAffineMessage}: {@code floorMod(queueId, N)} 번째 큐</li>
 *   <li>그 외: {@code floorMod(queueHash(message), N)} 번째 큐 (기본 해시는 라운드로빈)</li>
 * </ul>
 *
 * <p>같은 큐에 들어간 메시지끼리만 순서가 보장됩니다. 키 단위 순서가 필요하면
 * {@link QueueAffineMessage}를 구현하거나 키 기반 해시를 넘겨야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MultiQueuedHandler implements QueuedHandler {

    private final String name;
    private final List<QueuedHandler> queues;
    private final ToIntFunction<Message> queueHash;
    private final AtomicInteger nextQueue = new AtomicInteger();

    /**
     * SleepingQueuedHandler N개로 구성.
     *
     * @param name 이름 (각 큐는 name-0, name-1 ...)
     * @param queueCount 큐 개수 (1 이상)
     * @param consumer 모든 큐가 공유하는 최종 핸들러
     * @param config 큐 설정
     * @param monitor 큐 모니터 (null 가능)
     */
    public MultiQueuedHandler(
        String name,
        int queueCount,
        Handler<Message> consumer,
        QueuedHandlerConfig config,
        QueueMonitor monitor
    ) {
        this(name, queueCount, i -> new SleepingQueuedHandler(name + "-" + i, consumer, config, monitor), null);
    }

    /**
     * 생성자.
     *
     * @param name 이름
     * @param queueCount 큐 개수 (1 이상)
     * @param queueFactory 큐 인덱스를 받아 큐를 만드는 팩토리
     * @param queueHash 라우팅 해시 (null이면 라운드로빈)
     * @throws IllegalArgumentException 인자 검증 실패 시
     */
    public MultiQueuedHandler(
        String name,
        int queueCount,
        IntFunction<QueuedHandler> queueFactory,
        ToIntFunction<Message> queueHash
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (queueCount <= 0) {
            throw new IllegalArgumentException("queueCount must be positive (current: " + queueCount + ")");
        }
        if (queueFactory == null) {
            throw new IllegalArgumentException("queueFactory cannot be null");
        }
        this.name = name;
        List<QueuedHandler> created = new ArrayList<>(queueCount);
        for (int i = 0; i < queueCount; i++) {
            QueuedHandler queue = queueFactory.apply(i);
            if (queue == null) {
                throw new IllegalArgumentException("queueFactory returned null for queue " + i);
            }
            created.add(queue);
        }
        this.queues = List.copyOf(created);
        this.queueHash = queueHash != null ? queueHash : message -> nextQueue.getAndIncrement();
    }

    @Override
    public String getName() {
        return name;
    }

    public int queueCount() {
        return queues.size();
    }

    @Override
    public void start() {
        queues.forEach(QueuedHandler::start);
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
        queues.get(queueIndexOf(message)).publish(message);
    }

    /**
     * 모든 큐에 같은 메시지를 넣습니다 (제어 메시지용).
     */
    public void publishToAll(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        for (QueuedHandler queue : queues) {
            queue.publish(message);
        }
    }

    int queueIndexOf(Message message) {
        int hash = message instanceof QueueAffineMessage affine
            ? affine.queueId()
            : queueHash.applyAsInt(message);
        return Math.floorMod(hash, queues.size());
    }

    @Override
    public int messageCount() {
        int total = 0;
        for (QueuedHandler queue : queues) {
            total += queue.messageCount();
        }
        return total;
    }

    @Override
    public boolean isIdle() {
        for (QueuedHandler queue : queues) {
            if (!queue.isIdle()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public long processedCount() {
        long total = 0;
        for (QueuedHandler queue : queues) {
            total += queue.processedCount();
        }
        return total;
    }

    @Override
    public void requestStop() {
        queues.forEach(QueuedHandler::requestStop);
    }

    /**
     * 모든 큐에 먼저 중지를 알린 뒤 각각의 종료를 기다립니다.
     *
     * @throws QueueStopTimeoutException 하나라도 제한 시간 안에 멈추지 않은 경우 (나머지도 모두 대기한 뒤)
     */
    @Override
    public void stop() {
        requestStop();
        QueueStopTimeoutException failure = null;
        for (QueuedHandler queue : queues) {
            try {
                queue.stop();
            } catch (QueueStopTimeoutException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public String toString() {
        return "MultiQueuedHandler{name=" + name + ", queues=" + queues.size() + "}";
    }
}
