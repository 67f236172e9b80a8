package com.ryuqq.eventflow.adapter.runner;

import com.ryuqq.eventflow.core.spi.MonitoredQueue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * 등록된 큐의 상태를 조회하는 모니터.
 *
 * <p>전역 싱글톤이 아니라 소유자가 생성해 큐에 넘겨주는 인스턴스입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class QueueMonitor {

    private final CopyOnWriteArraySet<MonitoredQueue> queues = new CopyOnWriteArraySet<>();

    public void register(MonitoredQueue queue) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        queues.add(queue);
    }

    public void unregister(MonitoredQueue queue) {
        queues.remove(queue);
    }

    /**
     * @return 이름순으로 정렬된 등록 큐 상태 목록
     */
    public List<QueueStats> snapshot() {
        List<QueueStats> stats = new ArrayList<>();
        for (MonitoredQueue queue : queues) {
            stats.add(new QueueStats(queue.getName(), queue.messageCount(), queue.isIdle(), queue.processedCount()));
        }
        stats.sort(Comparator.comparing(QueueStats::name));
        return stats;
    }

    /**
     * @return 모든 등록 큐가 idle이면 true
     */
    public boolean allIdle() {
        for (MonitoredQueue queue : queues) {
            if (!queue.isIdle()) {
                return false;
            }
        }
        return true;
    }
}
