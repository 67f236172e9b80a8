package com.ryuqq.eventflow.core.util;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 이름 붙은 데몬 스레드 팩토리.
 *
 * <p>스레드 이름은 {@code <prefix>-1}, {@code <prefix>-2} ... 형식이며, 데몬 스레드라
 * JVM 종료를 막지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DaemonThreadFactory implements ThreadFactory {

    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger(1);

    public DaemonThreadFactory(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + "-" + counter.getAndIncrement());
        thread.setDaemon(true);
        return thread;
    }
}
