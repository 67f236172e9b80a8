package com.ryuqq.eventflow.core.exception;

import java.util.concurrent.TimeoutException;

/**
 * 큐 소비 스레드가 제한 시간 안에 멈추지 않음.
 *
 * <p>원인으로 {@link TimeoutException}을 담습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class QueueStopTimeoutException extends RuntimeException {

    public QueueStopTimeoutException(String name) {
        super("Unable to stop thread '" + name + "'.", new TimeoutException("Unable to stop thread '" + name + "'."));
    }
}
