package com.ryuqq.eventflow.core.exception;

/**
 * 같은 Command 타입에 두 번째 핸들러를 등록하려는 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ExistingHandlerException extends RuntimeException {

    public ExistingHandlerException(String message) {
        super(message);
    }
}
