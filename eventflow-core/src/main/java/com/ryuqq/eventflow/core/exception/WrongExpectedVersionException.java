package com.ryuqq.eventflow.core.exception;

/**
 * 낙관적 동시성 위반 (expectedVersion 불일치).
 *
 * <p>재시도하지 않습니다. 호출자가 다시 로드한 뒤 변경을 재적용해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class WrongExpectedVersionException extends StreamStoreException {

    public WrongExpectedVersionException(String message) {
        super(message);
    }
}
