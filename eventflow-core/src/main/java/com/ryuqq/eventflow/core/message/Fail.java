package com.ryuqq.eventflow.core.message;

/**
 * Command 실패 응답.
 *
 * <p>실패 원인 예외를 담고 있습니다. 예외는 스레드 경계를 넘어 던져지지 않고
 * 이 응답으로 전달된 뒤, 블로킹 호출 지점({@code send})에서 다시 던져집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed class Fail extends CommandResponse permits Canceled {

    private final Throwable exception;

    /**
     * @param sourceCommand 원본 Command
     * @param exception 실패 원인 (null 가능)
     */
    public Fail(Command sourceCommand, Throwable exception) {
        super(sourceCommand);
        this.exception = exception;
    }

    public Throwable getException() {
        return exception;
    }
}
