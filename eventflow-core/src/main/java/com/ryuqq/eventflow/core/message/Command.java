package com.ryuqq.eventflow.core.message;

import com.ryuqq.eventflow.core.exception.CommandCanceledException;

import java.util.UUID;

/**
 * 상태 변경 요청 메시지.
 *
 * <p>Command는 정확히 하나의 핸들러에 의해 처리되어야 하며, Dispatcher가
 * ack/완료 신호로 끝까지 추적합니다.</p>
 *
 * <p><strong>취소:</strong></p>
 * <ul>
 *   <li>{@link CancellationToken}이 주어진 경우에만 취소 가능 ({@link #isCancelable()})</li>
 *   <li>제출 시점과 핸들러 실행 직전에 {@link #isCanceled()}를 확인</li>
 * </ul>
 *
 * <p><strong>응답 팩토리:</strong> {@link #succeed()}, {@link #fail(Throwable)}, {@link #canceled()}</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class Command extends Message implements CorrelatedMessage {

    private final UUID correlationId;
    private final UUID causationId;
    private final CancellationToken cancellationToken;

    protected Command() {
        this((CancellationToken) null);
    }

    protected Command(CancellationToken cancellationToken) {
        this.correlationId = getMsgId();
        this.causationId = null;
        this.cancellationToken = cancellationToken;
    }

    protected Command(Message source) {
        this(source, null);
    }

    /**
     * source 메시지에 의해 발생한 Command 생성.
     *
     * @param source 원인 메시지
     * @param cancellationToken 취소 토큰 (null 가능)
     * @throws IllegalArgumentException source가 null인 경우
     */
    protected Command(Message source, CancellationToken cancellationToken) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        this.correlationId = CorrelatedMessage.correlationOf(source);
        this.causationId = source.getMsgId();
        this.cancellationToken = cancellationToken;
    }

    @Override
    public UUID getCorrelationId() {
        return correlationId;
    }

    @Override
    public UUID getCausationId() {
        return causationId;
    }

    public boolean isCancelable() {
        return cancellationToken != null;
    }

    public boolean isCanceled() {
        return cancellationToken != null && cancellationToken.isCancellationRequested();
    }

    public Success succeed() {
        return new Success(this);
    }

    public Fail fail(Throwable exception) {
        return new Fail(this, exception);
    }

    public Canceled canceled() {
        return new Canceled(this, new CommandCanceledException(this));
    }
}
