package com.ryuqq.eventflow.application.command;

import com.ryuqq.eventflow.core.exception.CommandNotHandledException;
import com.ryuqq.eventflow.core.exception.CommandOversubscribedException;
import com.ryuqq.eventflow.core.exception.CommandTimedOutException;
import com.ryuqq.eventflow.core.message.AckCommand;
import com.ryuqq.eventflow.core.message.AckTimeout;
import com.ryuqq.eventflow.core.message.Command;
import com.ryuqq.eventflow.core.message.CommandResponse;
import com.ryuqq.eventflow.core.message.CompletionTimeout;
import com.ryuqq.eventflow.core.message.DelaySendEnvelope;
import com.ryuqq.eventflow.core.spi.Publisher;
import com.ryuqq.eventflow.core.statemachine.CommandState;
import com.ryuqq.eventflow.core.statemachine.StateTransition;
import com.ryuqq.eventflow.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Command 하나의 Ack/완료 추적기.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * PENDING_ACK ──Ack──► PENDING_RESPONSE ──응답──► COMPLETE
 *      │                      │
 *      ├── 응답 ──────────────┼────────────────► COMPLETE
 *      └── AckTimeout         └── CompletionTimeout / 두 번째 Ack
 * </pre>
 *
 * <p><strong>결과 확정 규칙:</strong></p>
 * <ul>
 *   <li>결과 future는 정확히 한 번만 완료됩니다. 이후 신호는 무시됩니다.</li>
 *   <li>오류는 예외가 아니라 {@code Fail} 응답으로 future에 담깁니다.</li>
 *   <li>Ack는 처음 하나만 PENDING_RESPONSE로 전이시키고, 그 이후 Ack는 모두 oversubscription입니다.</li>
 *   <li>타임아웃/oversubscription으로 확정되면 cancelAction, 응답으로 확정되면 completionAction을 실행합니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CommandTracker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CommandTracker.class);

    static final String NOT_HANDLED_MESSAGE =
        " timed out waiting for a handler to start. Make sure a command handler is subscribed";
    static final String TIMED_OUT_MESSAGE = " timed out waiting for handler to complete.";
    static final String OVERSUBSCRIBED_MESSAGE = " multiple handlers responded to the command";

    private final Command command;
    private final CompletableFuture<CommandResponse> result;
    private final Runnable completionAction;
    private final Runnable cancelAction;
    private final AtomicReference<CommandState> state = new AtomicReference<>(CommandState.PENDING_ACK);
    private final AtomicInteger ackCount = new AtomicInteger();

    /**
     * 생성자.
     *
     * @param command 추적할 Command
     * @param result 결과를 받을 future
     * @param completionAction 응답으로 확정된 뒤 실행
     * @param cancelAction 타임아웃/oversubscription으로 확정된 뒤 실행
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CommandTracker(
        Command command,
        CompletableFuture<CommandResponse> result,
        Runnable completionAction,
        Runnable cancelAction
    ) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (completionAction == null) {
            throw new IllegalArgumentException("completionAction cannot be null");
        }
        if (cancelAction == null) {
            throw new IllegalArgumentException("cancelAction cannot be null");
        }
        this.command = command;
        this.result = result;
        this.completionAction = completionAction;
        this.cancelAction = cancelAction;
    }

    /**
     * Ack/완료 타임아웃 신호를 지연 전송으로 예약합니다.
     *
     * @param timeoutPublisher DelaySendEnvelope를 받을 publisher (LaterService로 연결)
     * @param timeSource LaterService와 같은 시계
     */
    public void scheduleTimeouts(
        Publisher timeoutPublisher,
        TimeSource timeSource,
        Duration ackTimeout,
        Duration completionTimeout
    ) {
        timeoutPublisher.publish(new DelaySendEnvelope(timeSource, ackTimeout, new AckTimeout(command.getMsgId())));
        timeoutPublisher.publish(
            new DelaySendEnvelope(timeSource, completionTimeout, new CompletionTimeout(command.getMsgId())));
    }

    public void handleResponse(CommandResponse response) {
        state.set(CommandState.COMPLETE);
        if (result.complete(response)) {
            completionAction.run();
        }
    }

    public void handleAck(AckCommand ack) {
        ackCount.incrementAndGet();
        CommandState current = state.get();
        if (StateTransition.isAllowed(current, CommandState.PENDING_RESPONSE)
            && state.compareAndSet(current, CommandState.PENDING_RESPONSE)) {
            return;
        }
        if (failWith(new CommandOversubscribedException(OVERSUBSCRIBED_MESSAGE, command))) {
            log.error("{} Multiple Handlers Acked Command", command.getClass().getSimpleName());
        }
    }

    public void handleAckTimeout(AckTimeout timeout) {
        if (state.get() != CommandState.PENDING_ACK) {
            return;
        }
        if (failWith(new CommandNotHandledException(NOT_HANDLED_MESSAGE, command))) {
            log.error("{} command not handled (no handler)", command.getClass().getSimpleName());
        }
    }

    public void handleCompletionTimeout(CompletionTimeout timeout) {
        if (state.get() != CommandState.PENDING_RESPONSE) {
            return;
        }
        if (failWith(new CommandTimedOutException(TIMED_OUT_MESSAGE, command))) {
            log.error("{} command timed out", command.getClass().getSimpleName());
        }
    }

    private boolean failWith(RuntimeException exception) {
        state.set(CommandState.COMPLETE);
        if (result.complete(command.fail(exception))) {
            cancelAction.run();
            return true;
        }
        return false;
    }

    public Command getCommand() {
        return command;
    }

    public CommandState getState() {
        return state.get();
    }

    public int getAckCount() {
        return ackCount.get();
    }

    public boolean isDone() {
        return result.isDone();
    }

    /**
     * 아직 확정되지 않았다면 Canceled 응답으로 확정합니다. 어떤 action도 실행하지 않습니다.
     */
    @Override
    public void close() {
        state.set(CommandState.COMPLETE);
        result.complete(command.canceled());
    }

    @Override
    public String toString() {
        return "CommandTracker{command=" + command.getClass().getSimpleName()
            + ", id=" + command.getMsgId() + ", state=" + state.get() + "}";
    }
}
