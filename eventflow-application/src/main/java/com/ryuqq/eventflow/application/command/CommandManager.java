package com.ryuqq.eventflow.application.command;

import com.ryuqq.eventflow.adapter.runner.QueueMonitor;
import com.ryuqq.eventflow.adapter.runner.QueuedHandlerConfig;
import com.ryuqq.eventflow.adapter.runner.QueuedSubscriber;
import com.ryuqq.eventflow.core.exception.CommandException;
import com.ryuqq.eventflow.core.message.AckCommand;
import com.ryuqq.eventflow.core.message.AckTimeout;
import com.ryuqq.eventflow.core.message.Command;
import com.ryuqq.eventflow.core.message.CommandResponse;
import com.ryuqq.eventflow.core.message.CommandTimeout;
import com.ryuqq.eventflow.core.message.CompletionTimeout;
import com.ryuqq.eventflow.core.spi.Publisher;
import com.ryuqq.eventflow.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 진행 중인 Command들의 추적기 저장소.
 *
 * <p>{@link QueuedSubscriber}를 상속하므로 Ack/응답/타임아웃 신호는 모두 하나의 큐 스레드에서
 * 순서대로 처리됩니다. 외부 버스에서 {@link AckCommand}, {@link CommandResponse},
 * {@link AckTimeout}, {@link CompletionTimeout}을 이 객체로 연결해야 합니다.</p>
 *
 * <p><strong>등록 흐름:</strong></p>
 * <ol>
 *   <li>{@link #registerCommand}로 추적기 생성 및 저장 (Command msgId 기준)</li>
 *   <li>저장에 성공한 뒤 두 타임아웃을 LaterService로 예약</li>
 *   <li>결과가 확정되면 추적기 제거 (타임아웃/oversubscription이면 Canceled 응답도 publish)</li>
 * </ol>
 *
 * <p><strong>종료:</strong> {@link #close()}는 큐를 먼저 멈춘 뒤 남은 추적기를 모두 Canceled로 확정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CommandManager extends QueuedSubscriber {

    private static final Logger log = LoggerFactory.getLogger(CommandManager.class);

    private final Publisher outBus;
    private final Publisher timeoutBus;
    private final TimeSource timeSource;
    private final Map<UUID, CommandTracker> pendingCommands = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public CommandManager(Publisher outBus, Publisher timeoutBus, TimeSource timeSource) {
        this("command-manager", outBus, timeoutBus, timeSource, new QueuedHandlerConfig(), null);
    }

    /**
     * 생성자.
     *
     * @param name 내부 큐 이름
     * @param outBus 타임아웃 시 Canceled 응답을 publish 할 버스
     * @param timeoutBus DelaySendEnvelope를 받을 버스
     * @param timeSource LaterService와 같은 시계
     * @param config 내부 큐 설정
     * @param monitor 큐 모니터 (null 가능)
     * @throws IllegalArgumentException 필수 인자가 null인 경우
     */
    public CommandManager(
        String name,
        Publisher outBus,
        Publisher timeoutBus,
        TimeSource timeSource,
        QueuedHandlerConfig config,
        QueueMonitor monitor
    ) {
        super(name, config, monitor);
        if (outBus == null) {
            throw new IllegalArgumentException("outBus cannot be null");
        }
        if (timeoutBus == null) {
            throw new IllegalArgumentException("timeoutBus cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.outBus = outBus;
        this.timeoutBus = timeoutBus;
        this.timeSource = timeSource;
        subscribe(CommandResponse.class, this::onResponse);
        subscribe(AckCommand.class, this::onAck);
        subscribe(AckTimeout.class, this::onAckTimeout);
        subscribe(CompletionTimeout.class, this::onCompletionTimeout);
    }

    /**
     * Command 추적을 시작합니다.
     *
     * @param command 추적할 Command
     * @param ackTimeout Ack 대기 시간
     * @param responseTimeout 완료 대기 시간
     * @return 결과 future (오류도 Fail 응답으로 완료됨)
     * @throws IllegalStateException 이미 닫힌 경우
     * @throws CommandException 같은 msgId의 Command가 이미 추적 중인 경우
     */
    public CompletableFuture<CommandResponse> registerCommand(
        Command command,
        Duration ackTimeout,
        Duration responseTimeout
    ) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (closed.get()) {
            throw new IllegalStateException("CommandManager is closed");
        }
        log.debug("Registering command tracker for {}", command.getClass().getSimpleName());

        UUID commandId = command.getMsgId();
        CompletableFuture<CommandResponse> result = new CompletableFuture<>();
        CommandTracker tracker = new CommandTracker(
            command,
            result,
            () -> pendingCommands.remove(commandId),
            () -> {
                outBus.publish(command.canceled());
                pendingCommands.remove(commandId);
            }
        );
        if (pendingCommands.putIfAbsent(commandId, tracker) != null) {
            throw new CommandException(
                "Command tracker already registered for this Command Id " + commandId + ".", command);
        }
        // 호출자가 publish 실패 등으로 직접 완료시킨 경우에도 추적기를 남기지 않는다
        result.whenComplete((response, error) -> pendingCommands.remove(commandId, tracker));
        tracker.scheduleTimeouts(timeoutBus, timeSource, ackTimeout, responseTimeout);
        return result;
    }

    /**
     * @return 결과가 확정되지 않은 추적기 수
     */
    public int pendingCount() {
        return pendingCommands.size();
    }

    private void onResponse(CommandResponse response) {
        CommandTracker tracker = pendingCommands.get(response.getCommandId());
        if (tracker != null) {
            tracker.handleResponse(response);
        }
    }

    private void onAck(AckCommand ack) {
        CommandTracker tracker = pendingCommands.get(ack.getCommandId());
        if (tracker != null) {
            tracker.handleAck(ack);
        }
    }

    private void onAckTimeout(AckTimeout timeout) {
        CommandTracker tracker = trackerFor(timeout);
        if (tracker != null) {
            tracker.handleAckTimeout(timeout);
        }
    }

    private void onCompletionTimeout(CompletionTimeout timeout) {
        CommandTracker tracker = trackerFor(timeout);
        if (tracker != null) {
            tracker.handleCompletionTimeout(timeout);
        }
    }

    private CommandTracker trackerFor(CommandTimeout timeout) {
        return pendingCommands.get(timeout.getCommandId());
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            super.close();
        } finally {
            List<CommandTracker> trackers = new ArrayList<>(pendingCommands.values());
            pendingCommands.clear();
            for (CommandTracker tracker : trackers) {
                tracker.close();
            }
        }
    }
}
