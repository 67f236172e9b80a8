package com.ryuqq.eventflow.application.command;

import com.ryuqq.eventflow.adapter.inmemory.bus.InMemoryBus;
import com.ryuqq.eventflow.adapter.runner.LaterService;
import com.ryuqq.eventflow.adapter.runner.MultiQueuedHandler;
import com.ryuqq.eventflow.adapter.runner.QueueMonitor;
import com.ryuqq.eventflow.core.exception.CommandCanceledException;
import com.ryuqq.eventflow.core.exception.CommandException;
import com.ryuqq.eventflow.core.exception.ExistingHandlerException;
import com.ryuqq.eventflow.core.message.AckCommand;
import com.ryuqq.eventflow.core.message.AckTimeout;
import com.ryuqq.eventflow.core.message.Command;
import com.ryuqq.eventflow.core.message.CommandResponse;
import com.ryuqq.eventflow.core.message.CompletionTimeout;
import com.ryuqq.eventflow.core.message.DelaySendEnvelope;
import com.ryuqq.eventflow.core.message.Fail;
import com.ryuqq.eventflow.core.message.Message;
import com.ryuqq.eventflow.core.spi.CommandHandler;
import com.ryuqq.eventflow.core.spi.Dispatcher;
import com.ryuqq.eventflow.core.spi.Handler;
import com.ryuqq.eventflow.core.spi.Subscription;
import com.ryuqq.eventflow.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 큐 기반 {@link Dispatcher} 구현체.
 *
 * <p><strong>구성:</strong></p>
 * <pre>
 * publish / send ─► MultiQueuedHandler (queueCount개 파티션) ─► InMemoryBus ─► 구독 핸들러
 *                                                               │
 *                      AckCommand / CommandResponse ◄───────────┘
 *                                 │
 *                                 ▼
 *                          CommandManager ◄── AckTimeout / CompletionTimeout ── LaterService
 * </pre>
 *
 * <p>queueCount가 0이면 파티션 큐 없이 호출 스레드에서 버스로 바로 publish 합니다.</p>
 *
 * <p><strong>Command 전송 방식:</strong></p>
 * <ul>
 *   <li>{@link #send}: 결과가 확정될 때까지 대기, 성공이 아니면 {@link CommandException}</li>
 *   <li>{@link #trySend}: 결과가 확정될 때까지 대기, 예외 없이 응답 반환</li>
 *   <li>{@link #trySendAsync}: 추적을 등록하고 publish 한 뒤 바로 반환</li>
 * </ul>
 *
 * <p>제출 시점에 이미 취소된 Command는 추적 없이 Canceled 응답만 publish 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class QueuedDispatcher implements Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(QueuedDispatcher.class);

    static final String DUPLICATE_REGISTRATION = "Duplicate registration for command type.";

    private final String name;
    private final DispatcherConfig config;
    private final InMemoryBus bus;
    private final InMemoryBus timeoutBus;
    private final LaterService laterService;
    private final CommandManager manager;
    private final MultiQueuedHandler publishQueue;
    private final Map<Class<?>, CommandHandlerAdapter<?>> commandHandlers = new HashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public QueuedDispatcher(String name) {
        this(name, new DispatcherConfig());
    }

    public QueuedDispatcher(String name, DispatcherConfig config) {
        this(name, config, TimeSource.system(), null);
    }

    /**
     * 생성자. 내부 큐, LaterService, CommandManager를 모두 시작합니다.
     *
     * @param name 이름 (내부 버스와 큐 이름의 접두어)
     * @param config 설정
     * @param timeSource 타임아웃 계산용 시계
     * @param monitor 큐 모니터 (null 가능)
     * @throws IllegalArgumentException 필수 인자가 null인 경우
     */
    public QueuedDispatcher(String name, DispatcherConfig config, TimeSource timeSource, QueueMonitor monitor) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.name = name;
        this.config = config;
        this.bus = new InMemoryBus(name, config.busConfig());
        this.timeoutBus = new InMemoryBus(name + "-timeouts", config.busConfig().withWatchSlowMsg(false));

        this.laterService = new LaterService(
            name + "-later", timeoutBus, timeSource, config.queueConfig().stopTimeout());
        timeoutBus.subscribe(DelaySendEnvelope.class, laterService);
        laterService.start();

        this.manager = new CommandManager(
            name + "-commands", bus, timeoutBus, timeSource, config.queueConfig(), monitor);
        timeoutBus.subscribe(AckTimeout.class, manager);
        timeoutBus.subscribe(CompletionTimeout.class, manager);
        bus.subscribe(AckCommand.class, manager);
        bus.subscribe(CommandResponse.class, manager);

        if (config.queueCount() > 0) {
            this.publishQueue = new MultiQueuedHandler(
                name, config.queueCount(), bus::publish, config.queueConfig(), monitor);
            publishQueue.start();
        } else {
            this.publishQueue = null;
        }
    }

    @Override
    public String getName() {
        return name;
    }

    public DispatcherConfig getConfig() {
        return config;
    }

    /**
     * @return publish 큐가 모두 비어 있으면 true (큐가 없으면 항상 true)
     */
    public boolean isIdle() {
        return publishQueue == null || publishQueue.isIdle();
    }

    // ============================================================
    // Publish / Subscribe
    // ============================================================

    @Override
    public void publish(Message message) {
        if (publishQueue == null) {
            bus.publish(message);
        } else {
            publishQueue.publish(message);
        }
    }

    @Override
    public <T extends Message> Subscription subscribe(Class<T> type, Handler<? super T> handler, boolean includeDerived) {
        return bus.subscribe(type, handler, includeDerived);
    }

    @Override
    public <T extends Message> void unsubscribe(Class<T> type, Handler<? super T> handler) {
        bus.unsubscribe(type, handler);
    }

    @Override
    public boolean hasSubscriberFor(Class<? extends Message> type, boolean includeDerived) {
        return bus.hasSubscriberFor(type, includeDerived);
    }

    /**
     * @throws ExistingHandlerException 같은 Command 타입에 핸들러가 이미 등록된 경우
     */
    @Override
    public <T extends Command> Subscription subscribeCommandHandler(Class<T> type, CommandHandler<T> handler) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        CommandHandlerAdapter<T> adapter = new CommandHandlerAdapter<>(bus, handler);
        synchronized (commandHandlers) {
            if (commandHandlers.containsKey(type)) {
                throw new ExistingHandlerException(DUPLICATE_REGISTRATION);
            }
            commandHandlers.put(type, adapter);
        }
        bus.subscribe(type, adapter, false);
        AtomicBoolean unsubscribed = new AtomicBoolean(false);
        return () -> {
            if (unsubscribed.compareAndSet(false, true)) {
                unsubscribeCommandHandler(type, handler);
            }
        };
    }

    @Override
    public <T extends Command> void unsubscribeCommandHandler(Class<T> type, CommandHandler<T> handler) {
        CommandHandlerAdapter<?> adapter;
        synchronized (commandHandlers) {
            adapter = commandHandlers.get(type);
            if (adapter == null || adapter.getHandler() != handler) {
                return;
            }
            commandHandlers.remove(type);
        }
        @SuppressWarnings("unchecked")
        CommandHandlerAdapter<T> typed = (CommandHandlerAdapter<T>) adapter;
        bus.unsubscribe(type, typed);
    }

    // ============================================================
    // Commands
    // ============================================================

    @Override
    public void send(Command command, String exceptionMsg, Duration responseTimeout, Duration ackTimeout) {
        requireCommand(command);
        if (command.isCanceled()) {
            publish(command.canceled());
            throw new CommandCanceledException(command);
        }
        CommandResponse response = await(command, execute(command, responseTimeout, ackTimeout));
        if (response.isSuccess()) {
            return;
        }
        Throwable cause = ((Fail) response).getException();
        if (exceptionMsg == null && cause instanceof CommandException commandException) {
            throw commandException;
        }
        if (cause != null) {
            throw new CommandException(exceptionMsg != null ? exceptionMsg : cause.getMessage(), command, cause);
        }
        throw new CommandException(exceptionMsg != null ? exceptionMsg : "Failed", command);
    }

    @Override
    public CommandResponse trySend(Command command, Duration responseTimeout, Duration ackTimeout) {
        requireCommand(command);
        if (command.isCanceled()) {
            CommandResponse canceled = command.canceled();
            publish(canceled);
            return canceled;
        }
        try {
            return await(command, execute(command, responseTimeout, ackTimeout));
        } catch (RuntimeException e) {
            return command.fail(e);
        }
    }

    @Override
    public boolean trySendAsync(Command command, Duration responseTimeout, Duration ackTimeout) {
        requireCommand(command);
        if (command.isCanceled()) {
            publish(command.canceled());
            return false;
        }
        try {
            execute(command, responseTimeout, ackTimeout);
            return true;
        } catch (RuntimeException e) {
            log.warn("Unable to send command {} on '{}'.", command.getClass().getSimpleName(), name, e);
            return false;
        }
    }

    /**
     * 추적을 등록하고 Command를 publish 합니다. 결과는 CommandManager가 비동기로 채웁니다.
     */
    private CompletableFuture<CommandResponse> execute(Command command, Duration responseTimeout, Duration ackTimeout) {
        CompletableFuture<CommandResponse> pending = manager.registerCommand(
            command,
            ackTimeout != null ? ackTimeout : config.ackTimeout(),
            responseTimeout != null ? responseTimeout : config.responseTimeout()
        );
        try {
            publish(command);
        } catch (RuntimeException e) {
            pending.complete(command.fail(e));
            throw e;
        }
        return pending;
    }

    private static CommandResponse await(Command command, CompletableFuture<CommandResponse> pending) {
        try {
            return pending.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return command.fail(e);
        } catch (ExecutionException e) {
            return command.fail(e.getCause());
        }
    }

    private static void requireCommand(Command command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
    }

    /**
     * 파티션 큐, LaterService, CommandManager 순서로 멈춥니다. 남은 추적은 Canceled로 확정됩니다.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (publishQueue != null) {
                publishQueue.stop();
            }
        } finally {
            try {
                laterService.close();
            } finally {
                try {
                    manager.close();
                } finally {
                    timeoutBus.close();
                    bus.close();
                }
            }
        }
    }

    @Override
    public String toString() {
        return "QueuedDispatcher{name=" + name + ", queueCount=" + config.queueCount() + "}";
    }
}
