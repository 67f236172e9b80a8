package com.ryuqq.eventflow.application.command;

import com.ryuqq.eventflow.core.message.AckCommand;
import com.ryuqq.eventflow.core.message.Command;
import com.ryuqq.eventflow.core.message.CommandResponse;
import com.ryuqq.eventflow.core.spi.CommandHandler;
import com.ryuqq.eventflow.core.spi.Handler;
import com.ryuqq.eventflow.core.spi.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CommandHandler}를 버스 {@link Handler}로 감싸 Ack/응답 프로토콜을 수행합니다.
 *
 * <ol>
 *   <li>{@link AckCommand} publish</li>
 *   <li>취소된 Command면 {@code canceled()} 응답</li>
 *   <li>아니면 핸들러 호출, 예외는 {@code fail(ex)} 응답으로 변환</li>
 *   <li>응답 publish</li>
 * </ol>
 *
 * @param <T> Command 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class CommandHandlerAdapter<T extends Command> implements Handler<T> {

    private static final Logger log = LoggerFactory.getLogger(CommandHandlerAdapter.class);

    private final Publisher bus;
    private final CommandHandler<T> handler;

    CommandHandlerAdapter(Publisher bus, CommandHandler<T> handler) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        this.bus = bus;
        this.handler = handler;
    }

    CommandHandler<T> getHandler() {
        return handler;
    }

    @Override
    public void handle(T command) {
        bus.publish(new AckCommand(command));
        CommandResponse response;
        if (command.isCanceled()) {
            response = command.canceled();
        } else {
            response = invoke(command);
        }
        bus.publish(response);
    }

    private CommandResponse invoke(T command) {
        try {
            CommandResponse response = handler.handle(command);
            if (response == null) {
                return command.fail(new IllegalStateException("Command handler returned no response"));
            }
            return response;
        } catch (RuntimeException e) {
            log.debug("Command handler for {} failed.", command.getClass().getSimpleName(), e);
            return command.fail(e);
        }
    }
}
