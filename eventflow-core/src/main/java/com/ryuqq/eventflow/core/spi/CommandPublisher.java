package com.ryuqq.eventflow.core.spi;

import com.ryuqq.eventflow.core.message.Command;
import com.ryuqq.eventflow.core.message.CommandResponse;

import java.time.Duration;

/**
 * Request/response command API.
 *
 * <p><strong>Variants:</strong></p>
 * <ul>
 *   <li>{@code send} - blocks until resolved; throws a
 *       {@link com.ryuqq.eventflow.core.exception.CommandException} on any non-success</li>
 *   <li>{@code trySend} - blocks until resolved; never throws, returns the response
 *       ({@link CommandResponse#isSuccess()} tells the outcome)</li>
 *   <li>{@code trySendAsync} - publishes and returns immediately; callers subscribe to
 *       responses themselves</li>
 * </ul>
 *
 * <p>Null timeouts mean "use the publisher's defaults".</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CommandPublisher {

    default void send(Command command) {
        send(command, null, null, null);
    }

    /**
     * @param command command to send
     * @param exceptionMsg message for the thrown exception (null for the default)
     * @param responseTimeout completion timeout (null for default)
     * @param ackTimeout acknowledgement timeout (null for default)
     * @throws com.ryuqq.eventflow.core.exception.CommandException when the command does not succeed
     */
    void send(Command command, String exceptionMsg, Duration responseTimeout, Duration ackTimeout);

    default CommandResponse trySend(Command command) {
        return trySend(command, null, null);
    }

    CommandResponse trySend(Command command, Duration responseTimeout, Duration ackTimeout);

    default boolean trySendAsync(Command command) {
        return trySendAsync(command, null, null);
    }

    boolean trySendAsync(Command command, Duration responseTimeout, Duration ackTimeout);
}
