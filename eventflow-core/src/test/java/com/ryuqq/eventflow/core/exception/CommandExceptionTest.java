package com.ryuqq.eventflow.core.exception;

import com.ryuqq.eventflow.core.message.Command;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 예외 메시지 형식 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CommandExceptionTest {

    static class ShipOrder extends Command {
    }

    @Test
    void message_IsPrefixedWithCommandType() {
        // given
        ShipOrder command = new ShipOrder();

        // when & then
        assertThat(new CommandTimedOutException(command)).hasMessage("ShipOrder: timed out");
        assertThat(new CommandNotHandledException(command)).hasMessage("ShipOrder: not handled");
        assertThat(new CommandOversubscribedException(command)).hasMessage("ShipOrder: oversubscribed");
        assertThat(new CommandException("custom", command).getCommand()).isSameAs(command);
    }

    @Test
    void aggregateVersionException_CarriesVersions() {
        // given
        UUID id = UUID.randomUUID();

        // when
        AggregateVersionException exception = new AggregateVersionException(id, String.class, 10, 4);

        // then
        assertThat(exception.getRequestedVersion()).isEqualTo(10);
        assertThat(exception.getAggregateVersion()).isEqualTo(4);
        assertThat(exception.getId()).isEqualTo(id);
        assertThat(exception.getMessage()).contains("Requested version 10").contains("aggregate version is 4");
    }

    @Test
    void queueStopTimeout_WrapsTimeoutException() {
        // when
        QueueStopTimeoutException exception = new QueueStopTimeoutException("worker");

        // then
        assertThat(exception).hasMessage("Unable to stop thread 'worker'.");
        assertThat(exception.getCause()).isInstanceOf(java.util.concurrent.TimeoutException.class);
    }
}
