package com.ryuqq.eventflow.core.message;

import com.ryuqq.eventflow.core.exception.CommandCanceledException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Command / CommandResponse 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CommandTest {

    static class DoWork extends Command {
        DoWork() {
        }

        DoWork(CancellationToken token) {
            super(token);
        }

        DoWork(Message source) {
            super(source);
        }
    }

    static class WorkDone extends Event {
        WorkDone(Message source) {
            super(source);
        }
    }

    @Test
    void constructor_RootCommand_CorrelatesToItself() {
        // when
        DoWork command = new DoWork();

        // then
        assertThat(command.getCorrelationId()).isEqualTo(command.getMsgId());
        assertThat(command.getCausationId()).isNull();
        assertThat(command.isCancelable()).isFalse();
        assertThat(command.isCanceled()).isFalse();
    }

    @Test
    void constructor_FromSource_InheritsCorrelationAndCausation() {
        // given
        DoWork root = new DoWork();
        WorkDone event = new WorkDone(root);

        // when
        DoWork next = new DoWork(event);

        // then
        assertThat(event.getCorrelationId()).isEqualTo(root.getMsgId());
        assertThat(event.getCausationId()).isEqualTo(root.getMsgId());
        assertThat(next.getCorrelationId()).isEqualTo(root.getMsgId());
        assertThat(next.getCausationId()).isEqualTo(event.getMsgId());
    }

    @Test
    void isCanceled_TokenCanceled_ReturnsTrue() {
        // given
        CancellationToken token = new CancellationToken();
        DoWork command = new DoWork(token);

        // when
        token.cancel();

        // then
        assertThat(command.isCancelable()).isTrue();
        assertThat(command.isCanceled()).isTrue();
    }

    @Test
    void responses_ReferenceSourceCommand() {
        // given
        DoWork command = new DoWork();
        IllegalStateException failure = new IllegalStateException("boom");

        // when
        Success success = command.succeed();
        Fail fail = command.fail(failure);
        Canceled canceled = command.canceled();

        // then
        assertThat(success.getCommandId()).isEqualTo(command.getMsgId());
        assertThat(success.isSuccess()).isTrue();
        assertThat(success.getCausationId()).isEqualTo(command.getMsgId());
        assertThat(fail.getException()).isSameAs(failure);
        assertThat(fail.isSuccess()).isFalse();
        assertThat(canceled).isInstanceOf(Fail.class);
        assertThat(canceled.getException())
            .isInstanceOf(CommandCanceledException.class)
            .hasMessage("DoWork: canceled");
        assertThat(canceled.getCommandType()).isEqualTo(DoWork.class);
    }

    @Test
    void msgId_IsUniquePerInstance() {
        // when & then
        assertThat(new DoWork().getMsgId()).isNotEqualTo(new DoWork().getMsgId());
    }
}
