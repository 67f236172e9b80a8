package com.ryuqq.eventflow.core.hierarchy;

import com.ryuqq.eventflow.core.message.Event;
import com.ryuqq.eventflow.core.message.Message;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MessageHierarchy 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class MessageHierarchyTest {

    static class ParentEvent extends Event {
    }

    static class ChildEvent extends ParentEvent {
    }

    static class GrandChildEvent extends ChildEvent {
    }

    @Test
    void ancestorsAndSelf_RegisteredType_ReturnsChainUpToMessage() {
        // given
        MessageHierarchy hierarchy = new MessageHierarchy();

        // when
        List<Class<?>> chain = hierarchy.ancestorsAndSelf(ChildEvent.class);

        // then
        assertThat(chain).containsExactly(ChildEvent.class, ParentEvent.class, Event.class, Message.class);
    }

    @Test
    void descendantsAndSelf_OnlyKnownTypesAreReturned() {
        // given
        MessageHierarchy hierarchy = new MessageHierarchy();
        hierarchy.register(ChildEvent.class);

        // when
        Set<Class<?>> descendants = hierarchy.descendantsAndSelf(ParentEvent.class);

        // then
        assertThat(descendants).containsExactlyInAnyOrder(ParentEvent.class, ChildEvent.class);
        assertThat(descendants).doesNotContain(GrandChildEvent.class);
    }

    @Test
    void register_NewType_NotifiesListenersWithAddedTypes() {
        // given
        MessageHierarchy hierarchy = new MessageHierarchy();
        List<Set<Class<?>>> notifications = new ArrayList<>();
        hierarchy.addListener(notifications::add);

        // when
        boolean added = hierarchy.register(GrandChildEvent.class);

        // then
        assertThat(added).isTrue();
        assertThat(notifications).hasSize(1);
        assertThat(notifications.get(0)).contains(GrandChildEvent.class, ChildEvent.class, ParentEvent.class);
    }

    @Test
    void register_KnownType_DoesNotNotify() {
        // given
        MessageHierarchy hierarchy = new MessageHierarchy();
        hierarchy.register(ChildEvent.class);
        List<Set<Class<?>>> notifications = new ArrayList<>();
        hierarchy.addListener(notifications::add);

        // when
        boolean added = hierarchy.register(ChildEvent.class);

        // then
        assertThat(added).isFalse();
        assertThat(notifications).isEmpty();
    }

    @Test
    void register_Null_ThrowsException() {
        // given
        MessageHierarchy hierarchy = new MessageHierarchy();

        // when & then
        assertThatThrownBy(() -> hierarchy.register(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null");
    }
}
