package com.ryuqq.eventflow.core.model;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EventData / StreamName / CatchUpSubscriptionSettings 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class EventDataTest {

    @Test
    void constructor_EmptyUuid_ThrowsException() {
        // when & then
        assertThatThrownBy(() -> new EventData(new UUID(0L, 0L), "Created", true, null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("eventId");
    }

    @Test
    void constructor_NullPayloads_DefaultToEmptyArrays() {
        // when
        EventData data = new EventData(UUID.randomUUID(), "Created", true, null, null);

        // then
        assertThat(data.data()).isEmpty();
        assertThat(data.metadata()).isEmpty();
    }

    @Test
    void streamName_PrefixAndSuffixOperations() {
        // given
        StreamName name = StreamName.of("account-1");

        // when
        StreamName decorated = name.withPrefix("$ce-").withSuffix("-snapshot");

        // then
        assertThat(decorated.getValue()).isEqualTo("$ce-account-1-snapshot");
        assertThat(decorated.withoutPrefix("$ce-").withoutSuffix("-snapshot")).isEqualTo(name);
        assertThat(name.withoutPrefix("missing")).isSameAs(name);
    }

    @Test
    void catchUpSettings_DefaultsAndValidation() {
        // when
        CatchUpSubscriptionSettings settings = CatchUpSubscriptionSettings.DEFAULT;

        // then
        assertThat(settings.maxLiveQueueSize()).isEqualTo(10000);
        assertThat(settings.readBatchSize()).isEqualTo(500);
        assertThatThrownBy(() -> settings.withReadBatchSize(CatchUpSubscriptionSettings.MAX_READ_SIZE + 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("you should page");
        assertThatThrownBy(() -> settings.withMaxLiveQueueSize(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
