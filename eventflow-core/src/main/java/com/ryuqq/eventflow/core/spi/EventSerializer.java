package com.ryuqq.eventflow.core.spi;

import com.ryuqq.eventflow.core.model.EventData;
import com.ryuqq.eventflow.core.model.RecordedEvent;

import java.util.Map;

/**
 * Converts in-memory events to and from stored events.
 *
 * <p>Implementations agree on two metadata headers identifying how to rebuild the object:
 * {@link #EVENT_TYPE_HEADER} and {@link #EVENT_QUALIFIED_TYPE_HEADER}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventSerializer {

    String EVENT_TYPE_HEADER = "EventClrTypeName";
    String EVENT_QUALIFIED_TYPE_HEADER = "EventClrQualifiedTypeName";

    /**
     * @param event event object
     * @param headers extra metadata headers (commit headers etc.)
     */
    EventData serialize(Object event, Map<String, Object> headers);

    /**
     * @return the rebuilt event, or null when the type cannot be resolved
     */
    Object deserialize(RecordedEvent recordedEvent);
}
