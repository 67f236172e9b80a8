package com.ryuqq.eventflow.application.serialization;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.eventflow.core.model.EventData;
import com.ryuqq.eventflow.core.model.RecordedEvent;
import com.ryuqq.eventflow.core.spi.EventSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * JSON {@link EventSerializer} backed by Jackson.
 *
 * <p>The payload is the event serialized field by field. The metadata is a JSON object holding the
 * caller's headers plus two type headers:</p>
 * <ul>
 *   <li>{@value EventSerializer#EVENT_TYPE_HEADER} - simple class name</li>
 *   <li>{@value EventSerializer#EVENT_QUALIFIED_TYPE_HEADER} - fully qualified class name, used to
 *       load the class again on deserialize</li>
 * </ul>
 *
 * <p>Headers already present in the caller's map are not overwritten.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JacksonEventSerializer implements EventSerializer {

    private static final Logger log = LoggerFactory.getLogger(JacksonEventSerializer.class);

    private static final TypeReference<LinkedHashMap<String, Object>> HEADERS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final boolean throwOnTypeNotFound;
    private final ClassLoader classLoader;

    public JacksonEventSerializer() {
        this(defaultObjectMapper(), false, null);
    }

    /**
     * @param mapper mapper used for payload and metadata
     * @param throwOnTypeNotFound throw instead of returning null when the event class cannot be loaded
     * @param classLoader loader for event classes (null for this class's loader)
     */
    public JacksonEventSerializer(ObjectMapper mapper, boolean throwOnTypeNotFound, ClassLoader classLoader) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
        this.throwOnTypeNotFound = throwOnTypeNotFound;
        this.classLoader = classLoader != null ? classLoader : JacksonEventSerializer.class.getClassLoader();
    }

    /**
     * Field-based mapper. Private fields are read and written directly and nulls are skipped.
     * Unknown properties are ignored. {@code java.time} values are written as ISO-8601.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .setVisibility(PropertyAccessor.ALL, Visibility.NONE)
            .setVisibility(PropertyAccessor.FIELD, Visibility.ANY)
            .setVisibility(PropertyAccessor.CREATOR, Visibility.ANY);
    }

    @Override
    public EventData serialize(Object event, Map<String, Object> headers) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        Class<?> type = event.getClass();
        Map<String, Object> metadata = headers == null ? new LinkedHashMap<>() : new LinkedHashMap<>(headers);
        metadata.putIfAbsent(EVENT_TYPE_HEADER, type.getSimpleName());
        metadata.putIfAbsent(EVENT_QUALIFIED_TYPE_HEADER, type.getName());
        try {
            return new EventData(
                UUID.randomUUID(),
                type.getSimpleName(),
                true,
                mapper.writeValueAsBytes(event),
                mapper.writeValueAsBytes(metadata)
            );
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize event: " + type.getName(), e);
        }
    }

    @Override
    public Object deserialize(RecordedEvent recordedEvent) {
        if (recordedEvent == null) {
            throw new IllegalArgumentException("recordedEvent cannot be null");
        }
        Object typeName = readHeaders(recordedEvent).get(EVENT_QUALIFIED_TYPE_HEADER);
        Class<?> type = findType(typeName == null ? null : typeName.toString());
        if (type == null) {
            return null;
        }
        try {
            return mapper.readValue(recordedEvent.data(), type);
        } catch (IOException e) {
            throw new EventSerializationException(
                "Failed to deserialize " + recordedEvent + " as " + type.getName(), e);
        }
    }

    /**
     * @return the metadata headers of a recorded event (empty when there is no metadata)
     */
    public Map<String, Object> readHeaders(RecordedEvent recordedEvent) {
        byte[] metadata = recordedEvent.metadata();
        if (metadata.length == 0) {
            return Collections.emptyMap();
        }
        try {
            return mapper.readValue(metadata, HEADERS_TYPE);
        } catch (IOException e) {
            throw new EventSerializationException("Failed to read metadata of " + recordedEvent, e);
        }
    }

    /**
     * @return the class for a qualified name, or null when it cannot be loaded and
     *         {@code throwOnTypeNotFound} is off
     */
    public Class<?> findType(String qualifiedName) {
        if (qualifiedName == null || qualifiedName.isBlank()) {
            if (throwOnTypeNotFound) {
                throw new EventSerializationException("Event type header is missing");
            }
            log.warn("Event type header is missing, event skipped.");
            return null;
        }
        try {
            return Class.forName(qualifiedName, true, classLoader);
        } catch (ClassNotFoundException e) {
            if (throwOnTypeNotFound) {
                throw new EventSerializationException("Type not found for " + qualifiedName, e);
            }
            log.warn("Type not found for {}, event skipped.", qualifiedName);
            return null;
        }
    }
}
