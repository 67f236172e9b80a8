/**
 * Jackson based event serialization.
 *
 * <p>{@link com.ryuqq.eventflow.application.serialization.JacksonEventSerializer} turns events into
 * {@link com.ryuqq.eventflow.core.model.EventData} and back, using the type headers of
 * {@link com.ryuqq.eventflow.core.spi.EventSerializer}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.eventflow.application.serialization;
