package com.ryuqq.eventflow.core.spi;

/**
 * Synchronous in-process publish/subscribe bus.
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe subscribe/unsubscribe</li>
 *   <li>Publish invokes handlers on the publishing thread, in registration order</li>
 *   <li>Handler exceptions propagate to the publisher</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Bus extends Publisher, Subscriber {

    String getName();
}
