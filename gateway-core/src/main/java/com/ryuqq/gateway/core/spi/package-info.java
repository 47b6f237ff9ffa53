/**
 * Service Provider Interfaces of the gateway runtime.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.spi.MessageQueue} - Blocking FIFO hand-off between producers and workers</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>gateway-adapter-inmemory: {@code InMemoryMessageQueue} (lock + condition over an ArrayDeque)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.core.spi;
