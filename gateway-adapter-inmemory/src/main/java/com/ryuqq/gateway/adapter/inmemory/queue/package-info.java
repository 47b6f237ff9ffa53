/**
 * In-memory MessageQueue adapter.
 *
 * <p>Provides {@link com.ryuqq.gateway.adapter.inmemory.queue.InMemoryMessageQueue},
 * the in-process implementation of the
 * {@link com.ryuqq.gateway.core.spi.MessageQueue} SPI. Contents are not persisted.</p>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.adapter.inmemory.queue;
