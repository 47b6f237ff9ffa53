/**
 * Work item contract.
 *
 * <p>{@link com.ryuqq.gateway.core.message.Message} is the unit of work carried
 * through a {@link com.ryuqq.gateway.core.spi.MessageQueue} to a worker.</p>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.core.message;
