/**
 * Concrete message types handled by the gateway.
 *
 * <ul>
 *   <li>{@link com.ryuqq.gateway.application.message.DataMessage} - Raw data ingestion</li>
 *   <li>{@link com.ryuqq.gateway.application.message.EventMessage} - System events with a severity</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.application.message;
