/**
 * Gateway wiring: queue, worker pool and state machine.
 *
 * <p>{@link com.ryuqq.gateway.application.gateway.Gateway} installs a message processor
 * that forwards ERROR events to the state machine, and owns its
 * {@link com.ryuqq.gateway.application.gateway.GatewayStats} counters.</p>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.application.gateway;
