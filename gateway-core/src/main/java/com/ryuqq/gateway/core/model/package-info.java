/**
 * Value objects shared by the core components.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.model.EventData} - Dynamically typed event payload with checked downcast</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.core.model;
