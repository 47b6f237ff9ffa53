/**
 * Gateway lifecycle states: {@code init}, {@code active}, {@code error}.
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.application.state;
