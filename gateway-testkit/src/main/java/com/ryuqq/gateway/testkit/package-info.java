/**
 * Test support for gateway modules.
 *
 * <p>{@code fixture} holds recording {@code State} and {@code Message} doubles;
 * {@code contract} holds abstract contract tests that every SPI implementation
 * should extend.</p>
 */
package com.ryuqq.gateway.testkit;
