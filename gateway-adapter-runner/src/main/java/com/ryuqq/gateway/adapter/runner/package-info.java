/**
 * Runner Adapter Layer - worker pool over the MessageQueue SPI.
 *
 * <p>이 패키지는 MessageQueue에서 메시지를 꺼내 처리하는 워커 풀을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.adapter.runner.MessageHandler} - 고정 크기 워커 풀 (drain-on-stop)</li>
 *   <li>{@link com.ryuqq.gateway.adapter.runner.MessageHandlerConfig} - 워커 수, 실패 정책, 스레드 이름</li>
 *   <li>{@link com.ryuqq.gateway.adapter.runner.FailurePolicy} - 처리 함수 예외 시 동작</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * application (Gateway: processor → StateMachine.triggerEvent)
 *   ↓ depends on
 * adapter-runner (MessageHandler)
 *   ↓ depends on
 * core/spi (MessageQueue)  ←  adapter-inmemory (InMemoryMessageQueue)
 * </pre>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
package com.ryuqq.gateway.adapter.runner;
