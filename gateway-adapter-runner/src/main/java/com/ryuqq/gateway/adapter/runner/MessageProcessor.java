package com.ryuqq.gateway.adapter.runner;

import com.ryuqq.gateway.core.message.Message;

/**
 * 워커가 dequeue한 메시지마다 호출하는 처리 함수.
 *
 * <p>워커 스레드에서 실행되며, 여러 워커가 동시에 호출할 수 있습니다.
 * 애플리케이션은 이 함수 안에서 StateMachine.triggerEvent를 호출하여
 * 메시지 도착과 상태 전이를 연결할 수 있습니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageProcessor {

    /**
     * 기본 처리 함수: 메시지 자신의 {@link Message#process()} 호출.
     */
    MessageProcessor DEFAULT = message -> {
        if (message != null) {
            message.process();
        }
    };

    /**
     * 메시지 처리.
     *
     * @param message 처리할 메시지
     */
    void process(Message message);
}
