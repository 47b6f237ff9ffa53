package com.ryuqq.gateway.core.statemachine;

import com.ryuqq.gateway.core.model.EventData;

/**
 * StateMachine에 등록되는 상태.
 *
 * <p>네 가지 생명주기 콜백을 제공하며, 모두 기본 구현(no-op)을 가집니다.</p>
 *
 * <p><strong>콜백 호출 규칙:</strong></p>
 * <ul>
 *   <li>모든 콜백은 StateMachine의 락을 잡지 않은 상태에서 호출됨</li>
 *   <li>따라서 콜백 안에서 StateMachine을 다시 호출해도 교착 상태가 발생하지 않음</li>
 *   <li>여러 스레드에서 triggerEvent를 호출하면 콜백이 동시에 실행될 수 있음
 *       → 상태 객체 내부의 가변 상태는 구현체가 보호해야 함</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public interface State {

    /**
     * 상태 이름.
     *
     * @return 상태 이름
     */
    String getName();

    /**
     * 상태 진입 시 호출.
     *
     * @param context 전이를 일으킨 이벤트 데이터 (start 시에는 빈 EventData)
     */
    default void onEnter(EventData context) {
    }

    /**
     * 상태 이탈 시 호출.
     */
    default void onExit() {
    }

    /**
     * 주기적 업데이트 ({@link StateMachine#update()} 호출 시).
     */
    default void onUpdate() {
    }

    /**
     * 현재 상태에서 이벤트 처리.
     *
     * <p>true를 반환하면 상태가 이벤트를 직접 처리한 것으로 간주하여
     * 전이 테이블에 등록된 전이가 있더라도 전이하지 않습니다.</p>
     *
     * @param eventName 이벤트 이름
     * @param eventData 이벤트 데이터
     * @return 직접 처리했으면 true
     */
    default boolean onEvent(String eventName, EventData eventData) {
        return false;
    }
}
