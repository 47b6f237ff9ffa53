package com.ryuqq.gateway.core.statemachine;

import com.ryuqq.gateway.core.model.EventData;

/**
 * 전이 허용 여부를 판단하는 조건.
 *
 * <p>Guard는 StateMachine 락을 잡은 상태에서 평가되므로 StateMachine을
 * 호출하거나 상태를 변경해서는 안 됩니다.</p>
 *
 * <p>false 반환과 예외 발생(예: {@link ClassCastException})은 모두
 * "전이 불가"로 처리됩니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransitionGuard {

    /**
     * 전이 허용 여부 평가.
     *
     * @param eventData 이벤트 데이터
     * @return 전이를 허용하면 true
     */
    boolean test(EventData eventData);
}
