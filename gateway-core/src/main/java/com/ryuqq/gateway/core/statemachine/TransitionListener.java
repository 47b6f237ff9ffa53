package com.ryuqq.gateway.core.statemachine;

/**
 * 상태 전이 관찰자.
 *
 * <p>전이가 성공할 때마다 이전 상태의 onExit 이후, 새 상태의 onEnter 이전에 호출됩니다.
 * 로깅이나 메트릭 수집 용도입니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransitionListener {

    /**
     * 전이 발생 알림.
     *
     * @param fromState 이전 상태 이름
     * @param toState 새 상태 이름
     */
    void onTransition(String fromState, String toState);
}
