package com.ryuqq.gateway.core.statemachine;

import com.ryuqq.gateway.core.model.EventData;

import java.util.Optional;

/**
 * 상태 전이 정의 (불변 record).
 *
 * <p>(fromState, event) 쌍 하나에는 하나의 Transition만 등록됩니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 * @param fromState 출발 상태 이름
 * @param event 전이를 일으키는 이벤트 이름
 * @param toState 도착 상태 이름
 * @param guard 전이 조건 (null이면 무조건 허용)
 */
public record Transition(
    String fromState,
    String event,
    String toState,
    TransitionGuard guard
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 상태 이름 또는 이벤트가 null인 경우
     */
    public Transition {
        if (fromState == null || event == null || toState == null) {
            throw new IllegalArgumentException(
                "fromState, event and toState cannot be null (from: " + fromState
                    + ", event: " + event + ", to: " + toState + ")"
            );
        }
        // guard는 null 허용
    }

    /**
     * Guard 없는 전이 생성.
     */
    public Transition(String fromState, String event, String toState) {
        this(fromState, event, toState, null);
    }

    /**
     * Guard 조회.
     *
     * @return guard (없으면 빈 Optional)
     */
    public Optional<TransitionGuard> findGuard() {
        return Optional.ofNullable(guard);
    }

    /**
     * 이벤트 데이터에 대해 전이가 허용되는지 평가.
     *
     * <p>Guard가 던진 예외는 그대로 전파되며, StateMachine이 "전이 불가"로 처리합니다.</p>
     *
     * @param eventData 이벤트 데이터
     * @return 허용되면 true
     */
    boolean permits(EventData eventData) {
        return guard == null || guard.test(eventData);
    }

    /**
     * 지정한 상태를 출발 또는 도착으로 참조하는지 확인.
     *
     * @param stateName 상태 이름
     * @return 참조하면 true
     */
    public boolean references(String stateName) {
        return fromState.equals(stateName) || toState.equals(stateName);
    }
}
