package com.ryuqq.gateway.core.statemachine;

import com.ryuqq.gateway.core.model.EventData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 스레드 안전한 이벤트 기반 상태 머신.
 *
 * <p>이름으로 등록된 {@link State}와 (출발 상태, 이벤트) 키의 {@link Transition} 테이블을 관리하며,
 * 외부 호출자 또는 워커 스레드가 {@link #triggerEvent(String, EventData)}로 전이를 일으킵니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>현재 상태는 실행 중일 때만 비어있지 않음</li>
 *   <li>현재 상태는 항상 등록된 상태를 가리킴</li>
 *   <li>실행 중에는 현재 상태를 제거할 수 없음</li>
 *   <li>상태 제거 시 그 상태를 출발/도착으로 참조하는 전이도 모두 제거</li>
 *   <li>히스토리 길이는 용량(기본 50)을 넘지 않으며, 실행 중 마지막 원소는 현재 상태</li>
 * </ul>
 *
 * <p><strong>이벤트 처리 흐름:</strong></p>
 * <pre>
 * triggerEvent(event, data)
 *   ↓ (lock)
 * 1. 현재 상태 스냅샷 + (current, event) 전이 조회 + guard 평가
 *   ↓ (unlock)
 * 2. current.onEvent(event, data) == true → 종료 (전이 없음)
 * 3. 전이 대상이 있으면 transitionTo
 *      (lock) 현재 상태가 바뀌었으면 1번부터 다시, 아니면 current/history 갱신 (unlock)
 *      → from.onExit() → listener(from, to) → to.onEnter(data)
 * </pre>
 *
 * <p><strong>동시성 규칙:</strong> 상태 콜백과 리스너는 절대 락을 잡은 채로 호출하지 않습니다.
 * 콜백 안에서 다시 triggerEvent를 호출해도 교착 상태가 발생하지 않습니다.
 * Guard만 락 안에서 평가되므로 Guard는 머신을 호출하면 안 됩니다.</p>
 *
 * <p>stop()은 onExit 호출이 끝날 때까지 실행 상태를 유지하므로, 동시에 들어온 triggerEvent가
 * 그 사이 전이를 커밋하면 이전 상태가 두 번 onExit되고 새 상태는 onExit되지 않을 수 있습니다.
 * stop()은 이벤트를 발생시키는 스레드가 모두 멈춘 뒤 한 스레드에서 호출해야 합니다.</p>
 *
 * <p><strong>오류 처리:</strong> 등록/제거/시작 실패는 예외 없이 false를 반환하며,
 * 실패한 호출은 아무것도 변경하지 않습니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class StateMachine {

    private static final Logger log = LoggerFactory.getLogger(StateMachine.class);

    /**
     * 기본 히스토리 용량.
     */
    public static final int DEFAULT_HISTORY_CAPACITY = 50;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, State> states = new HashMap<>();
    private final Map<String, Map<String, Transition>> transitions = new HashMap<>();
    private final Deque<String> history = new ArrayDeque<>();
    private final int historyCapacity;

    private String initialState = "";
    private String currentState = "";
    private volatile boolean running;
    private TransitionListener transitionListener;

    /**
     * 기본 히스토리 용량(50)으로 생성.
     */
    public StateMachine() {
        this(DEFAULT_HISTORY_CAPACITY);
    }

    /**
     * 히스토리 용량을 지정하여 생성.
     *
     * @param historyCapacity 히스토리 최대 길이
     * @throws IllegalArgumentException historyCapacity가 양수가 아닌 경우
     */
    public StateMachine(int historyCapacity) {
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException(
                "historyCapacity must be positive (current: " + historyCapacity + ")"
            );
        }
        this.historyCapacity = historyCapacity;
    }

    // ========== 상태 / 전이 등록 ==========

    /**
     * 상태 등록.
     *
     * @param name 상태 이름
     * @param state 상태 인스턴스
     * @return 등록 성공 시 true, 이름이 비었거나 state가 null이거나 이미 존재하면 false
     */
    public boolean addState(String name, State state) {
        if (state == null || name == null || name.isBlank()) {
            return false;
        }
        lock.lock();
        try {
            if (states.containsKey(name)) {
                return false;
            }
            states.put(name, state);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 상태 제거.
     *
     * <p>해당 상태를 출발 또는 도착으로 참조하는 모든 전이도 함께 제거합니다.</p>
     *
     * @param name 상태 이름
     * @return 제거 성공 시 true, 존재하지 않거나 실행 중인 현재 상태이면 false
     */
    public boolean removeState(String name) {
        lock.lock();
        try {
            if (running && currentState.equals(name)) {
                return false;
            }
            if (states.remove(name) == null) {
                return false;
            }

            transitions.remove(name);
            for (Map<String, Transition> byEvent : transitions.values()) {
                byEvent.values().removeIf(transition -> transition.references(name));
            }
            transitions.values().removeIf(Map::isEmpty);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Guard 없는 전이 등록.
     *
     * @see #addTransition(String, String, String, TransitionGuard)
     */
    public boolean addTransition(String fromState, String event, String toState) {
        return addTransition(fromState, event, toState, null);
    }

    /**
     * 전이 등록.
     *
     * <p>같은 (fromState, event) 쌍이 이미 있으면 새 전이로 교체합니다.</p>
     *
     * @param fromState 출발 상태 이름
     * @param event 이벤트 이름
     * @param toState 도착 상태 이름
     * @param guard 전이 조건 (null 허용)
     * @return 등록 성공 시 true, 출발 또는 도착 상태가 등록되지 않았으면 false
     */
    public boolean addTransition(String fromState, String event, String toState, TransitionGuard guard) {
        if (event == null) {
            return false;
        }
        lock.lock();
        try {
            if (!states.containsKey(fromState) || !states.containsKey(toState)) {
                return false;
            }
            transitions
                .computeIfAbsent(fromState, key -> new LinkedHashMap<>())
                .put(event, new Transition(fromState, event, toState, guard));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 전이 제거.
     *
     * @param fromState 출발 상태 이름
     * @param event 이벤트 이름
     * @return 제거 성공 시 true, 해당 전이가 없으면 false
     */
    public boolean removeTransition(String fromState, String event) {
        lock.lock();
        try {
            Map<String, Transition> byEvent = transitions.get(fromState);
            if (byEvent == null || byEvent.remove(event) == null) {
                return false;
            }
            if (byEvent.isEmpty()) {
                transitions.remove(fromState);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 초기 상태 지정.
     *
     * @param stateName 상태 이름
     * @return 등록된 상태이면 true
     */
    public boolean setInitialState(String stateName) {
        lock.lock();
        try {
            if (!states.containsKey(stateName)) {
                return false;
            }
            initialState = stateName;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 전이 리스너 지정.
     *
     * @param listener 리스너 (null이면 제거)
     */
    public void setTransitionListener(TransitionListener listener) {
        lock.lock();
        try {
            this.transitionListener = listener;
        } finally {
            lock.unlock();
        }
    }

    // ========== 생명주기 ==========

    /**
     * 상태 머신 시작.
     *
     * <p>현재 상태를 초기 상태로, 히스토리를 [초기 상태]로 설정한 뒤
     * 락 밖에서 초기 상태의 onEnter(빈 EventData)를 호출합니다.</p>
     *
     * @return 시작 성공 시 true, 이미 실행 중이거나 초기 상태가 없으면 false
     */
    public boolean start() {
        State entered;
        lock.lock();
        try {
            if (running || initialState.isEmpty()) {
                return false;
            }
            entered = states.get(initialState);
            if (entered == null) {
                return false;
            }
            running = true;
            currentState = initialState;
            history.clear();
            history.addLast(initialState);
        } finally {
            lock.unlock();
        }

        log.debug("State machine started in '{}'", entered.getName());
        entered.onEnter(EventData.empty());
        return true;
    }

    /**
     * 상태 머신 정지.
     *
     * <p>락 밖에서 현재 상태의 onExit를 호출한 뒤 현재 상태를 비웁니다.
     * 실행 중이 아니면 아무것도 하지 않습니다.</p>
     */
    public void stop() {
        State exiting;
        lock.lock();
        try {
            if (!running) {
                return;
            }
            exiting = states.get(currentState);
        } finally {
            lock.unlock();
        }

        if (exiting != null) {
            exiting.onExit();
        }

        lock.lock();
        try {
            running = false;
            currentState = "";
        } finally {
            lock.unlock();
        }
        log.debug("State machine stopped");
    }

    /**
     * 실행 중인지 확인.
     *
     * @return 실행 중이면 true
     */
    public boolean isRunning() {
        return running;
    }

    /**
     * 현재 상태의 onUpdate 호출 (락 밖에서).
     *
     * <p>실행 중이 아니면 아무것도 하지 않습니다.</p>
     */
    public void update() {
        if (!running) {
            return;
        }
        getCurrentStateInstance().ifPresent(State::onUpdate);
    }

    // ========== 이벤트 처리 ==========

    /**
     * 데이터 없는 이벤트 발생.
     *
     * @see #triggerEvent(String, EventData)
     */
    public boolean triggerEvent(String eventName) {
        return triggerEvent(eventName, EventData.empty());
    }

    /**
     * 임의의 값을 데이터로 이벤트 발생.
     *
     * @see #triggerEvent(String, EventData)
     */
    public boolean triggerEvent(String eventName, Object eventData) {
        return triggerEvent(eventName, eventData instanceof EventData data ? data : EventData.of(eventData));
    }

    /**
     * 이벤트 발생.
     *
     * <p>락 안에서 (현재 상태, 이벤트) 전이를 찾고 Guard를 평가한 뒤, 락 밖에서 현재 상태의 onEvent를 호출합니다.
     * onEvent가 true를 반환하면 전이 없이 종료하고, 그렇지 않으면 찾은 전이를 수행합니다.</p>
     *
     * <p>그 사이 다른 스레드가 먼저 전이를 커밋했다면 새 현재 상태 기준으로
     * onEvent 호출부터 다시 수행합니다.</p>
     *
     * @param eventName 이벤트 이름
     * @param eventData 이벤트 데이터 (null이면 빈 EventData)
     * @return 상태가 이벤트를 직접 처리했거나 전이가 일어났으면 true
     */
    public boolean triggerEvent(String eventName, EventData eventData) {
        EventData data = eventData == null ? EventData.empty() : eventData;

        while (true) {
            String observedState;
            State current;
            String target;

            lock.lock();
            try {
                if (!running || currentState.isEmpty()) {
                    return false;
                }
                observedState = currentState;
                current = states.get(observedState);
                target = findTarget(observedState, eventName, data);
            } finally {
                lock.unlock();
            }

            if (current != null && current.onEvent(eventName, data)) {
                log.debug("Event '{}' handled by state '{}'", eventName, current.getName());
                return true;
            }

            if (target == null) {
                log.debug("No transition from '{}' for event '{}'", observedState, eventName);
                return false;
            }

            DispatchResult result = transitionTo(observedState, eventName, target, data);
            if (result != DispatchResult.STALE) {
                return result == DispatchResult.APPLIED;
            }
            log.debug("State changed during '{}' dispatch from '{}', retrying", eventName, observedState);
        }
    }

    /**
     * 전이 수행.
     *
     * <p>락 안에서 현재 상태와 히스토리를 갱신하고, 락 밖에서
     * from.onExit → listener(from, to) → to.onEnter(context) 순서로 호출합니다.</p>
     *
     * @return 현재 상태가 observedState에서 바뀌었으면 STALE (아무것도 변경하지 않음)
     */
    private DispatchResult transitionTo(String observedState, String eventName, String toState, EventData context) {
        String fromState;
        State from;
        State to;
        TransitionListener listener;

        lock.lock();
        try {
            if (!running || currentState.isEmpty()) {
                return DispatchResult.REJECTED;
            }
            if (!currentState.equals(observedState)) {
                return DispatchResult.STALE;
            }
            to = states.get(toState);
            if (to == null) {
                return DispatchResult.REJECTED;
            }
            fromState = currentState;
            from = states.get(fromState);

            currentState = toState;
            history.addLast(toState);
            while (history.size() > historyCapacity) {
                history.removeFirst();
            }
            listener = transitionListener;
        } finally {
            lock.unlock();
        }

        log.debug("Transition {} → {} on '{}'", fromState, toState, eventName);
        notifyTransition(fromState, from, toState, to, listener, context);
        return DispatchResult.APPLIED;
    }

    /**
     * 전이 콜백 호출 (락 밖에서).
     *
     * <p>from.onExit → listener(from, to) → to.onEnter(context) 순서.</p>
     */
    private void notifyTransition(String fromState, State from, String toState, State to,
                                  TransitionListener listener, EventData context) {
        if (from != null) {
            from.onExit();
        }
        if (listener != null) {
            listener.onTransition(fromState, toState);
        }
        to.onEnter(context);
    }

    /**
     * (fromState, event) 전이의 도착 상태 조회 (락 안에서 호출).
     *
     * @return Guard를 통과한 도착 상태 이름, 없으면 null
     */
    private String findTarget(String fromState, String eventName, EventData data) {
        Map<String, Transition> byEvent = transitions.get(fromState);
        if (byEvent == null) {
            return null;
        }
        Transition transition = byEvent.get(eventName);
        if (transition == null) {
            return null;
        }
        try {
            return transition.permits(data) ? transition.toState() : null;
        } catch (RuntimeException e) {
            // Guard 예외 = 전이 불가
            log.debug("Guard for {} -[{}]-> {} rejected {}: {}",
                fromState, eventName, transition.toState(), data, e.toString());
            return null;
        }
    }

    // ========== 조회 ==========

    /**
     * 현재 상태 이름.
     *
     * @return 현재 상태 이름 (실행 중이 아니면 빈 문자열)
     */
    public String getCurrentState() {
        lock.lock();
        try {
            return currentState;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 상태 인스턴스.
     *
     * @return 현재 상태 (실행 중이 아니면 빈 Optional)
     */
    public Optional<State> getCurrentStateInstance() {
        lock.lock();
        try {
            if (currentState.isEmpty()) {
                return Optional.empty();
            }
            return Optional.ofNullable(states.get(currentState));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 이름으로 상태 조회.
     *
     * @param name 상태 이름
     * @return 상태 (없으면 빈 Optional)
     */
    public Optional<State> getState(String name) {
        lock.lock();
        try {
            return Optional.ofNullable(states.get(name));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 등록된 상태 이름 목록.
     *
     * @return 상태 이름 스냅샷
     */
    public Set<String> getStateNames() {
        lock.lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(states.keySet()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 전이 등록 여부 확인 (Guard는 평가하지 않음).
     *
     * @param fromState 출발 상태 이름
     * @param event 이벤트 이름
     * @return 전이가 등록되어 있으면 true
     */
    public boolean isValidTransition(String fromState, String event) {
        lock.lock();
        try {
            Map<String, Transition> byEvent = transitions.get(fromState);
            return byEvent != null && byEvent.containsKey(event);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 지정한 상태에서 전이를 일으킬 수 있는 이벤트 목록.
     *
     * @param stateName 상태 이름
     * @return 이벤트 이름 목록 (등록 순서)
     */
    public List<String> getPossibleTransitions(String stateName) {
        lock.lock();
        try {
            Map<String, Transition> byEvent = transitions.get(stateName);
            if (byEvent == null) {
                return List.of();
            }
            return List.copyOf(byEvent.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 전체 상태 히스토리 (오래된 순).
     *
     * @return 히스토리 스냅샷 (최대 historyCapacity개)
     */
    public List<String> getStateHistory() {
        return getStateHistory(historyCapacity);
    }

    /**
     * 최근 상태 히스토리 (오래된 순).
     *
     * @param maxHistory 반환할 최대 개수
     * @return 최근 maxHistory개의 상태 이름
     */
    public List<String> getStateHistory(int maxHistory) {
        lock.lock();
        try {
            int skip = Math.max(0, history.size() - Math.max(0, maxHistory));
            List<String> result = new ArrayList<>(history.size() - skip);
            Iterator<String> iterator = history.iterator();
            for (int i = 0; iterator.hasNext(); i++) {
                String name = iterator.next();
                if (i >= skip) {
                    result.add(name);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 히스토리 용량.
     *
     * @return 히스토리 최대 길이
     */
    public int getHistoryCapacity() {
        return historyCapacity;
    }

    private enum DispatchResult {
        APPLIED,
        REJECTED,
        STALE
    }
}
