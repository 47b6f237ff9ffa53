package com.ryuqq.gateway.testkit.fixture;

import com.ryuqq.gateway.core.model.EventData;
import com.ryuqq.gateway.core.statemachine.State;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 콜백 호출을 기록하는 테스트용 State.
 *
 * <p>여러 RecordingState가 같은 journal을 공유하면 상태 간 콜백 순서를 검증할 수 있습니다.
 * journal 항목 형식: {@code "<name>.enter"}, {@code "<name>.exit"}, {@code "<name>.update"},
 * {@code "<name>.event:<eventName>"}.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * List&lt;String&gt; journal = RecordingState.newJournal();
 * RecordingState a = new RecordingState("A", journal);
 * RecordingState b = new RecordingState("B", journal).handling("ping");
 * ...
 * assertThat(journal).containsExactly("A.enter", "A.event:go", "A.exit", "B.enter");
 * </pre>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public class RecordingState implements State {

    private final String name;
    private final List<String> journal;
    private final Set<String> handledEvents = ConcurrentHashMap.newKeySet();
    private final AtomicInteger enterCount = new AtomicInteger();
    private final AtomicInteger exitCount = new AtomicInteger();
    private final AtomicInteger updateCount = new AtomicInteger();
    private volatile EventData lastContext = EventData.empty();
    private volatile Consumer<EventData> onEnterAction = context -> { };

    /**
     * 전용 journal을 가진 RecordingState 생성.
     *
     * @param name 상태 이름
     */
    public RecordingState(String name) {
        this(name, newJournal());
    }

    /**
     * 공유 journal을 사용하는 RecordingState 생성.
     *
     * @param name 상태 이름
     * @param journal 콜백 기록 (thread-safe 리스트여야 함)
     */
    public RecordingState(String name, List<String> journal) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (journal == null) {
            throw new IllegalArgumentException("journal cannot be null");
        }
        this.name = name;
        this.journal = journal;
    }

    /**
     * 여러 스레드에서 안전하게 기록할 수 있는 journal 생성.
     *
     * @return synchronized 리스트
     */
    public static List<String> newJournal() {
        return Collections.synchronizedList(new ArrayList<>());
    }

    /**
     * 지정한 이벤트를 직접 처리(onEvent → true)하도록 설정.
     *
     * @param eventNames 직접 처리할 이벤트 이름
     * @return this
     */
    public RecordingState handling(String... eventNames) {
        Collections.addAll(handledEvents, eventNames);
        return this;
    }

    /**
     * onEnter 시 추가로 실행할 동작 설정 (예: 머신 재진입 검증).
     *
     * @param action 실행할 동작
     * @return this
     */
    public RecordingState onEnterDo(Consumer<EventData> action) {
        this.onEnterAction = action == null ? context -> { } : action;
        return this;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void onEnter(EventData context) {
        enterCount.incrementAndGet();
        lastContext = context;
        journal.add(name + ".enter");
        onEnterAction.accept(context);
    }

    @Override
    public void onExit() {
        exitCount.incrementAndGet();
        journal.add(name + ".exit");
    }

    @Override
    public void onUpdate() {
        updateCount.incrementAndGet();
        journal.add(name + ".update");
    }

    @Override
    public boolean onEvent(String eventName, EventData eventData) {
        journal.add(name + ".event:" + eventName);
        return handledEvents.contains(eventName);
    }

    public int getEnterCount() {
        return enterCount.get();
    }

    public int getExitCount() {
        return exitCount.get();
    }

    public int getUpdateCount() {
        return updateCount.get();
    }

    public EventData getLastContext() {
        return lastContext;
    }

    /**
     * 기록된 콜백 스냅샷.
     *
     * @return journal 복사본
     */
    public List<String> getJournal() {
        synchronized (journal) {
            return new ArrayList<>(journal);
        }
    }
}
