package com.ryuqq.gateway.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * 이벤트 및 전이 컨텍스트로 전달되는 동적 타입 데이터.
 *
 * <p>EventData는 임의의 값을 담으며, 값을 꺼낼 때는 {@link #as(Class)}로
 * 타입 확인 후 캐스팅합니다. 타입이 맞지 않으면 예외 대신 빈 {@link Optional}을 반환합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * EventData data = EventData.of("db down");
 * data.as(String.class);   // Optional["db down"]
 * data.as(Integer.class);  // Optional.empty()
 * EventData.empty().isEmpty(); // true
 * </pre>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가 (담긴 객체 자체의 가변성은 호출자 책임)</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class EventData {

    private static final EventData EMPTY = new EventData(null);

    private final Object value;

    private EventData(Object value) {
        // null 허용 (빈 EventData)
        this.value = value;
    }

    /**
     * EventData 생성.
     *
     * @param value 담을 값 (null이면 빈 EventData)
     * @return EventData 인스턴스
     */
    public static EventData of(Object value) {
        return value == null ? EMPTY : new EventData(value);
    }

    /**
     * 빈 EventData.
     *
     * @return 값이 없는 EventData
     */
    public static EventData empty() {
        return EMPTY;
    }

    /**
     * 값이 없는지 확인.
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return value == null;
    }

    /**
     * 원본 값 조회.
     *
     * @return 값 (비어있으면 빈 Optional)
     */
    public Optional<Object> get() {
        return Optional.ofNullable(value);
    }

    /**
     * 지정한 타입으로 값 조회.
     *
     * @param type 기대하는 타입
     * @param <T> 기대하는 타입
     * @return 값이 해당 타입이면 값, 아니면 빈 Optional
     * @throws IllegalArgumentException type이 null인 경우
     */
    public <T> Optional<T> as(Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (type.isInstance(value)) {
            return Optional.of(type.cast(value));
        }
        return Optional.empty();
    }

    /**
     * 값이 지정한 타입인지 확인.
     *
     * @param type 확인할 타입
     * @return 해당 타입이면 true
     */
    public boolean is(Class<?> type) {
        return type != null && type.isInstance(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EventData that = (EventData) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return "EventData{" + (value == null ? "empty" : value.getClass().getSimpleName()) + '}';
    }
}
