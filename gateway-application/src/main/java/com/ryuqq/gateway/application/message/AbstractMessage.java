package com.ryuqq.gateway.application.message;

import com.ryuqq.gateway.core.message.Message;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * 식별자와 생성 시각을 가진 메시지의 공통 구현.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public abstract class AbstractMessage implements Message {

    /**
     * toString()에 사용하는 시각 형식 (시스템 기본 타임존).
     */
    protected static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private final String id;
    private final Instant timestamp;

    /**
     * 생성자 (생성 시각 = 현재 시각).
     *
     * @param id 메시지 ID
     * @throws IllegalArgumentException id가 null이거나 빈 문자열인 경우
     */
    protected AbstractMessage(String id) {
        this(id, Instant.now());
    }

    /**
     * 생성자.
     *
     * @param id 메시지 ID
     * @param timestamp 생성 시각
     * @throws IllegalArgumentException id가 null이거나 빈 문자열이거나 timestamp가 null인 경우
     */
    protected AbstractMessage(String id, Instant timestamp) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        this.id = id;
        this.timestamp = timestamp;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * 포맷된 생성 시각.
     *
     * @return "yyyy-MM-dd HH:mm:ss" 형식의 시각
     */
    protected String formattedTimestamp() {
        return TIMESTAMP_FORMAT.format(timestamp);
    }
}
