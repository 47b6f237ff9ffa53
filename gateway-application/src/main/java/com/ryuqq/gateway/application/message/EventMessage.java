package com.ryuqq.gateway.application.message;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 시스템 이벤트 메시지.
 *
 * <p>심각도({@link Severity})와 설명을 담습니다.
 * Gateway는 ERROR 이벤트를 받으면 상태 머신에 error_occurred 이벤트를 전달합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class EventMessage extends AbstractMessage {

    private static final Logger log = LoggerFactory.getLogger(EventMessage.class);

    /**
     * 타입 이름.
     */
    public static final String TYPE = "EventMessage";

    /**
     * 이벤트 심각도.
     */
    public enum Severity {
        INFO,
        WARNING,
        ERROR
    }

    private final Severity severity;
    private final String description;

    /**
     * 생성자.
     *
     * @param id 메시지 ID
     * @param severity 심각도
     * @param description 설명 (null이면 빈 문자열)
     * @throws IllegalArgumentException severity가 null인 경우
     */
    public EventMessage(String id, Severity severity, String description) {
        super(id);
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        this.severity = severity;
        this.description = description == null ? "" : description;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public void process() {
        switch (severity) {
            case ERROR -> log.error("Event {}: {}", getId(), description);
            case WARNING -> log.warn("Event {}: {}", getId(), description);
            default -> log.info("Event {}: {}", getId(), description);
        }
    }

    /**
     * 심각도 조회.
     *
     * @return 심각도
     */
    public Severity getSeverity() {
        return severity;
    }

    /**
     * 설명 조회.
     *
     * @return 설명
     */
    public String getDescription() {
        return description;
    }

    /**
     * ERROR 이벤트인지 확인.
     *
     * @return ERROR이면 true
     */
    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return "[EventMessage] ID: " + getId()
            + ", Type: " + severity
            + ", Description: " + description
            + ", Timestamp: " + formattedTimestamp();
    }
}
