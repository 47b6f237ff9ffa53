package com.ryuqq.gateway.application.message;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 데이터 수집 메시지.
 *
 * <p>임의의 문자열 데이터를 담습니다. 예: ECU에서 수신한 원본 JSON.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class DataMessage extends AbstractMessage {

    private static final Logger log = LoggerFactory.getLogger(DataMessage.class);

    /**
     * 타입 이름.
     */
    public static final String TYPE = "DataMessage";

    private final String data;

    /**
     * 생성자.
     *
     * @param id 메시지 ID
     * @param data 데이터 (null이면 빈 문자열)
     */
    public DataMessage(String id, String data) {
        super(id);
        this.data = data == null ? "" : data;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public void process() {
        log.debug("Processing {} ({} chars)", getId(), data.length());
    }

    /**
     * 데이터 조회.
     *
     * @return 데이터
     */
    public String getData() {
        return data;
    }

    @Override
    public String toString() {
        return "[DataMessage] ID: " + getId()
            + ", Data: " + data
            + ", Timestamp: " + formattedTimestamp();
    }
}
