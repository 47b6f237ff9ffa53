package com.ryuqq.gateway.application.state;

import com.ryuqq.gateway.core.model.EventData;
import com.ryuqq.gateway.core.statemachine.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 운영 상태.
 *
 * <p>heartbeat, pause 이벤트는 상태가 직접 처리하며(전이 없음),
 * 그 외 이벤트는 전이 테이블에 맡깁니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class ActiveState implements State {

    private static final Logger log = LoggerFactory.getLogger(ActiveState.class);

    /**
     * 상태 이름.
     */
    public static final String NAME = "active";

    public static final String HEARTBEAT = "heartbeat";
    public static final String PAUSE = "pause";

    private final AtomicLong heartbeats = new AtomicLong();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void onEnter(EventData context) {
        log.info("Entered active state");
        context.as(String.class).ifPresent(data -> log.info("Activation data: {}", data));
    }

    @Override
    public void onExit() {
        log.info("Exiting active state");
    }

    @Override
    public boolean onEvent(String eventName, EventData eventData) {
        if (HEARTBEAT.equals(eventName)) {
            heartbeats.incrementAndGet();
            log.debug("Heartbeat received");
            return true;
        }
        if (PAUSE.equals(eventName)) {
            log.info("Pause requested");
            return true;
        }
        return false;
    }

    /**
     * 수신한 heartbeat 수.
     *
     * @return heartbeat 카운트
     */
    public long getHeartbeatCount() {
        return heartbeats.get();
    }
}
