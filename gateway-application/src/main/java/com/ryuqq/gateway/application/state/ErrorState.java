package com.ryuqq.gateway.application.state;

import com.ryuqq.gateway.core.model.EventData;
import com.ryuqq.gateway.core.statemachine.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 오류 상태.
 *
 * <p>진입 시 컨텍스트의 오류 설명을 보관합니다.
 * recover 이벤트는 직접 처리하지 않고 전이 테이블에 맡깁니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class ErrorState implements State {

    private static final Logger log = LoggerFactory.getLogger(ErrorState.class);

    /**
     * 상태 이름.
     */
    public static final String NAME = "error";

    private volatile String lastError;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void onEnter(EventData context) {
        lastError = context.as(String.class).orElse(null);
        log.warn("Entered error state: {}", lastError == null ? "unknown error" : lastError);
    }

    @Override
    public void onExit() {
        log.info("Exiting error state");
    }

    @Override
    public boolean onEvent(String eventName, EventData eventData) {
        if ("recover".equals(eventName)) {
            log.info("Recovery requested: {}", eventName);
        }
        return false;
    }

    /**
     * 마지막으로 진입할 때 전달된 오류 설명.
     *
     * @return 오류 설명 (없으면 빈 Optional)
     */
    public Optional<String> getLastError() {
        return Optional.ofNullable(lastError);
    }
}
