package com.ryuqq.gateway.application.state;

import com.ryuqq.gateway.core.model.EventData;
import com.ryuqq.gateway.core.statemachine.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 초기화 상태.
 *
 * <p>진입 시 컨텍스트에 문자열 설정값이 있으면 로그로 남깁니다.
 * 이벤트는 직접 처리하지 않으므로 init_complete 전이가 그대로 진행됩니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class InitState implements State {

    private static final Logger log = LoggerFactory.getLogger(InitState.class);

    /**
     * 상태 이름.
     */
    public static final String NAME = "init";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void onEnter(EventData context) {
        log.info("Entered initialization state");
        context.as(String.class).ifPresent(config -> log.info("Initialization config: {}", config));
    }

    @Override
    public void onExit() {
        log.info("Exiting initialization state");
    }
}
