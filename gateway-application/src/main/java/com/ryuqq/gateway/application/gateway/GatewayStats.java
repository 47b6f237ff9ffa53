package com.ryuqq.gateway.application.gateway;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Gateway 처리 통계.
 *
 * <p>Gateway 인스턴스가 소유하며 메시지 처리 함수와 전이 리스너에 전달됩니다.
 * 모든 카운터는 여러 워커 스레드에서 동시에 갱신될 수 있습니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class GatewayStats {

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong transitions = new AtomicLong();

    void recordProcessed() {
        processed.incrementAndGet();
    }

    void recordError() {
        errors.incrementAndGet();
    }

    void recordTransition() {
        transitions.incrementAndGet();
    }

    /**
     * 처리된 메시지 수.
     *
     * @return 처리 카운트
     */
    public long getProcessedCount() {
        return processed.get();
    }

    /**
     * 수신한 ERROR 이벤트 수.
     *
     * @return 오류 카운트
     */
    public long getErrorCount() {
        return errors.get();
    }

    /**
     * 상태 전이 횟수.
     *
     * @return 전이 카운트
     */
    public long getTransitionCount() {
        return transitions.get();
    }

    @Override
    public String toString() {
        return "GatewayStats{processed=" + processed.get()
            + ", errors=" + errors.get()
            + ", transitions=" + transitions.get() + '}';
    }
}
