package com.ryuqq.gateway.adapter.runner;

/**
 * MessageHandler 설정 (불변 record).
 *
 * <p>이 record는 MessageHandler 워커 풀의 동작을 제어하는 설정값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workerCount: 워커 스레드 수 (기본 1, 0이면 메시지를 처리하지 않음)</li>
 *   <li>failurePolicy: 처리 함수 예외 발생 시 동작 (기본 LOG_AND_CONTINUE)</li>
 *   <li>threadNamePrefix: 워커 스레드 이름 접두사 (기본 "message-worker")</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 * @param workerCount 워커 스레드 수 (0 이상이어야 함)
 * @param failurePolicy 실패 정책 (null 불가)
 * @param threadNamePrefix 스레드 이름 접두사 (빈 문자열 불가)
 */
public record MessageHandlerConfig(
    int workerCount,
    FailurePolicy failurePolicy,
    String threadNamePrefix
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: workerCount=1, failurePolicy=LOG_AND_CONTINUE, threadNamePrefix="message-worker"</p>
     */
    public MessageHandlerConfig() {
        this(1, FailurePolicy.LOG_AND_CONTINUE, "message-worker");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public MessageHandlerConfig {
        if (workerCount < 0) {
            throw new IllegalArgumentException(
                "workerCount cannot be negative (current: " + workerCount + ")"
            );
        }
        if (failurePolicy == null) {
            throw new IllegalArgumentException("failurePolicy cannot be null");
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
    }

    /**
     * workerCount만 변경한 새 인스턴스 생성.
     */
    public MessageHandlerConfig withWorkerCount(int workerCount) {
        return new MessageHandlerConfig(workerCount, failurePolicy, threadNamePrefix);
    }

    /**
     * failurePolicy만 변경한 새 인스턴스 생성.
     */
    public MessageHandlerConfig withFailurePolicy(FailurePolicy failurePolicy) {
        return new MessageHandlerConfig(workerCount, failurePolicy, threadNamePrefix);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public MessageHandlerConfig withThreadNamePrefix(String threadNamePrefix) {
        return new MessageHandlerConfig(workerCount, failurePolicy, threadNamePrefix);
    }
}
