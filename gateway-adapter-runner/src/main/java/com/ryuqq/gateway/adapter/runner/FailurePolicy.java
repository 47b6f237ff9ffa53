package com.ryuqq.gateway.adapter.runner;

/**
 * 메시지 처리 함수가 예외를 던졌을 때의 워커 동작.
 *
 * <p><strong>정책별 사용 시나리오:</strong></p>
 * <ul>
 *   <li>LOG_AND_CONTINUE: 메시지 하나의 실패가 워커 수를 줄이면 안 되는 경우 (기본값)</li>
 *   <li>TERMINATE_WORKER: 처리 실패를 치명적 오류로 보고 해당 워커만 종료하는 경우</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public enum FailurePolicy {

    /**
     * 로그 후 계속 처리.
     *
     * <p>예외를 ERROR 로그로 남기고 실패 카운트를 증가시킨 뒤 다음 메시지를 처리합니다.</p>
     *
     * <p><strong>주의:</strong></p>
     * <ul>
     *   <li>실패한 메시지는 재처리되지 않음 (at-most-once)</li>
     * </ul>
     */
    LOG_AND_CONTINUE,

    /**
     * 워커 종료.
     *
     * <p>예외가 워커 루프 밖으로 전파되어 해당 워커 스레드만 종료됩니다.
     * 다른 워커는 영향을 받지 않으며, 종료된 워커는 다시 생성되지 않습니다.</p>
     *
     * <p><strong>주의:</strong></p>
     * <ul>
     *   <li>모든 워커가 종료되면 큐에 남은 메시지는 처리되지 않음</li>
     *   <li>예외는 스레드의 UncaughtExceptionHandler가 로그로 남김</li>
     * </ul>
     */
    TERMINATE_WORKER
}
