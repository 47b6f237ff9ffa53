package com.ryuqq.gateway.core.message;

import java.time.Instant;

/**
 * 큐를 통해 워커에게 전달되는 작업 단위.
 *
 * <p>Message는 식별자, 생성 시각, 처리 동작({@link #process()})을 노출합니다.
 * 구체 타입(데이터 수집 메시지, 이벤트 메시지 등)은 애플리케이션 계층에서 정의합니다.</p>
 *
 * <p><strong>소유권:</strong></p>
 * <ul>
 *   <li>enqueue 시점: 호출자와 큐가 참조를 공유</li>
 *   <li>dequeue 이후: 처리하는 동안 단 하나의 워커가 참조를 소유</li>
 *   <li>처리 완료 후: 어떤 컴포넌트도 참조를 보관하지 않음</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 식별자와 생성 시각은 변경 불가.
 * 그 외의 가변 상태는 구체 타입의 책임입니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public interface Message {

    /**
     * 메시지 식별자.
     *
     * @return 메시지 ID
     */
    String getId();

    /**
     * 메시지 타입 식별자 (예: "DataMessage").
     *
     * @return 타입 이름
     */
    String getType();

    /**
     * 메시지 생성 시각.
     *
     * @return 생성 시각
     */
    Instant getTimestamp();

    /**
     * 메시지 처리.
     *
     * <p>기본 메시지 프로세서가 워커 스레드에서 호출합니다.</p>
     */
    void process();

    /**
     * 사람이 읽을 수 있는 문자열 표현.
     *
     * @return 문자열 표현
     */
    @Override
    String toString();
}
