package com.ryuqq.gateway.testkit.fixture;

import com.ryuqq.gateway.core.message.Message;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 처리 횟수를 세는 테스트용 Message.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public class TestMessage implements Message {

    private final String id;
    private final Instant timestamp = Instant.now();
    private final boolean failing;
    private final AtomicInteger processCount = new AtomicInteger();

    private TestMessage(String id, boolean failing) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        this.id = id;
        this.failing = failing;
    }

    /**
     * 정상 처리되는 메시지.
     *
     * @param id 메시지 ID
     * @return TestMessage
     */
    public static TestMessage of(String id) {
        return new TestMessage(id, false);
    }

    /**
     * process() 호출 시 IllegalStateException을 던지는 메시지.
     *
     * @param id 메시지 ID
     * @return TestMessage
     */
    public static TestMessage failing(String id) {
        return new TestMessage(id, true);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getType() {
        return "TestMessage";
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public void process() {
        processCount.incrementAndGet();
        if (failing) {
            throw new IllegalStateException("Simulated failure for " + id);
        }
    }

    /**
     * process() 호출 횟수.
     *
     * @return 호출 횟수
     */
    public int getProcessCount() {
        return processCount.get();
    }

    @Override
    public String toString() {
        return "TestMessage{" + id + '}';
    }
}
