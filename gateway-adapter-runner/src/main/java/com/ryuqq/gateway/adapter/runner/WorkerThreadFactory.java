package com.ryuqq.gateway.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 워커 스레드 팩토리.
 *
 * <p>{@code <prefix>-1}, {@code <prefix>-2} 형식의 이름을 가진 데몬 스레드를 생성하며,
 * 워커 루프 밖으로 전파된 예외는 ERROR 로그로 남깁니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
final class WorkerThreadFactory implements ThreadFactory {

    private static final Logger log = LoggerFactory.getLogger(WorkerThreadFactory.class);

    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger(1);

    WorkerThreadFactory(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + "-" + counter.getAndIncrement());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) ->
            log.error("Worker {} terminated by uncaught exception", t.getName(), e));
        return thread;
    }
}
