package com.ryuqq.gateway.adapter.runner;

import com.ryuqq.gateway.core.message.Message;
import com.ryuqq.gateway.core.spi.MessageQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 고정 크기 워커 풀.
 *
 * <p>N개의 워커 스레드가 하나의 {@link MessageQueue}에서 메시지를 꺼내
 * 교체 가능한 {@link MessageProcessor}로 처리합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>start(): 워커 스레드 N개 생성</li>
 *   <li>stop(): 큐를 정지시켜 대기 중인 워커를 깨우고, 모든 워커 종료까지 대기</li>
 *   <li>메시지 처리 함수의 원자적 교체 (실행 중에도 가능)</li>
 *   <li>처리/실패 카운트 집계</li>
 * </ul>
 *
 * <p><strong>워커 루프:</strong></p>
 * <pre>
 * while (running || !queue.isEmpty()):
 *   1. queue.dequeue() (blocking)
 *   2. 빈 결과 (큐 정지 + 비어있음) → 종료
 *   3. processor.process(message)
 *      - 예외 발생 시 FailurePolicy에 따라 로그 후 계속 or 워커 종료
 * </pre>
 *
 * <p><strong>종료 보장 (drain-on-stop):</strong></p>
 * <ul>
 *   <li>stop() 호출 이전에 enqueue된 메시지는 모두 처리된 뒤 워커가 종료됨</li>
 *   <li>처리 중인 메시지를 인터럽트하지 않음 (협력적 종료)</li>
 *   <li>isRunning()은 마지막 워커가 루프를 빠져나간 뒤에야 false가 됨 (워커 루프 플래그와 분리)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 생명주기 락은 플래그 변경과 워커 목록 스냅샷에만 잡고,
 * join은 락 밖에서 수행합니다. 워커(처리 함수) 안에서 stop()을 호출하면 종료 신호만 보내고
 * 어떤 워커도 join하지 않으므로, 여러 워커가 동시에 stop()을 호출해도 교착 상태가 없습니다.</p>
 *
 * <p><strong>주의:</strong> 큐는 빌려온 참조이며 stop() 시 큐도 정지됩니다.
 * 정지된 큐는 새 메시지를 받지 않으므로, 같은 큐로 다시 start()하면
 * 남은 메시지만 처리한 뒤 워커가 종료됩니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class MessageHandler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MessageHandler.class);

    private final MessageQueue queue;
    private final MessageHandlerConfig config;
    private final WorkerThreadFactory threadFactory;
    private final AtomicReference<MessageProcessor> processor = new AtomicReference<>(MessageProcessor.DEFAULT);
    private final AtomicLong processedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    /**
     * 워커 루프 안에 있는 스레드 수.
     */
    private final AtomicInteger liveWorkers = new AtomicInteger();

    /**
     * started/running 변경과 workers 접근을 보호. join 중에는 잡지 않음.
     */
    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final List<Thread> workers = new ArrayList<>();

    /**
     * 워커 루프 계속 여부. stop() 진입 즉시 false.
     */
    private volatile boolean running;

    /**
     * 외부에 노출되는 실행 상태. start()에서 true, stop() 이후 마지막 워커가 종료되면 false.
     */
    private volatile boolean started;

    /**
     * 생성자 (워커 수만 지정, 나머지는 기본 설정).
     *
     * @param queue 메시지 큐
     * @param workerCount 워커 스레드 수
     * @throws IllegalArgumentException queue가 null이거나 workerCount가 음수인 경우
     */
    public MessageHandler(MessageQueue queue, int workerCount) {
        this(queue, new MessageHandlerConfig().withWorkerCount(workerCount));
    }

    /**
     * 생성자.
     *
     * @param queue 메시지 큐 (소유하지 않음)
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public MessageHandler(MessageQueue queue, MessageHandlerConfig config) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.queue = queue;
        this.config = config;
        this.threadFactory = new WorkerThreadFactory(config.threadNamePrefix());
    }

    /**
     * 워커 시작.
     *
     * <p>이미 실행 중이면(이전 stop()의 워커가 아직 종료 중인 경우 포함) 아무것도 하지 않습니다.</p>
     */
    public void start() {
        lifecycleLock.lock();
        try {
            if (started) {
                return;
            }
            started = true;
            running = true;
            workers.clear();

            for (int i = 0; i < config.workerCount(); i++) {
                workers.add(threadFactory.newThread(this::runWorker));
            }
            liveWorkers.set(workers.size());
            for (Thread worker : workers) {
                worker.start();
            }
        } finally {
            lifecycleLock.unlock();
        }
        log.info("MessageHandler started with {} workers", config.workerCount());
    }

    /**
     * 워커 정지.
     *
     * <p>running=false → queue.stop() → 모든 워커 join 순서로 진행합니다.
     * 실행 중이 아니면 아무것도 하지 않으며, 여러 번 호출해도 안전합니다.</p>
     *
     * <p>워커 스레드(처리 함수 안)에서 호출하면 종료 신호만 보내고 즉시 반환합니다.
     * 이 경우 isRunning()은 호출한 워커가 루프를 빠져나간 뒤 false가 됩니다.</p>
     *
     * <p>join 대기 중 인터럽트가 발생하면 인터럽트 플래그를 복원하고
     * 나머지 워커에 대한 대기를 계속합니다.</p>
     */
    public void stop() {
        List<Thread> snapshot;
        boolean firstStop;

        lifecycleLock.lock();
        try {
            if (!started) {
                return;
            }
            firstStop = running;
            running = false;
            snapshot = List.copyOf(workers);
        } finally {
            lifecycleLock.unlock();
        }
        queue.stop();

        Thread current = Thread.currentThread();
        boolean interrupted = false;
        if (!snapshot.contains(current)) {
            for (Thread worker : snapshot) {
                while (worker.isAlive()) {
                    try {
                        worker.join();
                    } catch (InterruptedException e) {
                        interrupted = true;
                    }
                }
            }
        }
        markStoppedIfDrained();

        if (interrupted) {
            current.interrupt();
        }
        if (firstStop) {
            log.info("MessageHandler stopped: processed={}, failed={}", processedCount.get(), failedCount.get());
        }
    }

    /**
     * {@link #stop()}과 동일.
     */
    @Override
    public void close() {
        stop();
    }

    /**
     * 실행 중인지 확인.
     *
     * <p>stop() 진행 중(워커 drain/join 중)에는 여전히 true입니다.</p>
     *
     * @return 실행 중이면 true
     */
    public boolean isRunning() {
        return started;
    }

    /**
     * 메시지 처리 함수 교체.
     *
     * <p>실행 중에도 호출 가능하며, 다음에 dequeue되는 메시지부터 새 함수가 사용됩니다.</p>
     *
     * @param messageProcessor 새 처리 함수 (null이면 기본 처리 함수로 복원)
     */
    public void setMessageProcessor(MessageProcessor messageProcessor) {
        processor.set(messageProcessor == null ? MessageProcessor.DEFAULT : messageProcessor);
    }

    /**
     * 설정된 워커 수.
     *
     * @return 워커 스레드 수
     */
    public int getWorkerCount() {
        return config.workerCount();
    }

    /**
     * 워커 루프 안에 있는 워커 수.
     *
     * <p>TERMINATE_WORKER 정책이나 Error로 종료된 워커는 제외됩니다. 락을 잡지 않으므로
     * 처리 함수 안에서 호출해도 안전합니다.</p>
     *
     * @return 살아있는 워커 수
     */
    public int getActiveWorkerCount() {
        return liveWorkers.get();
    }

    /**
     * 정상 처리된 메시지 수.
     *
     * @return 처리 카운트
     */
    public long getProcessedCount() {
        return processedCount.get();
    }

    /**
     * 처리 함수가 예외(또는 Error)를 던진 메시지 수.
     *
     * @return 실패 카운트
     */
    public long getFailedCount() {
        return failedCount.get();
    }

    /**
     * 설정 조회.
     *
     * @return 설정
     */
    public MessageHandlerConfig getConfig() {
        return config;
    }

    /**
     * 정지 요청 이후 모든 워커가 루프를 빠져나갔으면 started=false.
     */
    private void markStoppedIfDrained() {
        lifecycleLock.lock();
        try {
            if (started && !running && liveWorkers.get() == 0) {
                started = false;
                workers.clear();
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * 워커 루프.
     */
    private void runWorker() {
        log.debug("Worker {} started", Thread.currentThread().getName());
        try {
            while (running || !queue.isEmpty()) {
                Optional<Message> next = queue.dequeue();
                if (next.isEmpty()) {
                    // 큐 정지 + 비어있음 (또는 인터럽트)
                    break;
                }
                handle(next.get());
            }
        } finally {
            liveWorkers.decrementAndGet();
            markStoppedIfDrained();
            log.debug("Worker {} exited", Thread.currentThread().getName());
        }
    }

    /**
     * 메시지 하나 처리 (FailurePolicy 적용).
     *
     * <p>Error는 정책과 관계없이 카운트한 뒤 다시 던져 워커를 종료합니다.</p>
     *
     * @param message 처리할 메시지
     */
    private void handle(Message message) {
        try {
            processor.get().process(message);
            processedCount.incrementAndGet();
        } catch (RuntimeException e) {
            failedCount.incrementAndGet();
            if (config.failurePolicy() == FailurePolicy.TERMINATE_WORKER) {
                throw e;
            }
            log.error("Failed to process message {}", message.getId(), e);
        } catch (Error e) {
            failedCount.incrementAndGet();
            throw e;
        }
    }
}
