package com.ryuqq.gateway.application.gateway;

import com.ryuqq.gateway.adapter.inmemory.queue.InMemoryMessageQueue;
import com.ryuqq.gateway.adapter.runner.MessageHandler;
import com.ryuqq.gateway.adapter.runner.MessageHandlerConfig;
import com.ryuqq.gateway.application.message.EventMessage;
import com.ryuqq.gateway.application.state.ActiveState;
import com.ryuqq.gateway.application.state.ErrorState;
import com.ryuqq.gateway.application.state.InitState;
import com.ryuqq.gateway.core.message.Message;
import com.ryuqq.gateway.core.spi.MessageQueue;
import com.ryuqq.gateway.core.statemachine.StateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 메시지 큐, 워커 풀, 상태 머신을 연결하는 Gateway.
 *
 * <p>워커의 메시지 처리 함수가 상태 머신에 이벤트를 전달하여
 * 메시지 도착과 상태 전이를 연결합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * init ──init_complete──► active ──error_occurred──► error
 *                            ▲                          │
 *                            └───────── recover ────────┘
 * </pre>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submit(message) → queue.enqueue
 *   ↓ (worker thread)
 * processMessage(message):
 *   1. message.process()
 *   2. stats.processed++
 *   3. EventMessage(ERROR) → stats.errors++, triggerEvent("error_occurred", description)
 * </pre>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class Gateway implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Gateway.class);

    public static final String INIT_COMPLETE = "init_complete";
    public static final String ERROR_OCCURRED = "error_occurred";
    public static final String RECOVER = "recover";

    private final MessageQueue queue;
    private final MessageHandler handler;
    private final StateMachine stateMachine;
    private final GatewayStats stats = new GatewayStats();

    /**
     * 생성자 (워커 수만 지정).
     *
     * @param workerCount 워커 스레드 수
     */
    public Gateway(int workerCount) {
        this(new MessageHandlerConfig().withWorkerCount(workerCount).withThreadNamePrefix("gateway-worker"));
    }

    /**
     * 생성자.
     *
     * @param config 워커 풀 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public Gateway(MessageHandlerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.queue = new InMemoryMessageQueue();
        this.handler = new MessageHandler(queue, config);
        this.stateMachine = new StateMachine();

        stateMachine.addState(InitState.NAME, new InitState());
        stateMachine.addState(ActiveState.NAME, new ActiveState());
        stateMachine.addState(ErrorState.NAME, new ErrorState());

        stateMachine.addTransition(InitState.NAME, INIT_COMPLETE, ActiveState.NAME);
        stateMachine.addTransition(ActiveState.NAME, ERROR_OCCURRED, ErrorState.NAME);
        stateMachine.addTransition(ErrorState.NAME, RECOVER, ActiveState.NAME);
        stateMachine.setInitialState(InitState.NAME);

        stateMachine.setTransitionListener((from, to) -> {
            stats.recordTransition();
            log.info("State transition: {} → {}", from, to);
        });
        handler.setMessageProcessor(this::processMessage);
    }

    /**
     * Gateway 시작.
     *
     * <p>상태 머신을 시작하여 init 상태로 진입한 뒤 워커를 시작하고
     * init_complete 이벤트로 active 상태로 전이합니다.</p>
     *
     * <p>정지된 Gateway는 큐가 닫혀 있으므로 다시 시작할 수 없습니다.</p>
     *
     * @return 시작 성공 시 true, 이미 실행 중이거나 정지된 적이 있으면 false
     */
    public boolean start() {
        if (queue.isStopped() || !stateMachine.start()) {
            return false;
        }
        handler.start();
        stateMachine.triggerEvent(INIT_COMPLETE);
        log.info("Gateway started with {} workers", handler.getWorkerCount());
        return true;
    }

    /**
     * Gateway 정지.
     *
     * <p>워커 풀을 정지하여 이미 제출된 메시지를 모두 처리한 뒤 상태 머신을 정지합니다.</p>
     */
    public void stop() {
        handler.stop();
        stateMachine.stop();
        log.info("Gateway stopped: {}", stats);
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * 메시지 제출.
     *
     * <p>정지된 뒤 제출한 메시지는 조용히 버려집니다.</p>
     *
     * @param message 처리할 메시지
     */
    public void submit(Message message) {
        queue.enqueue(message);
    }

    /**
     * 워커에서 실행되는 메시지 처리 함수.
     *
     * @param message 처리할 메시지
     */
    void processMessage(Message message) {
        message.process();
        stats.recordProcessed();

        if (message instanceof EventMessage event && event.isError()) {
            stats.recordError();
            stateMachine.triggerEvent(ERROR_OCCURRED, event.getDescription());
        }
    }

    /**
     * 현재 상태 이름.
     *
     * @return 현재 상태 (정지 상태면 빈 문자열)
     */
    public String getCurrentState() {
        return stateMachine.getCurrentState();
    }

    public StateMachine getStateMachine() {
        return stateMachine;
    }

    public GatewayStats getStats() {
        return stats;
    }

    /**
     * 처리 대기 중인 메시지 수.
     *
     * @return 큐 크기
     */
    public int getPendingCount() {
        return queue.size();
    }
}
