package com.ryuqq.gateway.adapter.runner;

import com.ryuqq.gateway.adapter.inmemory.queue.InMemoryMessageQueue;
import com.ryuqq.gateway.core.message.Message;
import com.ryuqq.gateway.core.spi.MessageQueue;
import com.ryuqq.gateway.testkit.fixture.TestMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * MessageHandler 유닛 테스트.
 *
 * <p>MessageHandler의 핵심 동작을 검증합니다:</p>
 * <ul>
 *   <li>N개 워커가 큐의 모든 메시지를 정확히 한 번씩 처리</li>
 *   <li>stop() 시 drain 후 종료</li>
 *   <li>처리 함수 교체</li>
 *   <li>FailurePolicy별 예외 처리</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class MessageHandlerTest {

    private InMemoryMessageQueue queue;
    private MessageHandler handler;

    @BeforeEach
    void setUp() {
        queue = new InMemoryMessageQueue();
    }

    @AfterEach
    void tearDown() {
        if (handler != null) {
            handler.stop();
        }
    }

    /**
     * 조건이 만족될 때까지 최대 timeoutMillis 동안 대기.
     */
    private static boolean awaitCondition(BooleanSupplier condition, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }

    // ============================================================
    // 1. 처리 보장
    // ============================================================

    @Test
    @Timeout(10)
    void 워커_4개로_100개_메시지를_정확히_100번_처리() {
        // given
        AtomicInteger counter = new AtomicInteger();
        handler = new MessageHandler(queue, 4);
        handler.setMessageProcessor(message -> counter.incrementAndGet());
        handler.start();

        // when
        for (int i = 0; i < 100; i++) {
            queue.enqueue(TestMessage.of("msg-" + i));
        }
        handler.stop();

        // then
        assertThat(counter.get()).isEqualTo(100);
        assertThat(handler.getProcessedCount()).isEqualTo(100);
        assertThat(handler.getFailedCount()).isZero();
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    @Timeout(10)
    void 각_메시지는_하나의_워커에서만_처리됨() {
        // given
        Set<String> seen = ConcurrentHashMap.newKeySet();
        AtomicInteger duplicates = new AtomicInteger();
        handler = new MessageHandler(queue, 8);
        handler.setMessageProcessor(message -> {
            if (!seen.add(message.getId())) {
                duplicates.incrementAndGet();
            }
        });
        handler.start();

        // when
        for (int i = 0; i < 2_000; i++) {
            queue.enqueue(TestMessage.of("msg-" + i));
        }
        handler.stop();

        // then
        assertThat(duplicates.get()).isZero();
        assertThat(seen).hasSize(2_000);
    }

    @Test
    @Timeout(10)
    void 기본_처리_함수는_message_process를_호출() {
        // given
        TestMessage message = TestMessage.of("default");
        handler = new MessageHandler(queue, 1);
        handler.start();

        // when
        queue.enqueue(message);
        handler.stop();

        // then
        assertThat(message.getProcessCount()).isEqualTo(1);
    }

    @Test
    @Timeout(10)
    void 워커가_0개면_아무것도_처리하지_않음() {
        // given
        AtomicInteger counter = new AtomicInteger();
        handler = new MessageHandler(queue, 0);
        handler.setMessageProcessor(message -> counter.incrementAndGet());

        // when
        handler.start();
        for (int i = 0; i < 5; i++) {
            queue.enqueue(TestMessage.of("msg-" + i));
        }
        handler.stop();

        // then
        assertThat(counter.get()).isZero();
        assertThat(queue.size()).isEqualTo(5);
        assertThat(handler.getWorkerCount()).isZero();
    }

    @Test
    @Timeout(10)
    void stop은_남은_메시지를_모두_처리한_뒤_반환() {
        // given
        AtomicInteger counter = new AtomicInteger();
        handler = new MessageHandler(queue, 2);
        handler.setMessageProcessor(message -> {
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            counter.incrementAndGet();
        });
        handler.start();
        for (int i = 0; i < 50; i++) {
            queue.enqueue(TestMessage.of("msg-" + i));
        }

        // when
        handler.stop();

        // then
        assertThat(counter.get()).isEqualTo(50);
        assertThat(handler.isRunning()).isFalse();
        assertThat(handler.getActiveWorkerCount()).isZero();
    }

    // ============================================================
    // 2. 생명주기
    // ============================================================

    @Test
    @Timeout(10)
    void start와_stop은_여러_번_호출해도_안전() {
        // given
        MessageQueue mockQueue = mock(MessageQueue.class);
        handler = new MessageHandler(mockQueue, 2);

        // when
        handler.start();
        handler.start();
        handler.stop();
        handler.stop();

        // then
        assertThat(handler.isRunning()).isFalse();
        verify(mockQueue, times(1)).stop();
    }

    @Test
    @Timeout(10)
    void isRunning은_start_후_true_stop_후_false() {
        // given
        handler = new MessageHandler(queue, 1);
        assertThat(handler.isRunning()).isFalse();

        // when
        handler.start();

        // then
        assertThat(handler.isRunning()).isTrue();
        assertThat(handler.getActiveWorkerCount()).isEqualTo(1);

        handler.close();
        assertThat(handler.isRunning()).isFalse();
    }

    @Test
    @Timeout(10)
    void stop_진행_중에는_isRunning이_true_모든_워커_종료_후_false() throws Exception {
        // given
        CountDownLatch inProcess = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        handler = new MessageHandler(queue, 1);
        handler.setMessageProcessor(message -> {
            inProcess.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        handler.start();
        queue.enqueue(TestMessage.of("slow"));
        assertThat(inProcess.await(2, TimeUnit.SECONDS)).isTrue();

        // when
        Thread stopper = new Thread(handler::stop);
        stopper.start();
        assertThat(awaitCondition(queue::isStopped, 2_000)).isTrue();

        // then
        assertThat(handler.isRunning()).isTrue();
        release.countDown();
        stopper.join(2_000);
        assertThat(handler.isRunning()).isFalse();
        assertThat(handler.getProcessedCount()).isEqualTo(1);
    }

    @Test
    @Timeout(10)
    void 워커_스레드는_설정한_이름_접두사를_가진_데몬_스레드() {
        // given
        List<String> names = new CopyOnWriteArrayList<>();
        AtomicBoolean daemon = new AtomicBoolean();
        MessageHandlerConfig config = new MessageHandlerConfig().withWorkerCount(1).withThreadNamePrefix("test-worker");
        handler = new MessageHandler(queue, config);
        handler.setMessageProcessor(message -> {
            names.add(Thread.currentThread().getName());
            daemon.set(Thread.currentThread().isDaemon());
        });
        handler.start();

        // when
        queue.enqueue(TestMessage.of("m"));
        handler.stop();

        // then
        assertThat(names).containsExactly("test-worker-1");
        assertThat(daemon.get()).isTrue();
        assertThat(handler.getConfig()).isEqualTo(config);
    }

    @Test
    @Timeout(10)
    void 처리_함수_안에서_stop을_호출하면_해당_워커가_종료된_뒤_isRunning이_false() throws Exception {
        // given
        CountDownLatch stopReturned = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean runningInsideProcessor = new AtomicBoolean();
        AtomicInteger activeInsideProcessor = new AtomicInteger();
        handler = new MessageHandler(queue, 1);
        handler.setMessageProcessor(message -> {
            handler.stop();
            runningInsideProcessor.set(handler.isRunning());
            activeInsideProcessor.set(handler.getActiveWorkerCount());
            stopReturned.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        handler.start();

        // when
        queue.enqueue(TestMessage.of("stop-me"));
        assertThat(stopReturned.await(2, TimeUnit.SECONDS)).isTrue();

        // then
        assertThat(runningInsideProcessor.get()).isTrue();
        assertThat(activeInsideProcessor.get()).isEqualTo(1);
        assertThat(handler.isRunning()).isTrue();
        assertThat(queue.isStopped()).isTrue();

        release.countDown();
        assertThat(awaitCondition(() -> !handler.isRunning(), 2_000)).isTrue();
        assertThat(handler.getActiveWorkerCount()).isZero();
    }

    @Test
    @Timeout(10)
    void 여러_워커가_동시에_stop을_호출해도_교착_상태_없음() throws Exception {
        // given
        CountDownLatch bothInside = new CountDownLatch(2);
        handler = new MessageHandler(queue, 2);
        handler.setMessageProcessor(message -> {
            bothInside.countDown();
            try {
                bothInside.await(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            handler.stop();
        });
        handler.start();

        // when
        queue.enqueue(TestMessage.of("m1"));
        queue.enqueue(TestMessage.of("m2"));

        // then
        assertThat(awaitCondition(() -> !handler.isRunning(), 5_000)).isTrue();
        assertThat(handler.getProcessedCount()).isEqualTo(2);
    }

    @Test
    @Timeout(10)
    void 외부_stop_진행_중_처리_함수가_상태를_조회해도_stop이_반환됨() throws Exception {
        // given
        CountDownLatch inProcess = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger observedActive = new AtomicInteger(-1);
        handler = new MessageHandler(queue, 1);
        handler.setMessageProcessor(message -> {
            inProcess.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            observedActive.set(handler.getActiveWorkerCount());
            handler.start();
            handler.stop();
        });
        handler.start();
        queue.enqueue(TestMessage.of("m"));
        assertThat(inProcess.await(2, TimeUnit.SECONDS)).isTrue();

        // when
        Thread stopper = new Thread(handler::stop);
        stopper.start();
        assertThat(awaitCondition(queue::isStopped, 2_000)).isTrue();
        release.countDown();
        stopper.join(3_000);

        // then
        assertThat(stopper.isAlive()).isFalse();
        assertThat(observedActive.get()).isEqualTo(1);
        assertThat(handler.isRunning()).isFalse();
    }

    @Test
    void 생성자_의존성이_null이면_예외() {
        assertThatThrownBy(() -> new MessageHandler(null, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("queue cannot be null");
        assertThatThrownBy(() -> new MessageHandler(queue, (MessageHandlerConfig) null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
    }

    // ============================================================
    // 3. 처리 함수 교체
    // ============================================================

    @Test
    @Timeout(10)
    void 실행_중_처리_함수를_교체하면_다음_메시지부터_새_함수_사용() throws Exception {
        // given
        List<String> first = new CopyOnWriteArrayList<>();
        List<String> second = new CopyOnWriteArrayList<>();
        handler = new MessageHandler(queue, 1);
        handler.setMessageProcessor(message -> first.add(message.getId()));
        handler.start();

        queue.enqueue(TestMessage.of("m1"));
        assertThat(awaitCondition(() -> first.size() == 1, 2_000)).isTrue();

        // when
        handler.setMessageProcessor(message -> second.add(message.getId()));
        queue.enqueue(TestMessage.of("m2"));
        handler.stop();

        // then
        assertThat(first).containsExactly("m1");
        assertThat(second).containsExactly("m2");
    }

    @Test
    @Timeout(10)
    void 처리_함수를_null로_설정하면_기본_처리_함수로_복원() {
        // given
        TestMessage message = TestMessage.of("m");
        handler = new MessageHandler(queue, 1);
        handler.setMessageProcessor(m -> { });
        handler.setMessageProcessor(null);
        handler.start();

        // when
        queue.enqueue(message);
        handler.stop();

        // then
        assertThat(message.getProcessCount()).isEqualTo(1);
    }

    // ============================================================
    // 4. FailurePolicy
    // ============================================================

    @Test
    @Timeout(10)
    void LOG_AND_CONTINUE_예외가_발생해도_워커는_계속_처리() {
        // given
        handler = new MessageHandler(queue, 1);
        TestMessage ok = TestMessage.of("ok");
        handler.start();

        // when
        queue.enqueue(TestMessage.failing("bad-1"));
        queue.enqueue(TestMessage.failing("bad-2"));
        queue.enqueue(ok);
        handler.stop();

        // then
        assertThat(handler.getFailedCount()).isEqualTo(2);
        assertThat(handler.getProcessedCount()).isEqualTo(1);
        assertThat(ok.getProcessCount()).isEqualTo(1);
    }

    @Test
    @Timeout(10)
    void Error는_정책과_관계없이_실패로_집계되고_워커를_종료() throws Exception {
        // given
        handler = new MessageHandler(queue, 2);
        handler.setMessageProcessor(message -> {
            if (message.getId().equals("fatal")) {
                throw new AssertionError("fatal");
            }
        });
        handler.start();

        // when
        queue.enqueue(TestMessage.of("fatal"));

        // then
        assertThat(awaitCondition(() -> handler.getActiveWorkerCount() == 1, 2_000)).isTrue();
        assertThat(handler.getFailedCount()).isEqualTo(1);

        queue.enqueue(TestMessage.of("ok"));
        handler.stop();
        assertThat(handler.getProcessedCount()).isEqualTo(1);
        assertThat(handler.isRunning()).isFalse();
    }

    @Test
    @Timeout(10)
    void TERMINATE_WORKER_예외가_발생한_워커만_종료() throws Exception {
        // given
        MessageHandlerConfig config = new MessageHandlerConfig()
            .withWorkerCount(2)
            .withFailurePolicy(FailurePolicy.TERMINATE_WORKER);
        handler = new MessageHandler(queue, config);
        handler.start();
        assertThat(handler.getActiveWorkerCount()).isEqualTo(2);

        // when
        queue.enqueue(TestMessage.failing("poison"));

        // then
        assertThat(awaitCondition(() -> handler.getActiveWorkerCount() == 1, 2_000)).isTrue();
        assertThat(handler.getFailedCount()).isEqualTo(1);

        TestMessage ok = TestMessage.of("after");
        queue.enqueue(ok);
        handler.stop();
        assertThat(ok.getProcessCount()).isEqualTo(1);
        assertThat(handler.getProcessedCount()).isEqualTo(1);
    }

    @Test
    @Timeout(10)
    void 처리_함수에_전달되는_메시지는_큐에_넣은_그_인스턴스() {
        // given
        List<Message> received = new CopyOnWriteArrayList<>();
        TestMessage message = TestMessage.of("same");
        handler = new MessageHandler(queue, 1);
        handler.setMessageProcessor(received::add);
        handler.start();

        // when
        queue.enqueue(message);
        handler.stop();

        // then
        assertThat(received).containsExactly(message);
    }
}
