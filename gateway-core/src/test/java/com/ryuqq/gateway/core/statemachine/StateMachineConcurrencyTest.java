package com.ryuqq.gateway.core.statemachine;

import com.ryuqq.gateway.core.model.EventData;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * StateMachine 동시성 테스트.
 *
 * <p>여러 스레드가 동시에 triggerEvent를 호출해도 전이가 직렬화되고,
 * 콜백 안에서 머신을 다시 호출해도 교착 상태가 없는지 검증합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class StateMachineConcurrencyTest {

    private static final int THREADS = 8;
    private static final int EVENTS_PER_THREAD = 500;

    private static State named(String name) {
        return () -> name;
    }

    @Test
    @Timeout(10)
    void 동시_triggerEvent는_하나씩만_적용되고_리스너_호출_수와_히스토리가_일치() throws Exception {
        // given
        StateMachine machine = new StateMachine(10_000);
        machine.addState("A", named("A"));
        machine.addState("B", named("B"));
        machine.addTransition("A", "toggle", "B");
        machine.addTransition("B", "toggle", "A");
        machine.setInitialState("A");

        List<String> observed = new ArrayList<>();
        machine.setTransitionListener((from, to) -> {
            synchronized (observed) {
                observed.add(from + "->" + to);
            }
        });
        machine.start();

        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger applied = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // when
        for (int t = 0; t < THREADS; t++) {
            futures.add(pool.submit(() -> {
                go.await();
                for (int i = 0; i < EVENTS_PER_THREAD; i++) {
                    if (machine.triggerEvent("toggle")) {
                        applied.incrementAndGet();
                    }
                }
                return null;
            }));
        }
        go.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // then
        List<String> history = machine.getStateHistory();
        assertThat(applied.get()).isEqualTo(THREADS * EVENTS_PER_THREAD);
        assertThat(history).hasSize(applied.get() + 1);
        for (int i = 1; i < history.size(); i++) {
            assertThat(history.get(i)).isNotEqualTo(history.get(i - 1));
        }
        synchronized (observed) {
            assertThat(observed).hasSize(applied.get());
            assertThat(observed).allMatch(entry -> entry.equals("A->B") || entry.equals("B->A"));
        }
        assertThat(machine.getCurrentState()).isEqualTo(history.get(history.size() - 1));
    }

    @Test
    @Timeout(5)
    void onEnter_안에서_triggerEvent를_호출해도_교착_상태_없음() {
        // given
        StateMachine machine = new StateMachine();
        machine.addState("A", named("A"));
        machine.addState("C", named("C"));
        machine.addState("B", new State() {
            @Override
            public String getName() {
                return "B";
            }

            @Override
            public void onEnter(EventData context) {
                machine.triggerEvent("next");
            }
        });
        machine.addTransition("A", "go", "B");
        machine.addTransition("B", "next", "C");
        machine.setInitialState("A");
        machine.start();

        // when
        boolean transitioned = machine.triggerEvent("go");

        // then
        assertThat(transitioned).isTrue();
        assertThat(machine.getCurrentState()).isEqualTo("C");
        assertThat(machine.getStateHistory()).containsExactly("A", "B", "C");
    }

    @Test
    @Timeout(5)
    void 리스너_안에서_조회_메서드를_호출해도_교착_상태_없음() {
        // given
        StateMachine machine = new StateMachine();
        machine.addState("A", named("A"));
        machine.addState("B", named("B"));
        machine.addTransition("A", "go", "B");
        machine.setInitialState("A");
        List<String> seen = new ArrayList<>();
        machine.setTransitionListener((from, to) -> seen.add(machine.getCurrentState()));
        machine.start();

        // when
        machine.triggerEvent("go");

        // then
        assertThat(seen).containsExactly("B");
    }

    @Test
    @Timeout(5)
    void 대기_중_다른_스레드가_전이하면_새_상태의_onEvent부터_다시_처리() throws Exception {
        // given
        CountDownLatch parked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean firstCaller = new AtomicBoolean(true);
        AtomicInteger bOnEventCalls = new AtomicInteger();

        StateMachine machine = new StateMachine();
        machine.addState("A", new State() {
            @Override
            public String getName() {
                return "A";
            }

            @Override
            public boolean onEvent(String eventName, EventData data) {
                if (firstCaller.compareAndSet(true, false)) {
                    parked.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return false;
            }
        });
        machine.addState("B", new State() {
            @Override
            public String getName() {
                return "B";
            }

            @Override
            public boolean onEvent(String eventName, EventData data) {
                bOnEventCalls.incrementAndGet();
                return "go".equals(eventName);
            }
        });
        machine.addState("C", named("C"));
        machine.addTransition("A", "go", "B");
        machine.addTransition("B", "go", "C");
        machine.setInitialState("A");
        machine.start();

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> late = pool.submit(() -> machine.triggerEvent("go"));
            assertThat(parked.await(2, TimeUnit.SECONDS)).isTrue();

            // when
            boolean first = machine.triggerEvent("go");
            release.countDown();
            boolean lateResult = late.get(2, TimeUnit.SECONDS);

            // then
            assertThat(first).isTrue();
            assertThat(lateResult).isTrue();
            assertThat(machine.getCurrentState()).isEqualTo("B");
            assertThat(machine.getStateHistory()).containsExactly("A", "B");
            assertThat(bOnEventCalls.get()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
