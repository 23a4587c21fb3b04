package com.tradepilot.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradepilot.engine.InstrumentLane;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Serial execution per instrument on top of a shared multi-threaded pool. */
class InstrumentLaneTest {

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("Tasks run one at a time in submission order")
    void serialInOrder() {
        InstrumentLane lane = new InstrumentLane("BTC-USDT", pool);
        List<Integer> order = new CopyOnWriteArrayList<>();
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();

        for (int i = 0; i < 50; i++) {
            int n = i;
            lane.submit(() -> {
                maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
                order.add(n);
                concurrent.decrementAndGet();
            });
        }

        assertThat(lane.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(order).hasSize(50).isSorted();
        assertThat(maxConcurrent.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Different lanes run in parallel")
    void lanesInParallel() throws InterruptedException {
        InstrumentLane btc = new InstrumentLane("BTC-USDT", pool);
        InstrumentLane eth = new InstrumentLane("ETH-USDT", pool);
        CountDownLatch bothRunning = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);

        Runnable task = () -> {
            bothRunning.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        btc.submit(task);
        eth.submit(task);

        assertThat(bothRunning.await(5, TimeUnit.SECONDS)).isTrue();
        release.countDown();
        assertThat(btc.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(eth.awaitIdle(Duration.ofSeconds(5))).isTrue();
    }

    @Test
    @DisplayName("A failing task does not stop the lane")
    void failureIsolated() {
        InstrumentLane lane = new InstrumentLane("BTC-USDT", pool);
        AtomicInteger ran = new AtomicInteger();

        lane.submit(() -> {
            throw new IllegalStateException("boom");
        });
        lane.submit(ran::incrementAndGet);

        assertThat(lane.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(ran.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("A closed lane refuses tasks and drops queued ones")
    void closeDropsQueued() throws InterruptedException {
        InstrumentLane lane = new InstrumentLane("BTC-USDT", pool);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger ran = new AtomicInteger();

        lane.submit(() -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        lane.submit(ran::incrementAndGet);
        lane.submit(ran::incrementAndGet);

        int dropped = lane.close();
        release.countDown();

        assertThat(dropped).isEqualTo(2);
        assertThat(lane.submit(ran::incrementAndGet)).isFalse();
        assertThat(lane.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(ran.get()).isZero();
        assertThat(lane.isClosed()).isTrue();
    }

    @Test
    @DisplayName("awaitIdle returns only after every queued task has run")
    void awaitIdleCoversQueuedTasks() {
        InstrumentLane lane = new InstrumentLane("BTC-USDT", pool);
        AtomicInteger ran = new AtomicInteger();

        for (int i = 0; i < 200; i++) {
            lane.submit(ran::incrementAndGet);
        }

        assertThat(lane.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(ran.get()).isEqualTo(200);
        assertThat(lane.queuedTasks()).isZero();
        assertThat(lane.isBusy()).isFalse();
    }

    @Test
    @DisplayName("A pool rejection leaves the lane idle with the task still queued")
    void rejectedByPool() {
        Executor rejecting = command -> {
            throw new RejectedExecutionException("pool shut down");
        };
        InstrumentLane lane = new InstrumentLane("BTC-USDT", rejecting);

        assertThat(lane.submit(() -> {})).isTrue();

        assertThat(lane.isBusy()).isFalse();
        assertThat(lane.queuedTasks()).isEqualTo(1);
        assertThat(lane.awaitIdle(Duration.ofMillis(50))).isFalse();
    }
}
