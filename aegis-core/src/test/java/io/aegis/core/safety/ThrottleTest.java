package io.aegis.core.safety;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class ThrottleTest {

    @Test
    void shouldSpaceConsecutiveAcquires() throws Exception {
        Throttle throttle = new Throttle(Duration.ofMillis(200));

        long started = System.nanoTime();
        throttle.acquire();
        throttle.acquire();
        throttle.acquire();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(elapsedMs).isGreaterThanOrEqualTo(380);
    }

    @Test
    void shouldNotDelayFirstAcquire() throws Exception {
        Throttle throttle = new Throttle(Duration.ofSeconds(10));

        long started = System.nanoTime();
        throttle.acquire();

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(1));
    }

    @Test
    void shouldPassThroughWithZeroInterval() throws Exception {
        Throttle throttle = new Throttle(Duration.ZERO);

        long started = System.nanoTime();
        for (int i = 0; i < 100; i++) {
            throttle.acquire();
        }

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(1));
    }

    @Test
    void shouldUpdateInterval() {
        Throttle throttle = new Throttle(Duration.ofMillis(5));

        throttle.setInterval(Duration.ofMillis(50));

        assertThat(throttle.interval()).isEqualTo(Duration.ofMillis(50));
        assertThatThrownBy(() -> throttle.setInterval(Duration.ofMillis(-1))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldSpaceConcurrentCallersByFullInterval() throws Exception {
        Duration interval = Duration.ofMillis(100);
        Throttle throttle = new Throttle(interval);
        int callers = 6;
        List<long[]> grants = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch ready = new CountDownLatch(callers);
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    ready.countDown();
                    go.await();
                    long slot = throttle.acquire();
                    grants.add(new long[] {slot, System.nanoTime()});
                    return null;
                }));
            }
            ready.await();
            go.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<long[]> sorted = new ArrayList<>(grants);
        sorted.sort((a, b) -> Long.compare(a[0], b[0]));
        assertThat(sorted).hasSize(callers);
        for (int i = 0; i < sorted.size(); i++) {
            assertThat(sorted.get(i)[1]).as("caller %d returned before its slot", i).isGreaterThanOrEqualTo(sorted.get(i)[0]);
            if (i > 0) {
                assertThat(sorted.get(i)[0] - sorted.get(i - 1)[0])
                    .as("gap before start %d", i)
                    .isGreaterThanOrEqualTo(interval.toNanos());
            }
        }
    }

    @Test
    void shouldHandBackSlotOfInterruptedCaller() throws Exception {
        Duration interval = Duration.ofMillis(400);
        Throttle throttle = new Throttle(interval);
        long first = throttle.acquire();

        AtomicBoolean interrupted = new AtomicBoolean();
        Thread waiter = new Thread(() -> {
            try {
                throttle.acquire();
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
        });
        waiter.start();
        while (waiter.getState() != Thread.State.TIMED_WAITING && waiter.isAlive()) {
            Thread.onSpinWait();
        }
        waiter.interrupt();
        waiter.join(5_000);

        long next = throttle.acquire();

        assertThat(interrupted).isTrue();
        assertThat(next - first)
            .isGreaterThanOrEqualTo(interval.toNanos())
            .isLessThan(interval.multipliedBy(2).toNanos());
    }
}
