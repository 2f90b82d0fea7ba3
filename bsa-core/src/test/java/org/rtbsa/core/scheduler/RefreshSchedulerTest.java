package org.rtbsa.core.scheduler;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RefreshSchedulerTest {

    @Test
    void deliversReadsPeriodically() throws Exception {
        var latch = new CountDownLatch(3);
        var counter = new AtomicInteger();
        try (var scheduler = new RefreshScheduler()) {
            scheduler.start(counter::incrementAndGet, Duration.ofMillis(5), v -> latch.countDown());
            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        }
        assertThat(counter.get()).isGreaterThanOrEqualTo(3);
    }

    @Test
    void failingTickDoesNotCancelTheSchedule() throws Exception {
        var latch = new CountDownLatch(3);
        var calls = new AtomicInteger();
        try (var scheduler = new RefreshScheduler()) {
            scheduler.start(() -> {
                if (calls.incrementAndGet() == 1) throw new IllegalStateException("first read fails");
                return calls.get();
            }, Duration.ofMillis(5), v -> latch.countDown());
            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    void handleStopsRefreshing() throws Exception {
        var calls = new AtomicInteger();
        try (var scheduler = new RefreshScheduler()) {
            var handle = scheduler.start(calls::incrementAndGet, Duration.ofMillis(5), v -> { });
            Thread.sleep(50);
            handle.close();
            Thread.sleep(20);
            int after = calls.get();
            Thread.sleep(50);
            assertThat(calls.get()).isEqualTo(after);
        }
    }
}
