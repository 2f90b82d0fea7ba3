package org.rtbsa.core.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Periodically reads a stream (snapshot or alignment) and hands the result to a consumer,
 * like a display refresh timer.
 */
public final class RefreshScheduler implements AutoCloseable {
    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(100);

    private static final Logger LOG = LoggerFactory.getLogger(RefreshScheduler.class);

    private final ScheduledExecutorService ses =
            Executors.newSingleThreadScheduledExecutor(r -> {
                var t = new Thread(r, "bsa-refresh");
                t.setDaemon(true);
                return t;
            });
    private ScheduledFuture<?> task;

    public <T> AutoCloseable start(Supplier<T> read, Consumer<T> onRefresh) {
        return start(read, DEFAULT_INTERVAL, onRefresh);
    }

    public synchronized <T> AutoCloseable start(Supplier<T> read, Duration interval, Consumer<T> onRefresh) {
        Objects.requireNonNull(read);
        Objects.requireNonNull(interval);
        Objects.requireNonNull(onRefresh);
        stop();

        task = ses.scheduleAtFixedRate(() -> {
            try {
                onRefresh.accept(read.get());
            } catch (RuntimeException e) {
                LOG.warn("Refresh failed", e);
            }
        }, 0, interval.toMillis(), TimeUnit.MILLISECONDS);

        return this::stop;
    }

    private synchronized void stop() {
        if (task != null) task.cancel(false);
        task = null;
    }

    @Override
    public void close() {
        stop();
        ses.shutdownNow();
    }
}
