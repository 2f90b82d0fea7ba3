package org.rtbsa.core.stream;

import org.rtbsa.core.buffer.PulseIds;
import org.rtbsa.core.buffer.RingBuffer;
import org.rtbsa.core.error.ConfigurationException;
import org.rtbsa.core.error.StreamInitException;
import org.rtbsa.core.model.*;
import org.rtbsa.core.ports.MissedPulseListener;
import org.rtbsa.core.spi.StreamPorts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Streams one BSA channel in real time without monitoring its history buffer after start-up.
 * Pulses missed between two updates are padded with NaN.
 *
 * <p>Seeded from the history buffer that fills fastest at the current beam rate, then fed by live
 * value updates. {@link #onValueUpdate} and {@link #snapshot} share one lock, so a snapshot's
 * values and pulse ID always come from the same update.
 *
 * <pre>{@code
 * var stream = new SingleStream(StreamConfig.of("BLEN:LI21:265:AIMAX", "NC_HXR"), ports);
 * Snapshot s = stream.snapshot();
 * }</pre>
 */
public final class SingleStream implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SingleStream.class);

    private final StreamPorts ports;
    private final MissedPulseListener missedPulses;
    private final ReentrantLock lock = new ReentrantLock();

    // ---- guarded by lock ----
    private final RingBuffer buffer = new RingBuffer(PulseIds.BUFFER_LENGTH);
    private int latestPulseId;
    private int previousPulseId;
    private AutoCloseable valueHandle;
    private AutoCloseable rateHandle;

    private volatile StreamConfig config;
    private volatile RateState rate = RateState.UNDEFINED;
    private volatile boolean usable;
    // bumped on every (re)initialization and stop; callbacks from older subscriptions are ignored
    private volatile long generation;

    public SingleStream(StreamConfig config, StreamPorts ports) {
        this(config, ports, MissedPulseListener.LOGGING, true);
    }

    public SingleStream(StreamConfig config, StreamPorts ports, MissedPulseListener missedPulses) {
        this(config, ports, missedPulses, true);
    }

    /**
     * @param raiseOnFailure when false a failed start-up leaves the stream disabled instead of
     *                       throwing {@link StreamInitException}
     */
    public SingleStream(StreamConfig config, StreamPorts ports, MissedPulseListener missedPulses,
                        boolean raiseOnFailure) {
        this.config = Objects.requireNonNull(config, "config");
        this.ports = Objects.requireNonNull(ports, "ports");
        this.missedPulses = missedPulses != null ? missedPulses : MissedPulseListener.NO_OP;
        initialize(raiseOnFailure);
    }

    // ---- Lifecycle ----

    /**
     * Drops the current subscriptions and reseeds the buffer from the history buffer matching the
     * current beam rate. Live updates are subscribed only once the seed is installed.
     */
    public void initialize(boolean raiseOnFailure) {
        var cfg = config;
        lock.lock();
        try {
            detach();
            long gen = generation;
            buffer.seed(null);

            String rateAddress = cfg.beamline().rateSourceAddress();
            rateHandle = ports.rates().subscribeRate(rateAddress, v -> {
                if (generation == gen) onRateUpdate(v);
            });
            onRateUpdate(ports.rates().currentRate(rateAddress));

            var r = rate;
            String historyAddress = cfg.beamline().historyAddress(cfg.channel(), r.sampleRate());
            HistoryBuffer history = ports.history().fetch(historyAddress);
            if (history == null) {
                throw new IllegalStateException("no history returned for " + historyAddress);
            }
            buffer.seed(history.values());
            latestPulseId = PulseIds.fromNanos(history.timestampNanos());
            previousPulseId = r.isDefined()
                    ? PulseIds.wrap(latestPulseId - (int) Math.round(r.ticksPerSample()))
                    : latestPulseId;

            valueHandle = ports.subscribe().subscribe(List.of(cfg.channel()), new ValueSubscriber(cfg.channel(), gen));
            usable = true;
            LOG.debug("{} {} stream seeded from {} at pulse {} (rate={})",
                    cfg.beamline(), cfg.channel(), historyAddress, latestPulseId, r.sampleRate());
        } catch (Exception e) {
            detach();
            if (raiseOnFailure) {
                LOG.error("{} stream init for {} failed", cfg.beamline(), cfg.channel());
                throw new StreamInitException(cfg.beamline() + " stream init for " + cfg.channel() + " failed", e);
            }
            LOG.warn("Invalid stream definition: {} {} ({})", cfg.beamline(), cfg.channel(), e.toString());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Validates {@code next}, tears the stream down and rebuilds it. A failed rebuild leaves the
     * stream disabled rather than throwing, so multi-field changes can pass through invalid
     * intermediate combinations.
     */
    public void reconfigure(StreamConfig next) {
        this.config = Objects.requireNonNull(next, "config");
        initialize(false);
    }

    public void setChannel(String channel) {
        reconfigure(config.withChannel(channel));
    }

    public void setBeamline(Beamline beamline) {
        if (beamline == null) throw new ConfigurationException("beamline must be set");
        reconfigure(config.withBeamline(beamline));
    }

    public void setBeamline(String beamline) {
        setBeamline(Beamline.parse(beamline));
    }

    /** Unsubscribes from values and rate. No update is applied once this returns. */
    public void stop() {
        lock.lock();
        try {
            detach();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        stop();
    }

    private void detach() {
        generation++;
        usable = false;
        closeQuietly(valueHandle, "value");
        closeQuietly(rateHandle, "rate");
        valueHandle = null;
        rateHandle = null;
    }

    private void closeQuietly(AutoCloseable handle, String what) {
        if (handle == null) return;
        try {
            handle.close();
        } catch (Exception e) {
            LOG.warn("Closing {} subscription for {} failed: {}", what, config.channel(), e.toString());
        }
    }

    // ---- Updates ----

    /**
     * Appends {@code value}, padding any pulses missed since the last update with NaN.
     * Runs on the transport's delivery thread and never throws.
     */
    public void onValueUpdate(double value, long timestampNanos) {
        apply(value, timestampNanos, -1);
    }

    private void apply(double value, long timestampNanos, long gen) {
        try {
            var r = rate;
            if (!r.isDefined()) return; // rate not known yet, nothing to place the value against

            int newId = PulseIds.fromNanos(timestampNanos);
            MissedPulseEvent gap = null;
            lock.lock();
            try {
                if (!usable || (gen >= 0 && gen != generation)) return;
                double expected = PulseIds.wrap(latestPulseId + r.ticksPerSample());
                int missed = (int) (PulseIds.distance(expected, newId) / r.ticksPerSample());
                if (missed > 0) {
                    buffer.shift(missed);
                    gap = new MissedPulseEvent(config.channel(), missed, latestPulseId, newId);
                }
                buffer.push(value);
                previousPulseId = latestPulseId;
                latestPulseId = newId;
            } finally {
                lock.unlock();
            }
            if (gap != null) missedPulses.onMissedPulses(gap);
        } catch (RuntimeException e) {
            LOG.error("Update for {} dropped", config.channel(), e);
        }
    }

    /** Replaces the sample rate and its derived constants. The buffer is left untouched. */
    public void onRateUpdate(double value) {
        this.rate = RateState.of(value, config.beamline().maxRateHz());
    }

    // ---- Reads ----

    public Snapshot snapshot() {
        lock.lock();
        try {
            return new Snapshot(buffer.copy(), latestPulseId);
        } finally {
            lock.unlock();
        }
    }

    public int latestPulseId() {
        lock.lock();
        try {
            return latestPulseId;
        } finally {
            lock.unlock();
        }
    }

    public int previousPulseId() {
        lock.lock();
        try {
            return previousPulseId;
        } finally {
            lock.unlock();
        }
    }

    public StreamConfig config() {
        return config;
    }

    public String channel() {
        return config.channel();
    }

    public Beamline beamline() {
        return config.beamline();
    }

    public boolean isUsable() {
        return usable;
    }

    public RateState rateState() {
        return rate;
    }

    public double sampleRate() {
        return rate.sampleRate();
    }

    public double sampleSpacing() {
        return rate.sampleSpacing();
    }

    public double ticksPerSample() {
        return rate.ticksPerSample();
    }

    public double bufferModulus() {
        return rate.bufferModulus();
    }

    private final class ValueSubscriber implements Flow.Subscriber<Sample> {
        private final String channel;
        private final long gen;

        ValueSubscriber(String channel, long gen) {
            this.channel = channel;
            this.gen = gen;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(Sample item) {
            if (generation != gen || !channel.equals(item.channel())) return;
            apply(item.value(), item.timestampNanos(), gen);
        }

        @Override
        public void onError(Throwable throwable) {
            LOG.warn("Value subscription for {} failed: {}", channel, throwable.toString());
        }

        @Override
        public void onComplete() {
            LOG.debug("Value subscription for {} completed", channel);
        }
    }
}
