package org.rtbsa.core.stream;

import org.rtbsa.core.error.BsaException;
import org.rtbsa.core.error.ConfigurationException;
import org.rtbsa.core.model.*;
import org.rtbsa.core.ports.MissedPulseListener;
import org.rtbsa.core.spi.StreamPorts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Paired, pulse-synchronized view of two channels on one beamline.
 *
 * <p>Each channel streams through its own {@link SingleStream}; the two buffers are aligned on
 * every {@link #align()} call and never cached. The two snapshots are taken one after the other
 * without a shared lock, so they may be up to one update apart; the offset resolution tolerates
 * that skew.
 */
public final class DualStream implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(DualStream.class);

    private final StreamPorts ports;
    private final MissedPulseListener missedPulses;

    private volatile DualStreamConfig config;
    private volatile SingleStream first;
    private volatile SingleStream second;

    private volatile int latestSyncedPulseId = -1;
    private volatile int syncedPointCount = -1;

    public DualStream(DualStreamConfig config, StreamPorts ports) {
        this(config, ports, MissedPulseListener.LOGGING);
    }

    public DualStream(DualStreamConfig config, StreamPorts ports, MissedPulseListener missedPulses) {
        this.config = Objects.requireNonNull(config, "config");
        this.ports = Objects.requireNonNull(ports, "ports");
        this.missedPulses = missedPulses;
        rebuild(true);
    }

    private synchronized void rebuild(boolean raiseOnFailure) {
        stop();
        var cfg = config;
        try {
            first = new SingleStream(cfg.first(), ports, missedPulses, raiseOnFailure);
            second = new SingleStream(cfg.second(), ports, missedPulses, raiseOnFailure);
        } catch (BsaException e) {
            LOG.error("{} dual stream init with [{}, {}] failed", cfg.beamline(), cfg.ch1(), cfg.ch2());
            stop();
            throw e;
        }
        if (!isUsable()) {
            LOG.warn("Invalid dual stream definition: {} [{}, {}]", cfg.beamline(), cfg.ch1(), cfg.ch2());
        }
    }

    // ---- Alignment ----

    /**
     * Returns the overlap of both buffers in which element {@code i} of each row belongs to the
     * same pulse. When the streams are too far apart to overlap the result is empty.
     */
    public AlignedSnapshot align() {
        SingleStream s1 = first, s2 = second;
        Snapshot a = s1.snapshot();
        Snapshot b = s2.snapshot();

        int dp = b.pulseId() - a.pulseId();
        int latest = Math.min(a.pulseId(), b.pulseId());
        latestSyncedPulseId = latest;
        if (dp == 0) return new AlignedSnapshot(a.values(), b.values(), latest, 0); // already synced

        RateState rate = s1.rateState();
        if (!rate.isDefined()) {
            LOG.debug("No beam rate for {}, returning unshifted buffers", config.beamline());
            return new AlignedSnapshot(a.values(), b.values(), latest, 0);
        }

        int offset = resolveOffset(dp, rate.ticksPerSample(), rate.bufferModulus());
        int length = Math.min(a.length(), b.length());
        int n = length - Math.abs(offset);
        syncedPointCount = Math.max(n, 0);
        if (n <= 0) {
            LOG.debug("{} and {} are {} samples apart, nothing to align",
                    s1.channel(), s2.channel(), offset);
            return AlignedSnapshot.empty(latest, offset);
        }

        double[] va = a.values(), vb = b.values();
        // offset > 0: the first stream lags the second
        if (offset > 0) {
            return new AlignedSnapshot(
                    Arrays.copyOfRange(va, offset, offset + n), Arrays.copyOfRange(vb, 0, n), latest, offset);
        }
        if (offset < 0) {
            return new AlignedSnapshot(
                    Arrays.copyOfRange(va, 0, n), Arrays.copyOfRange(vb, -offset, -offset + n), latest, offset);
        }
        return new AlignedSnapshot(Arrays.copyOf(va, n), Arrays.copyOf(vb, n), latest, 0);
    }

    /**
     * Converts a pulse ID difference into a lag in samples. Pulse IDs wrap after
     * {@code bufferModulus} samples, so a raw lag is compared with the same lag taken across the
     * wrap and the shorter one wins; e.g. with a modulus of 2730 a raw lag of 2727 samples is
     * really a lag of 3 samples in the other direction.
     *
     * @param dp pulse ID of the second stream minus that of the first
     * @return signed lag, positive when the first stream lags the second
     */
    public static int resolveOffset(int dp, double ticksPerSample, double bufferModulus) {
        int raw = (int) (dp / ticksPerSample);
        int rollover = (int) (raw - Integer.signum(raw) * bufferModulus);
        return Math.abs(rollover) < Math.abs(raw) ? rollover : raw;
    }

    // ---- Configuration ----

    /** Stops both streams and rebuilds them for {@code next}. */
    public void reconfigure(DualStreamConfig next) {
        this.config = Objects.requireNonNull(next, "config");
        rebuild(false);
    }

    public void setCh1(String ch1) {
        reconfigure(config.withCh1(ch1));
    }

    public void setCh2(String ch2) {
        reconfigure(config.withCh2(ch2));
    }

    public void setBeamline(Beamline beamline) {
        if (beamline == null) throw new ConfigurationException("beamline must be set");
        reconfigure(config.withBeamline(beamline));
    }

    public void setBeamline(String beamline) {
        setBeamline(Beamline.parse(beamline));
    }

    public void stop() {
        var s1 = first;
        var s2 = second;
        if (s1 != null) s1.stop();
        if (s2 != null) s2.stop();
    }

    @Override
    public void close() {
        stop();
    }

    // ---- Accessors ----

    public DualStreamConfig config() {
        return config;
    }

    public String ch1() {
        return config.ch1();
    }

    public String ch2() {
        return config.ch2();
    }

    public Beamline beamline() {
        return config.beamline();
    }

    public SingleStream first() {
        return first;
    }

    public SingleStream second() {
        return second;
    }

    public boolean isUsable() {
        var s1 = first;
        var s2 = second;
        return s1 != null && s2 != null && s1.isUsable() && s2.isUsable();
    }

    /** Number of aligned points from the last shifted alignment, -1 before the first one. */
    public int syncedPointCount() {
        return syncedPointCount;
    }

    /** Smaller of the two newest pulse IDs seen by the last {@link #align()}, -1 before it. */
    public int latestSyncedPulseId() {
        return latestSyncedPulseId;
    }

    public RateState rateState() {
        return first.rateState();
    }

    public double sampleRate() {
        return first.sampleRate();
    }

    public double sampleSpacing() {
        return first.sampleSpacing();
    }

    public double ticksPerSample() {
        return first.ticksPerSample();
    }

    public double bufferModulus() {
        return first.bufferModulus();
    }
}
