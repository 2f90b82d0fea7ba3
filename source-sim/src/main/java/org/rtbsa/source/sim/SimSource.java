package org.rtbsa.source.sim;

import org.rtbsa.core.buffer.PulseIds;
import org.rtbsa.core.model.HealthStatus;
import org.rtbsa.core.model.HistoryBuffer;
import org.rtbsa.core.model.Sample;
import org.rtbsa.core.ports.*;
import org.rtbsa.core.spi.StreamSourcePlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleConsumer;
import java.util.regex.Pattern;

/**
 * Simulated beam. Every emission period the 360 Hz fiducial counter advances by one sample's
 * worth of ticks and each subscribed channel receives a value stamped with its pulse ID.
 *
 * <p>Config keys: {@code rateHz} (beam rate reported on every rate address), {@code periodMs}
 * (wall-clock time per emitted pulse), {@code dropEvery} (skip every Nth pulse, 0 = never),
 * {@code noise}, {@code seed}, and {@code lag.<channel>} (pulse ID lag in samples for that
 * channel).
 */
public final class SimSource implements StreamSourcePlugin {
    private static final Logger LOG = LoggerFactory.getLogger(SimSource.class);

    // <channel><edef><suffix>, e.g. BLEN:LI21:265:AIMAXHSTCUHTH
    private static final Pattern HISTORY_ADDRESS = Pattern.compile("^(.+?)(HST[A-Z]{0,3})(1H|TH|HH|BR)$");
    private static final String LAG_PREFIX = "lag.";

    private final Map<String, List<Flow.Subscriber<? super Sample>>> subscribers = new ConcurrentHashMap<>();
    private final Map<String, List<DoubleConsumer>> rateListeners = new ConcurrentHashMap<>();
    private final Map<String, Integer> lags = new ConcurrentHashMap<>();
    private final AtomicLong fiducial = new AtomicLong();
    private final AtomicLong pulses = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private ScheduledExecutorService ses;
    private volatile Random rnd = new Random();

    private volatile double rateHz = 120.0;
    private volatile long periodMs = 10;
    private volatile int dropEvery = 0;
    private volatile double noise = 0.1;

    @Override
    public String id() {
        return "sim";
    }

    // ---- Lifecycle ----
    @Override
    public void init(Map<String, Object> config) {
        var cfg = config != null ? config : Map.<String, Object>of();
        this.rateHz = getDouble(cfg, "rateHz", 120.0);
        this.periodMs = Math.max(1, (long) getDouble(cfg, "periodMs", 10));
        this.dropEvery = (int) getDouble(cfg, "dropEvery", 0);
        this.noise = getDouble(cfg, "noise", 0.1);
        if (cfg.containsKey("seed")) this.rnd = new Random((long) getDouble(cfg, "seed", 0));

        lags.clear();
        for (var e : cfg.entrySet()) {
            if (e.getKey().startsWith(LAG_PREFIX)) {
                lags.put(e.getKey().substring(LAG_PREFIX.length()), (int) getDouble(cfg, e.getKey(), 0));
            }
        }
        LOG.info("Simulated beam at {} Hz, one pulse every {} ms, dropEvery={}, lags={}",
                rateHz, periodMs, dropEvery, lags);
    }

    @Override
    public synchronized void start() {
        if (ses != null) return;
        ses = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "sim-beam");
            t.setDaemon(true);
            return t;
        });
        ses.scheduleAtFixedRate(this::pulse, 0, periodMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void stop() {
        if (ses != null) ses.shutdownNow();
        ses = null;
    }

    // ---- Beam ----

    /** Fires one beam pulse. No-op while there is no beam. */
    void pulse() {
        int ticks = ticksPerSample();
        if (ticks <= 0) return;
        long fid = fiducial.addAndGet(ticks);
        long n = pulses.incrementAndGet();
        if (dropEvery > 0 && n % dropEvery == 0) {
            dropped.incrementAndGet();
            return;
        }
        long now = System.currentTimeMillis() * 1_000_000L;
        for (var e : subscribers.entrySet()) {
            String channel = e.getKey();
            long f = fid - (long) lagOf(channel) * ticks;
            var sample = new Sample(channel, valueAt(f), PulseIds.stamp(now, PulseIds.wrap((int) (f % PulseIds.MODULUS))));
            for (var s : e.getValue()) {
                try {
                    s.onNext(sample);
                } catch (RuntimeException ex) {
                    LOG.warn("Subscriber of {} failed: {}", channel, ex.toString());
                }
            }
        }
    }

    /** Changes the beam rate and notifies every rate subscriber. Zero means no beam. */
    public void setRate(double hz) {
        this.rateHz = hz;
        LOG.info("Beam rate now {} Hz", hz);
        for (var listeners : rateListeners.values()) {
            for (var l : listeners) l.accept(hz);
        }
    }

    public double rate() {
        return rateHz;
    }

    public int pulseId() {
        return PulseIds.wrap((int) (fiducial.get() % PulseIds.MODULUS));
    }

    private int ticksPerSample() {
        double r = rateHz;
        if (!(r > 0)) return 0;
        return Math.max(1, (int) Math.round(PulseIds.FIDUCIAL_RATE_HZ / r));
    }

    private int lagOf(String channel) {
        return lags.getOrDefault(channel, 0);
    }

    // a slow oscillation shared by every channel, so aligned channels correlate
    private double valueAt(long fid) {
        double signal = Math.sin(2 * Math.PI * fid / 1800.0);
        return signal + noise * rnd.nextGaussian();
    }

    // ---- Ports ----
    @Override
    public SubscribePort subscribe() {
        return (channels, subscriber) -> {
            subscriber.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) { /* no-op */ }

                @Override
                public void cancel() {
                    remove(channels, subscriber);
                }
            });
            for (var c : channels) {
                subscribers.computeIfAbsent(c, k -> new CopyOnWriteArrayList<>()).add(subscriber);
            }
            return () -> remove(channels, subscriber);
        };
    }

    private void remove(List<String> channels, Flow.Subscriber<? super Sample> subscriber) {
        for (var c : channels) {
            subscribers.computeIfPresent(c, (k, list) -> {
                list.remove(subscriber);
                return list.isEmpty() ? null : list;
            });
        }
    }

    @Override
    public RatePort rates() {
        return new RatePort() {
            @Override
            public double currentRate(String address) {
                return rateHz;
            }

            @Override
            public AutoCloseable subscribeRate(String address, DoubleConsumer onRate) {
                rateListeners.computeIfAbsent(address, k -> new CopyOnWriteArrayList<>()).add(onRate);
                return () -> rateListeners.computeIfPresent(address, (k, list) -> {
                    list.remove(onRate);
                    return list.isEmpty() ? null : list;
                });
            }
        };
    }

    @Override
    public HistoryPort history() {
        return address -> {
            var m = HISTORY_ADDRESS.matcher(address);
            if (!m.matches()) {
                throw new IllegalArgumentException("Not a history buffer address: " + address);
            }
            String channel = m.group(1);
            int ticks = Math.max(1, ticksPerSample());
            long newest = fiducial.get() - (long) lagOf(channel) * ticks;

            var values = new double[PulseIds.BUFFER_LENGTH];
            for (int i = 0; i < values.length; i++) {
                values[i] = valueAt(newest - (long) (values.length - 1 - i) * ticks);
            }
            long now = System.currentTimeMillis() * 1_000_000L;
            return new HistoryBuffer(values, PulseIds.stamp(now, PulseIds.wrap((int) (newest % PulseIds.MODULUS))));
        };
    }

    @Override
    public HealthPort health() {
        return () -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("rateHz", rateHz);
            m.put("pulseId", pulseId());
            m.put("pulses", pulses.get());
            m.put("dropped", dropped.get());
            m.put("channels", subscribers.size());
            m.put("rateSubscribers", rateListeners.values().stream().mapToInt(List::size).sum());
            boolean up;
            synchronized (this) {
                up = ses != null;
            }
            m.put("beam", up ? "running" : "stopped");
            return new HealthStatus(up, m);
        };
    }

    // -------- helpers --------

    private static double getDouble(Map<String, Object> cfg, String key, double def) {
        Object v = cfg.get(key);
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring non-numeric {}={}", key, s);
            }
        }
        return def;
    }
}
