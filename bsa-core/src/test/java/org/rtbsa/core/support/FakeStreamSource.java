package org.rtbsa.core.support;

import org.rtbsa.core.buffer.PulseIds;
import org.rtbsa.core.model.HealthStatus;
import org.rtbsa.core.model.HistoryBuffer;
import org.rtbsa.core.model.Sample;
import org.rtbsa.core.ports.*;
import org.rtbsa.core.spi.StreamPorts;
import org.rtbsa.core.spi.StreamSourcePlugin;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Flow;
import java.util.function.DoubleConsumer;

/**
 * In-memory source for tests: rates, histories and value deliveries are driven by the test.
 */
public final class FakeStreamSource implements StreamSourcePlugin {
    /** Arbitrary upper timestamp bits, so tests prove only the low 14 bits are used. */
    public static final long BASE_NANOS = 0x7A3C_0000L;

    private final Map<String, Double> rates = new ConcurrentHashMap<>();
    private final Map<String, List<DoubleConsumer>> rateListeners = new ConcurrentHashMap<>();
    private final Map<String, List<Flow.Subscriber<? super Sample>>> subscribers = new ConcurrentHashMap<>();
    private final Map<String, HistoryBuffer> histories = new ConcurrentHashMap<>();
    private final List<String> historyRequests = new CopyOnWriteArrayList<>();

    private volatile double defaultRate = 120.0;
    private volatile int defaultHistoryPulseId = 1000;
    private volatile boolean failHistory;
    private volatile boolean failSubscribe;

    @Override
    public String id() {
        return "fake";
    }

    @Override
    public void init(Map<String, Object> config) {
    }

    @Override
    public void start() {
    }

    @Override
    public void stop() {
    }

    // ---- test controls ----

    public StreamPorts ports() {
        return StreamPorts.of(this);
    }

    public FakeStreamSource defaultRate(double hz) {
        this.defaultRate = hz;
        return this;
    }

    public FakeStreamSource historyPulseId(int pulseId) {
        this.defaultHistoryPulseId = pulseId;
        return this;
    }

    public FakeStreamSource history(String address, double[] values, int pulseId) {
        histories.put(address, new HistoryBuffer(values, nanos(pulseId)));
        return this;
    }

    public FakeStreamSource failHistory(boolean fail) {
        this.failHistory = fail;
        return this;
    }

    public FakeStreamSource failSubscribe(boolean fail) {
        this.failSubscribe = fail;
        return this;
    }

    public void setRate(String address, double hz) {
        rates.put(address, hz);
        for (var l : rateListeners.getOrDefault(address, List.of())) l.accept(hz);
    }

    public void emit(String channel, double value, int pulseId) {
        var sample = new Sample(channel, value, nanos(pulseId));
        for (var s : subscribers.getOrDefault(channel, List.of())) s.onNext(sample);
    }

    public int subscriberCount(String channel) {
        return subscribers.getOrDefault(channel, List.of()).size();
    }

    public int rateListenerCount(String address) {
        return rateListeners.getOrDefault(address, List.of()).size();
    }

    public List<String> historyRequests() {
        return historyRequests;
    }

    public static long nanos(int pulseId) {
        return PulseIds.stamp(BASE_NANOS, pulseId);
    }

    /** 0, 1, 2, ... so element positions are easy to assert. */
    public static double[] ramp(int n) {
        var out = new double[n];
        for (int i = 0; i < n; i++) out[i] = i;
        return out;
    }

    // ---- ports ----

    @Override
    public SubscribePort subscribe() {
        return (channels, subscriber) -> {
            if (failSubscribe) throw new IllegalStateException("subscribe refused");
            subscriber.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) {
                }

                @Override
                public void cancel() {
                    channels.forEach(c -> subscribers.getOrDefault(c, new ArrayList<>()).remove(subscriber));
                }
            });
            for (var c : channels) {
                subscribers.computeIfAbsent(c, k -> new CopyOnWriteArrayList<>()).add(subscriber);
            }
            return () -> channels.forEach(c -> subscribers.getOrDefault(c, new ArrayList<>()).remove(subscriber));
        };
    }

    @Override
    public RatePort rates() {
        return new RatePort() {
            @Override
            public double currentRate(String address) {
                return rates.getOrDefault(address, defaultRate);
            }

            @Override
            public AutoCloseable subscribeRate(String address, DoubleConsumer onRate) {
                rateListeners.computeIfAbsent(address, k -> new CopyOnWriteArrayList<>()).add(onRate);
                return () -> rateListeners.getOrDefault(address, new ArrayList<>()).remove(onRate);
            }
        };
    }

    @Override
    public HistoryPort history() {
        return address -> {
            historyRequests.add(address);
            if (failHistory) throw new IllegalStateException("history unavailable: " + address);
            var h = histories.get(address);
            if (h != null) return h;
            return new HistoryBuffer(ramp(PulseIds.BUFFER_LENGTH), nanos(defaultHistoryPulseId));
        };
    }

    @Override
    public HealthPort health() {
        return () -> new HealthStatus(true, Map.of("channels", subscribers.size()));
    }
}
