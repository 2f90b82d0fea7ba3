package org.rtbsa.core;

import org.rtbsa.core.model.*;
import org.rtbsa.core.ports.HealthPort;
import org.rtbsa.core.ports.MissedPulseListener;
import org.rtbsa.core.spi.StreamPorts;
import org.rtbsa.core.spi.StreamSourcePlugin;
import org.rtbsa.core.stream.DualStream;
import org.rtbsa.core.stream.SingleStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Opens streams against one source and keeps track of them by id.
 */
public final class Kernel {
    private static final Logger LOG = LoggerFactory.getLogger(Kernel.class);

    private final StreamPorts ports;
    private final HealthPort health;
    private final MissedPulseListener missedPulses;

    private final Map<String, SingleStream> singles = new ConcurrentHashMap<>();
    private final Map<String, DualStream> duals = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private final AtomicLong missedTotal = new AtomicLong();

    public Kernel(StreamPorts ports, HealthPort health, MissedPulseListener missedPulses) {
        this.ports = Objects.requireNonNull(ports, "ports");
        this.health = Objects.requireNonNull(health, "health");
        MissedPulseListener counting = e -> missedTotal.addAndGet(e.missed());
        this.missedPulses = counting.andThen(missedPulses != null ? missedPulses : MissedPulseListener.NO_OP);
    }

    public static Kernel of(StreamSourcePlugin plugin, MissedPulseListener missedPulses) {
        return new Kernel(StreamPorts.of(plugin), plugin.health(), missedPulses);
    }

    public String openSingle(StreamConfig config) {
        var stream = new SingleStream(config, ports, missedPulses);
        var id = "single-" + nextId.getAndIncrement();
        singles.put(id, stream);
        LOG.info("Opened {} for {} on {}", id, config.channel(), config.beamline());
        return id;
    }

    public String openDual(DualStreamConfig config) {
        var stream = new DualStream(config, ports, missedPulses);
        var id = "dual-" + nextId.getAndIncrement();
        duals.put(id, stream);
        LOG.info("Opened {} for [{}, {}] on {}", id, config.ch1(), config.ch2(), config.beamline());
        return id;
    }

    public SingleStream single(String id) {
        var s = singles.get(id);
        if (s == null) throw new NoSuchElementException("No single stream with id=" + id);
        return s;
    }

    public DualStream dual(String id) {
        var s = duals.get(id);
        if (s == null) throw new NoSuchElementException("No dual stream with id=" + id);
        return s;
    }

    public boolean isDual(String id) {
        return duals.containsKey(id);
    }

    public Snapshot snapshot(String id) {
        return single(id).snapshot();
    }

    public AlignedSnapshot align(String id) {
        return dual(id).align();
    }

    public void reconfigure(String id, StreamConfig config) {
        single(id).reconfigure(config);
    }

    public void reconfigure(String id, DualStreamConfig config) {
        dual(id).reconfigure(config);
    }

    public boolean close(String id) {
        var s = singles.remove(id);
        if (s != null) {
            s.stop();
            return true;
        }
        var d = duals.remove(id);
        if (d != null) {
            d.stop();
            return true;
        }
        return false;
    }

    public void closeAll() {
        for (var id : new ArrayList<>(streamIds())) close(id);
    }

    public Collection<String> streamIds() {
        var ids = new TreeSet<String>(singles.keySet());
        ids.addAll(duals.keySet());
        return ids;
    }

    public List<StreamInfo> streams() {
        var out = new ArrayList<StreamInfo>();
        singles.forEach((id, s) -> out.add(
                new StreamInfo(id, "single", List.of(s.channel()), s.beamline(), s.isUsable())));
        duals.forEach((id, d) -> out.add(
                new StreamInfo(id, "dual", List.of(d.ch1(), d.ch2()), d.beamline(), d.isUsable())));
        out.sort(Comparator.comparing(StreamInfo::id));
        return out;
    }

    public int openCount() {
        return singles.size() + duals.size();
    }

    public long missedPulses() {
        return missedTotal.get();
    }

    public HealthStatus health() {
        var source = health.health();
        var m = new LinkedHashMap<String, Object>();
        if (source.metrics() != null) m.putAll(source.metrics());
        m.put("streamsOpen", openCount());
        long disabled = streams().stream().filter(s -> !s.usable()).count();
        m.put("streamsDisabled", disabled);
        m.put("missedPulses", missedTotal.get());
        return new HealthStatus(source.up(), m);
    }
}
