package org.rtbsa.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.rtbsa.core.Kernel;
import org.rtbsa.core.model.*;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api")
public class StreamController {

    public record SnapshotView(String id, int pulseId, int finiteCount, double[] values) {
    }

    public record AlignedView(String id, int latestSyncedPulseId, int offset, int syncedPointCount,
                              int finitePairCount, double[] a, double[] b) {
    }

    private final Kernel kernel;
    private final StreamDefaultsProperties defaults;

    // metrics
    private final Counter snapshotCounter;
    private final Counter alignCounter;
    private final Timer alignTimer;

    public StreamController(Kernel kernel, StreamDefaultsProperties defaults, MeterRegistry registry) {
        this.kernel = kernel;
        this.defaults = defaults;

        this.snapshotCounter = registry.counter("bsa_snapshot_reads");
        this.alignCounter = registry.counter("bsa_aligned_reads");
        // name includes _seconds so Prometheus will export *_seconds_* series
        this.alignTimer = registry.timer("bsa_align_latency_seconds");

        registry.gauge("bsa_streams_open", this.kernel, k -> (double) k.openCount());
    }

    @PostMapping("/streams/single")
    public Map<String, String> openSingle(@RequestParam String channel,
                                          @RequestParam(required = false) String beamline) {
        var id = kernel.openSingle(StreamConfig.of(channel, beamlineOrDefault(beamline)));
        return Map.of("id", id);
    }

    @PostMapping("/streams/dual")
    public Map<String, String> openDual(@RequestParam String ch1, @RequestParam String ch2,
                                        @RequestParam(required = false) String beamline) {
        var id = kernel.openDual(DualStreamConfig.of(ch1, ch2, beamlineOrDefault(beamline)));
        return Map.of("id", id);
    }

    @GetMapping("/streams")
    public List<StreamInfo> streams() {
        return kernel.streams();
    }

    @GetMapping("/streams/{id}/snapshot")
    public SnapshotView snapshot(@PathVariable String id, @RequestParam(required = false) Integer n) {
        var s = kernel.snapshot(id);
        snapshotCounter.increment();
        var values = s.tail(windowOrDefault(n));
        return new SnapshotView(id, s.pulseId(), new Snapshot(values, s.pulseId()).finiteCount(), values);
    }

    @GetMapping("/streams/{id}/aligned")
    public AlignedView aligned(@PathVariable String id, @RequestParam(required = false) Integer n) {
        var dual = kernel.dual(id);
        alignCounter.increment();
        var sample = Timer.start();
        AlignedSnapshot s;
        try {
            s = dual.align();
        } finally {
            sample.stop(alignTimer);
        }
        var w = s.tail(windowOrDefault(n));
        return new AlignedView(id, w.latestSyncedPulseId(), w.offset(), s.syncedPointCount(),
                w.finitePairCount(), w.a(), w.b());
    }

    /** Changes the fields given; omitted ones keep their current value. */
    @PutMapping("/streams/{id}/config")
    public StreamInfo reconfigure(@PathVariable String id,
                                  @RequestParam(required = false) String channel,
                                  @RequestParam(required = false) String ch1,
                                  @RequestParam(required = false) String ch2,
                                  @RequestParam(required = false) String beamline) {
        if (kernel.isDual(id)) {
            var cfg = kernel.dual(id).config();
            if (ch1 != null) cfg = cfg.withCh1(ch1);
            if (ch2 != null) cfg = cfg.withCh2(ch2);
            if (beamline != null) cfg = cfg.withBeamline(Beamline.parse(beamline));
            kernel.reconfigure(id, cfg);
        } else {
            var cfg = kernel.single(id).config();
            if (channel != null) cfg = cfg.withChannel(channel);
            if (beamline != null) cfg = cfg.withBeamline(Beamline.parse(beamline));
            kernel.reconfigure(id, cfg);
        }
        return kernel.streams().stream()
                .filter(s -> s.id().equals(id))
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("No stream with id=" + id));
    }

    @DeleteMapping("/streams/{id}")
    public ResponseEntity<Void> close(@PathVariable String id) {
        if (!kernel.close(id)) throw new NoSuchElementException("No stream with id=" + id);
        return ResponseEntity.noContent().build();
    }

    private String beamlineOrDefault(String beamline) {
        return beamline != null ? beamline : defaults.getBeamline();
    }

    private int windowOrDefault(Integer n) {
        return n != null ? n : defaults.getWindow();
    }
}
