package org.rtbsa.core.stream;

import org.junit.jupiter.api.Test;
import org.rtbsa.core.buffer.PulseIds;
import org.rtbsa.core.model.Beamline;
import org.rtbsa.core.model.StreamConfig;
import org.rtbsa.core.ports.MissedPulseListener;
import org.rtbsa.core.support.FakeStreamSource;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SingleStreamConcurrencyTest {
    private static final String CH = "BPMS:LTUH:250:X";

    @Test
    void snapshotsNeverPairValuesWithAnotherUpdatesPulseId() throws Exception {
        var source = new FakeStreamSource();
        source.setRate(Beamline.NC_HXR.rateSourceAddress(), 120.0);
        double[] seed = FakeStreamSource.ramp(PulseIds.BUFFER_LENGTH);
        seed[seed.length - 1] = 500; // newest value equals its pulse id, as every update below does
        source.history(CH + "HSTCUHBR", seed, 500);
        var stream = new SingleStream(new StreamConfig(CH, Beamline.NC_HXR), source.ports(), MissedPulseListener.NO_OP);

        var done = new AtomicBoolean();
        var torn = new AtomicInteger();
        var reads = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            Future<?> writer = executor.submit(() -> {
                int id = 500;
                for (int i = 0; i < 50_000; i++) {
                    id = PulseIds.wrap(id + 3);
                    source.emit(CH, id, id);
                }
                done.set(true);
            });
            Runnable reader = () -> {
                while (!done.get()) {
                    var s = stream.snapshot();
                    if (s.values()[s.length() - 1] != s.pulseId()) torn.incrementAndGet();
                    if (s.length() != PulseIds.BUFFER_LENGTH) torn.incrementAndGet();
                    reads.incrementAndGet();
                }
            };
            Future<?> r1 = executor.submit(reader);
            Future<?> r2 = executor.submit(reader);

            writer.get(30, TimeUnit.SECONDS);
            r1.get(5, TimeUnit.SECONDS);
            r2.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertThat(torn.get()).isZero();
        assertThat(reads.get()).isPositive();
        assertThat(stream.snapshot().finiteCount()).isEqualTo(PulseIds.BUFFER_LENGTH);
    }

    @Test
    void stopWhileUpdatesArriveLeavesTheBufferFrozen() throws Exception {
        var source = new FakeStreamSource().historyPulseId(0);
        source.setRate(Beamline.NC_SXR.rateSourceAddress(), 120.0);
        var stream = new SingleStream(new StreamConfig(CH, Beamline.NC_SXR), source.ports(), MissedPulseListener.NO_OP);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> writer = executor.submit(() -> {
                int id = 0;
                for (int i = 0; i < 20_000; i++) {
                    id = PulseIds.wrap(id + 3);
                    stream.onValueUpdate(i, FakeStreamSource.nanos(id));
                }
            });
            Thread.sleep(5);
            stream.stop();
            var frozen = stream.snapshot();
            writer.get(30, TimeUnit.SECONDS);

            assertThat(stream.snapshot().pulseId()).isEqualTo(frozen.pulseId());
            assertThat(stream.snapshot().values()).containsExactly(frozen.values());
        } finally {
            executor.shutdownNow();
        }
    }
}
