package org.rtbsa.app;

import org.rtbsa.core.Kernel;
import org.rtbsa.core.model.AlignedSnapshot;
import org.rtbsa.core.model.DualStreamConfig;
import org.rtbsa.core.ports.MissedPulseListener;
import org.rtbsa.core.scheduler.RefreshScheduler;
import org.rtbsa.core.spi.StreamSourcePlugin;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Streams two channels from the first source on the classpath and prints a few aligned windows.
 *
 * <pre>
 * java -jar smoke-app.jar [ch1] [ch2] [beamline] [refreshes] [key=value ...]
 * </pre>
 * {@code key=value} pairs are handed to the source's {@code init}, e.g. {@code lag.GDET:FEE1:241:ENRC=3}.
 */
public class SmokeMain {

    static final String DEFAULT_CH1 = "BLEN:LI21:265:AIMAX";
    static final String DEFAULT_CH2 = "GDET:FEE1:241:ENRC";
    static final String DEFAULT_BEAMLINE = "NC_HXR";

    // Prints each aligned window and stops after N
    static final class WindowPrinter implements Consumer<AlignedSnapshot> {
        private final CountDownLatch latch;
        private final int window;

        WindowPrinter(int count, int window) {
            this.latch = new CountDownLatch(count);
            this.window = window;
        }

        @Override
        public void accept(AlignedSnapshot s) {
            if (latch.getCount() == 0) return;
            System.out.println(describe(s.tail(window), window));
            latch.countDown();
        }

        boolean await(long timeout, TimeUnit unit) throws InterruptedException {
            return latch.await(timeout, unit);
        }
    }

    static String describe(AlignedSnapshot s, int window) {
        if (s.syncedPointCount() == 0) return "NO DATA";
        return String.format(Locale.ROOT, "N pts: %d/%d, offset: %d, latest pulse ID: %d",
                s.finitePairCount(), window, s.offset(), s.latestSyncedPulseId());
    }

    static Map<String, Object> sourceConfig(String[] args) {
        var cfg = new HashMap<String, Object>();
        for (var a : args) {
            int eq = a.indexOf('=');
            if (eq > 0) cfg.put(a.substring(0, eq), a.substring(eq + 1));
        }
        return cfg;
    }

    static String positional(String[] args, int index, String def) {
        int i = 0;
        for (var a : args) {
            if (a.indexOf('=') > 0) continue;
            if (i++ == index) return a;
        }
        return def;
    }

    public static void main(String[] args) throws Exception {
        var loader = ServiceLoader.load(StreamSourcePlugin.class);
        var plugin = loader.findFirst().orElseThrow(() ->
                new IllegalStateException("No StreamSourcePlugin found on classpath"));

        var cfg = DualStreamConfig.of(
                positional(args, 0, DEFAULT_CH1),
                positional(args, 1, DEFAULT_CH2),
                positional(args, 2, DEFAULT_BEAMLINE));
        int refreshes = Integer.parseInt(positional(args, 3, "10"));

        plugin.init(sourceConfig(args));
        plugin.start();

        var kernel = Kernel.of(plugin, MissedPulseListener.LOGGING);
        try (var scheduler = new RefreshScheduler()) {
            var id = kernel.openDual(cfg);
            var dual = kernel.dual(id);
            System.out.println("Streaming " + cfg.ch1() + " vs " + cfg.ch2() + " on " + cfg.beamline()
                    + " (" + dual.sampleRate() + " Hz, " + dual.ticksPerSample() + " ticks/sample)");

            var printer = new WindowPrinter(refreshes, 1000);
            AutoCloseable handle = scheduler.start(dual::align, RefreshScheduler.DEFAULT_INTERVAL, printer);

            // ~100 ms per refresh, generous margin for a slow start
            printer.await(refreshes + 10L, TimeUnit.SECONDS);
            handle.close();

            System.out.println("\nMissed pulses: " + kernel.missedPulses());
            System.out.println("Health: " + kernel.health().metrics());
        } finally {
            kernel.closeAll();
            plugin.stop();
        }
    }
}
