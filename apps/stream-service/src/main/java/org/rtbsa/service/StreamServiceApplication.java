package org.rtbsa.service;

import io.micrometer.core.instrument.MeterRegistry;
import org.rtbsa.core.Kernel;
import org.rtbsa.core.ports.HealthPort;
import org.rtbsa.core.ports.MissedPulseListener;
import org.rtbsa.core.spi.StreamSourcePlugin;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.ServiceLoader;

@SpringBootApplication
@EnableConfigurationProperties({
        SimSourceProperties.class,
        StreamSourceProperties.class,
        StreamDefaultsProperties.class
})
public class StreamServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(StreamServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(StreamServiceApplication.class, args);
    }

    @Bean
    public SourceRuntimeInfo sourceRuntimeInfo(StreamSourceProperties selection, SimSourceProperties simProps) {
        String id = selection.getActive();
        Map<String, Object> cfg = "sim".equals(id) ? simProps.toConfig() : Map.of();
        return new SourceRuntimeInfo(id, cfg);
    }

    @Bean(destroyMethod = "stop")
    public StreamSourcePlugin streamSourcePlugin(SourceRuntimeInfo rt) throws Exception {
        var plugin = ServiceLoader.load(StreamSourcePlugin.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .filter(p -> p.id().equals(rt.id()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No StreamSourcePlugin found with id=" + rt.id()));

        log.info("Starting source id={} with cfg={}", rt.id(), rt.cfg());
        plugin.init(rt.cfg());
        plugin.start();
        return plugin;
    }

    @Bean
    public MissedPulseListener missedPulseListener(MeterRegistry registry) {
        return new MissedPulseMetrics(registry);
    }

    @Bean(destroyMethod = "closeAll")
    public Kernel kernel(StreamSourcePlugin plugin, MissedPulseListener missedPulses) {
        return Kernel.of(plugin, missedPulses);
    }

    @Bean
    public HealthPort healthPort(Kernel kernel) {
        return kernel::health;
    }
}
