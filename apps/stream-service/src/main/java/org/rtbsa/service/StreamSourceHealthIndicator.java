package org.rtbsa.service;

import org.rtbsa.core.ports.HealthPort;
import org.springframework.boot.actuate.health.*;
import org.springframework.stereotype.Component;

@Component
public class StreamSourceHealthIndicator implements HealthIndicator {
    private final HealthPort health;
    public StreamSourceHealthIndicator(HealthPort health) { this.health = health; }

    @Override public Health health() {
        var s = health.health();
        var builder = s.up() ? Health.up() : Health.down();
        if (s.metrics() != null) builder.withDetails(s.metrics());
        return builder.build();
    }
}
