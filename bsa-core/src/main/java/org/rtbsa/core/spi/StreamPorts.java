package org.rtbsa.core.spi;

import org.rtbsa.core.ports.HistoryPort;
import org.rtbsa.core.ports.RatePort;
import org.rtbsa.core.ports.SubscribePort;

import java.util.Objects;

/**
 * The three ports a stream needs from its source.
 */
public record StreamPorts(SubscribePort subscribe, RatePort rates, HistoryPort history) {

    public StreamPorts {
        Objects.requireNonNull(subscribe, "subscribe");
        Objects.requireNonNull(rates, "rates");
        Objects.requireNonNull(history, "history");
    }

    public static StreamPorts of(StreamSourcePlugin plugin) {
        return new StreamPorts(plugin.subscribe(), plugin.rates(), plugin.history());
    }
}
