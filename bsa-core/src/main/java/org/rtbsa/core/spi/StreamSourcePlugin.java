package org.rtbsa.core.spi;

import org.rtbsa.core.ports.*;

/**
 * A control-system transport delivering BSA values, beam rates and history buffers.
 * Implementations are discovered with {@link java.util.ServiceLoader}.
 */
public interface StreamSourcePlugin extends LifecyclePort {
    String id();

    SubscribePort subscribe();

    RatePort rates();

    HistoryPort history();

    HealthPort health();
}
