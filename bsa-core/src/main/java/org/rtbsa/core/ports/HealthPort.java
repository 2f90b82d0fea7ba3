package org.rtbsa.core.ports;

import org.rtbsa.core.model.HealthStatus;

public interface HealthPort {
    HealthStatus health();
}
