package org.rtbsa.core.ports;

import org.rtbsa.core.model.HistoryBuffer;

public interface HistoryPort {
    HistoryBuffer fetch(String address) throws Exception;
}
