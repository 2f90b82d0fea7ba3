package org.rtbsa.core.ports;

import java.util.function.DoubleConsumer;

public interface RatePort {
    double currentRate(String address) throws Exception;

    AutoCloseable subscribeRate(String address, DoubleConsumer onRate) throws Exception;
}
