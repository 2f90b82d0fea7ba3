package org.rtbsa.core.ports;

import org.rtbsa.core.model.Sample;

import java.util.List;
import java.util.concurrent.Flow;

public interface SubscribePort {
    /**
     * Streams live updates of {@code channels} to {@code subscriber} until the returned handle is
     * closed. Closing must stop delivery before it returns.
     */
    AutoCloseable subscribe(List<String> channels, Flow.Subscriber<Sample> subscriber) throws Exception;
}
