package org.rtbsa.core.error;

/**
 * A rate subscription, history fetch or value subscription failed while a stream was being
 * initialized with errors enabled.
 */
public class StreamInitException extends BsaException {

    public StreamInitException(String message, Throwable cause) {
        super(message, cause);
    }
}
