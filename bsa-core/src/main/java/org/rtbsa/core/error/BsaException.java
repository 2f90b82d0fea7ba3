package org.rtbsa.core.error;

/**
 * Base type for failures raised by the stream engine.
 */
public class BsaException extends RuntimeException {

    public BsaException(String message) {
        super(message);
    }

    public BsaException(String message, Throwable cause) {
        super(message, cause);
    }
}
