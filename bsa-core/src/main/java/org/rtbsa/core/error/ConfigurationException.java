package org.rtbsa.core.error;

/**
 * Invalid beamline or channel. Always raised synchronously to the caller that supplied it.
 */
public class ConfigurationException extends BsaException {

    public ConfigurationException(String message) {
        super(message);
    }
}
