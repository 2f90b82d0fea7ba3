package org.rtbsa.service;

import java.util.Map;

/**
 * The source selected at startup and the config it was initialized with.
 */
public record SourceRuntimeInfo(String id, Map<String, Object> cfg) {
}
