package org.rtbsa.service;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rtbsa.source")
public class StreamSourceProperties {
    /**
     * Id of the StreamSourcePlugin to load at runtime. Default is "sim".
     */
    private String active = "sim";

    public String getActive() {
        return active;
    }

    public void setActive(String active) {
        this.active = active;
    }
}
