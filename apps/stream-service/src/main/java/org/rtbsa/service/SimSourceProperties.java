package org.rtbsa.service;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "rtbsa.source.sim")
public class SimSourceProperties {
    private double rateHz = 120.0;  // beam rate reported on every rate address
    private long periodMs = 10;     // wall-clock time per pulse
    private int dropEvery = 0;      // 0 = never drop
    private double noise = 0.1;
    private Long seed;
    private Map<String, Integer> lag = new LinkedHashMap<>(); // channel -> samples

    public double getRateHz() {
        return rateHz;
    }

    public void setRateHz(double v) {
        this.rateHz = v;
    }

    public long getPeriodMs() {
        return periodMs;
    }

    public void setPeriodMs(long v) {
        this.periodMs = v;
    }

    public int getDropEvery() {
        return dropEvery;
    }

    public void setDropEvery(int v) {
        this.dropEvery = v;
    }

    public double getNoise() {
        return noise;
    }

    public void setNoise(double v) {
        this.noise = v;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long v) {
        this.seed = v;
    }

    public Map<String, Integer> getLag() {
        return lag;
    }

    public void setLag(Map<String, Integer> lag) {
        this.lag = lag;
    }

    /** Flattens these properties into the key set {@code SimSource.init} reads. */
    public Map<String, Object> toConfig() {
        Map<String, Object> cfg = new LinkedHashMap<>();
        cfg.put("rateHz", rateHz);
        cfg.put("periodMs", periodMs);
        cfg.put("dropEvery", dropEvery);
        cfg.put("noise", noise);
        if (seed != null) cfg.put("seed", seed);
        lag.forEach((channel, samples) -> cfg.put("lag." + channel, samples));
        return cfg;
    }
}
