package org.rtbsa.service;

import org.rtbsa.core.buffer.PulseIds;
import org.springframework.boot.actuate.info.Info;
import org.springframework.boot.actuate.info.InfoContributor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class StreamSourceInfoContributor implements InfoContributor {
    private final SourceRuntimeInfo rt;

    public StreamSourceInfoContributor(SourceRuntimeInfo rt) {
        this.rt = rt;
    }

    @Override
    public void contribute(Info.Builder builder) {
        builder.withDetail("source", Map.of(
                "id", rt.id(),
                "cfg", rt.cfg()
        ));
        builder.withDetail("buffer", Map.of(
                "length", PulseIds.BUFFER_LENGTH,
                "pulseIdModulus", PulseIds.MODULUS
        ));
    }
}
