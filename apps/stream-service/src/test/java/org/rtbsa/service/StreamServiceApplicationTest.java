package org.rtbsa.service;

import org.junit.jupiter.api.Test;
import org.rtbsa.core.Kernel;
import org.rtbsa.core.spi.StreamSourcePlugin;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"rtbsa.source.sim.period-ms=5", "rtbsa.source.sim.seed=1"})
class StreamServiceApplicationTest {

    @Autowired
    private TestRestTemplate http;

    @Autowired
    private StreamSourcePlugin plugin;

    @Autowired
    private Kernel kernel;

    @Test
    void loadsTheSimulatedSourceAndServesStreams() {
        assertThat(plugin.id()).isEqualTo("sim");

        var opened = http.postForObject("/api/streams/single?channel=CH:A", null, Map.class);
        var id = (String) opened.get("id");
        assertThat(kernel.streamIds()).contains(id);

        var snap = http.getForObject("/api/streams/" + id + "/snapshot?n=5", Map.class);
        assertThat((List<?>) snap.get("values")).hasSize(5);

        var missing = http.getForEntity("/api/streams/dual-999/aligned", String.class);
        assertThat(missing.getStatusCode().value()).isEqualTo(404);

        var health = http.getForObject("/actuator/health", Map.class);
        assertThat(health.get("status")).isEqualTo("UP");
    }
}
