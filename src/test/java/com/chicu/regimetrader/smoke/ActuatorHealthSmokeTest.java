package com.chicu.regimetrader.smoke;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ActuatorHealthSmokeTest {

    @LocalServerPort
    int port;

    private final TestRestTemplate rest = new TestRestTemplate();

    @Test
    void actuatorHealthShouldBeUp() {
        ResponseEntity<Map> resp = rest.getForEntity("http://localhost:" + port + "/actuator/health", Map.class);
        assertEquals(200, resp.getStatusCode().value());
        assertNotNull(resp.getBody());
        assertEquals("UP", resp.getBody().get("status"));
    }

    @Test
    void tradingCoreComponentShouldReportArmedKillSwitch() {
        ResponseEntity<Map> resp = rest.getForEntity("http://localhost:" + port + "/actuator/health", Map.class);
        Map<?, ?> components = (Map<?, ?>) resp.getBody().get("components");
        assertNotNull(components, "show-details=always должен отдавать компоненты");

        Map<?, ?> core = (Map<?, ?>) components.get("tradingCore");
        assertNotNull(core);
        assertEquals("UP", core.get("status"));
        assertEquals("ARMED", ((Map<?, ?>) core.get("details")).get("killSwitch"));
    }
}
