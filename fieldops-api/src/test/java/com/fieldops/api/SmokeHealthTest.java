package com.fieldops.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class SmokeHealthTest {
  @LocalServerPort int port;
  @Autowired TestRestTemplate rest;

  @Test void healthIsPublicAndUp() {
    var r = rest.getForEntity("http://localhost:" + port + "/actuator/health", String.class);
    assertThat(r.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(r.getBody()).contains("\"UP\"");
    assertThat(r.getHeaders().getFirst("X-Request-Id")).isNotBlank();
  }

  @Test void otherActuatorEndpointsAreClosed() {
    var r = rest.getForEntity("http://localhost:" + port + "/actuator/metrics", String.class);
    assertThat(r.getStatusCode().is4xxClientError()).isTrue();
  }

  @Test void entitiesNeedToken() {
    var r = rest.getForEntity("http://localhost:" + port + "/api/v1/entities/customer", String.class);
    assertThat(r.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
  }
}
