package com.signalsentinel.flink;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HealthServerTest {

    private final HealthServer server = new HealthServer("log");

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Should report UP and the active channel")
    void shouldServeHealth() throws Exception {
        server.start(0);

        HttpResponse<String> response = HttpClient.newHttpClient().send(
                HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + "/readiness")).build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(server.isRunning()).isTrue();
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("{\"status\":\"UP\",\"channel\":\"log\"}");
    }

    @Test
    @DisplayName("Should reject an out-of-range port")
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> server.start(70_000)).isInstanceOf(IllegalArgumentException.class);
        assertThat(server.isRunning()).isFalse();
    }
}
