package com.spansentinel.flink;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HealthServer}.
 */
class HealthServerTest {

    private final HealthServer server = new HealthServer(3);

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Health body reports status and rule count")
    void shouldRenderHealthBody() {
        assertThat(HealthServer.healthBody(3)).isEqualTo("{\"status\":\"UP\",\"rules\":3}");
    }

    @Test
    @DisplayName("Health and readiness endpoints answer 200")
    void shouldServeHealthEndpoints() throws Exception {
        int port = freePort();
        server.start(port);
        assertThat(server.isRunning()).isTrue();

        HttpClient client = HttpClient.newHttpClient();
        for (String path : new String[] { "/health", "/readiness" }) {
            HttpResponse<String> response = client.send(
                    HttpRequest.newBuilder(URI.create("http://localhost:" + port + path)).GET().build(),
                    HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).isEqualTo("{\"status\":\"UP\",\"rules\":3}");
        }

        server.stop();
        assertThat(server.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Out-of-range port is rejected")
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> server.start(0)).isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }
}
