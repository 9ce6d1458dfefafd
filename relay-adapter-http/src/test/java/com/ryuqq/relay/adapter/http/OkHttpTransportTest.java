package com.ryuqq.relay.adapter.http;

import com.ryuqq.relay.adapter.jackson.JacksonCodec;
import com.ryuqq.relay.application.service.Service;
import com.ryuqq.relay.core.model.ApiDescription;
import com.ryuqq.relay.core.spi.TransportException;
import com.ryuqq.relay.core.spi.TransportResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OkHttpTransport tests against a live {@link RelayHttpServer}.
 */
class OkHttpTransportTest {

    private RelayHttpServer server;
    private final OkHttpTransport transport = new OkHttpTransport();

    @BeforeEach
    void setUp() throws Exception {
        Service service = new Service(ApiDescription.fromDescription(Map.of(
            "name", "text",
            "operations", List.of(
                Map.of("name", "upper", "input", List.of("text"), "output", List.of("result")),
                "slow"))),
            new JacksonCodec());
        service.operation("upper", (request, response, context) ->
            response.set("result", request.get("text", String.class).toUpperCase()));
        service.operation("slow", (request, response, context) -> Thread.sleep(1_000));
        server = new RelayHttpServer(service, "localhost", 0);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private URI uri(String operation) {
        return URI.create("http://localhost:" + server.getPort() + "/api/0/" + operation);
    }

    @Test
    void testPostReturnsStatusAndBody() throws Exception {
        // When
        TransportResponse response = transport.post(uri("upper"), "{\"text\":\"hi\"}", Duration.ofSeconds(2));

        // Then
        assertEquals(200, response.status());
        assertEquals("{\"result\":\"HI\"}", response.text());
    }

    @Test
    void testUnknownPathReturns404() throws Exception {
        // When
        TransportResponse response = transport.post(uri("lower"), "{}", Duration.ofSeconds(2));

        // Then
        assertEquals(404, response.status());
        assertEquals("Not Found", response.reason());
        assertFalse(response.isSuccess());
    }

    @Test
    void testCallTimeoutMapsTo504() {
        // When & Then
        TransportException e = assertThrows(TransportException.class,
            () -> transport.post(uri("slow"), "{}", Duration.ofMillis(200)));
        assertEquals(504, e.status());
        assertEquals("Gateway Timeout", e.getMessage());
    }

    @Test
    void testConnectionRefusedMapsTo503() throws Exception {
        // Given
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        // When & Then
        TransportException e = assertThrows(TransportException.class,
            () -> transport.post(URI.create("http://localhost:" + closedPort + "/api/0/upper"), "{}",
                Duration.ofSeconds(2)));
        assertEquals(503, e.status());
        assertEquals("Service Unavailable", e.getMessage());
    }

    @Test
    void testServerLifecycle() throws Exception {
        // Then
        assertTrue(server.isRunning());
        assertTrue(server.getPort() > 0);

        // When
        server.start();
        server.stop();

        // Then
        assertFalse(server.isRunning());
    }

    @Test
    void testStartWithUnboundOperationFails() {
        // Given
        Service unbound = new Service(ApiDescription.fromDescription(Map.of(
            "name", "text", "operations", List.of("ping"))), new JacksonCodec());

        // When & Then
        try (RelayHttpServer idle = new RelayHttpServer(unbound, "localhost", 0)) {
            assertThrows(IllegalStateException.class, idle::start);
            assertFalse(idle.isRunning());
        }
    }
}
