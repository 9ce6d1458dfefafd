package com.ryuqq.relay.core.model;

import com.ryuqq.relay.core.fault.DescriptionException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 클라이언트 포맷 및 서비스 매처 생성 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class ApiConfigTest {

    private static ApiConfig api(Map<String, Object> endpoint) {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("name", "test");
        description.put("version", "2");
        description.put("endpoint", endpoint);
        description.put("operations", List.of("echo", "upper"));
        return ApiDescription.fromDescription(description);
    }

    @Test
    void clientFormat_SubstitutesVersionAndKeepsOperationPlaceholder() {
        // Given
        ApiConfig api = api(Map.of("host", "localhost", "port", 8080, "pattern", "/test/{version}/{operation}"));

        // When & Then
        assertEquals("http://localhost:8080/test/2/{operation}", api.clientFormat());
        assertEquals("http://localhost:8080/test/2/echo", api.uriFor("echo"));
    }

    @Test
    void clientFormat_IsCached() {
        // Given
        ApiConfig api = api(Map.of());

        // When & Then
        assertSame(api.clientFormat(), api.clientFormat());
        assertSame(api.serviceMatcher(), api.serviceMatcher());
    }

    @Test
    void clientFormat_MissingHost_ThrowsDescriptionException() {
        // Given
        Map<String, Object> endpoint = new HashMap<>();
        endpoint.put("host", null);
        ApiConfig api = api(endpoint);

        // When & Then
        DescriptionException exception = assertThrows(DescriptionException.class, api::clientFormat);
        assertTrue(exception.getMessage().contains("host"));
    }

    @Test
    void clientFormat_MissingPort_ThrowsDescriptionException() {
        // Given
        Map<String, Object> endpoint = new HashMap<>();
        endpoint.put("port", null);

        // When & Then
        assertThrows(DescriptionException.class, () -> api(endpoint).clientFormat());
    }

    @Test
    void serviceMatcher_MissingPattern_ThrowsDescriptionException() {
        // Given
        Map<String, Object> endpoint = new HashMap<>();
        endpoint.put("pattern", null);
        ApiConfig api = api(endpoint);

        // When & Then
        assertThrows(DescriptionException.class, api::serviceMatcher);
        assertThrows(DescriptionException.class, api::clientFormat);
    }

    @Test
    void matchOperation_CapturesOperationGroup() {
        // Given
        ApiConfig api = api(Map.of("pattern", "/api/{version}/{operation}"));

        // When & Then
        assertEquals(Optional.of("echo"), api.matchOperation("/api/2/echo"));
        assertEquals(Optional.of("upper"), api.matchOperation("/api/2/upper/"));
        assertEquals(Optional.empty(), api.matchOperation("/api/1/echo"));
        assertEquals(Optional.empty(), api.matchOperation("/api/2/echo/extra"));
        assertEquals(Optional.empty(), api.matchOperation("/api/2/"));
        assertEquals(Optional.empty(), api.matchOperation(null));
    }

    @Test
    void matchOperation_RegexCharactersInPatternAreLiteral() {
        // Given
        ApiConfig api = api(Map.of("pattern", "/v1.0/{operation}.json"));

        // When & Then
        assertEquals(Optional.of("echo"), api.matchOperation("/v1.0/echo.json"));
        assertEquals(Optional.empty(), api.matchOperation("/v1x0/echo.json"));
    }

    @Test
    void operation_Unknown_ThrowsDescriptionException() {
        // Given
        ApiConfig api = api(Map.of());

        // When & Then
        assertThrows(DescriptionException.class, () -> api.operation("missing"));
        assertFalse(api.hasOperation("missing"));
        assertTrue(api.hasOperation("echo"));
    }

    @Test
    void withTimeout_ReturnsCopyWithNewTimeout() {
        // Given
        ApiConfig api = api(Map.of());

        // When
        ApiConfig copy = api.withTimeout(Duration.ofMillis(250)).withDebug(true);

        // Then
        assertEquals(Duration.ofMillis(250), copy.timeout());
        assertTrue(copy.debug());
        assertEquals(Duration.ofSeconds(2), api.timeout());
        assertFalse(api.debug());
        assertEquals(api.operations().keySet(), copy.operations().keySet());
    }

    @Test
    void isWhitelisted_ChecksExceptionNames() {
        // Given
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("name", "test");
        description.put("exceptions", List.of("NotFound"));
        ApiConfig api = ApiDescription.fromDescription(description);

        // When & Then
        assertTrue(api.isWhitelisted("NotFound"));
        assertFalse(api.isWhitelisted("RequestException"));
    }
}
