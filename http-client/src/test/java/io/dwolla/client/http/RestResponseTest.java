package io.dwolla.client.http;

import static org.junit.jupiter.api.Assertions.*;

import java.net.URI;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class RestResponseTest {

    private static final RestRequest REQUEST = RestRequest.builder()
            .method(HttpMethod.POST)
            .uri(URI.create("https://api-sandbox.dwolla.com/customers"))
            .build();

    @Test
    public void testHeaderLookupIsCaseInsensitive() {
        RestResponse<Void> response = RestResponse.success(REQUEST, 201,
                Map.of("X-Request-Id", List.of("abc")), null, "");

        assertEquals("abc", response.requestId());
        assertEquals("abc", response.header("x-request-id"));
        assertNull(response.header("missing"));
        assertTrue(response.success());
    }

    @Test
    public void testLocationIsResolvedAgainstRequestUri() {
        RestResponse<Void> absolute = RestResponse.success(REQUEST, 201,
                Map.of("location", List.of("https://api-sandbox.dwolla.com/customers/123")), null, "");
        RestResponse<Void> relative = RestResponse.success(REQUEST, 201,
                Map.of("Location", List.of("/customers/456")), null, "");

        assertEquals(URI.create("https://api-sandbox.dwolla.com/customers/123"), absolute.location());
        assertEquals(URI.create("https://api-sandbox.dwolla.com/customers/456"), relative.location());
    }

    @Test
    public void testFailureCarriesException() {
        RestException exception = new RestException("Request failed: status[404]", 404, "{}");
        RestResponse<Object> response = RestResponse.failure(REQUEST, 404, Map.of(), "{}", exception);

        assertFalse(response.success());
        assertNull(response.content());
        assertSame(exception, response.exception());
        assertEquals(404, response.exception().getStatusCode());
    }

    @Test
    public void testRelativeRequestUriIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> RestRequest.builder()
                .method(HttpMethod.GET)
                .uri(URI.create("/customers"))
                .build());
    }

    @Test
    public void testResourceDescribesMethodAndUri() {
        assertEquals("POST https://api-sandbox.dwolla.com/customers", REQUEST.resource());
    }
}
