package io.dwolla.client;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import com.fasterxml.jackson.core.type.TypeReference;
import io.dwolla.client.http.HttpMethod;
import io.dwolla.client.http.RequestBody;
import io.dwolla.client.http.RestClient;
import io.dwolla.client.http.RestClientBuilder;
import io.dwolla.client.http.RestClientOptions;
import io.dwolla.client.http.RestException;
import io.dwolla.client.http.RestRequest;
import io.dwolla.client.http.RestResponse;
import io.dwolla.model.DocumentFile;
import io.dwolla.model.Headers;
import io.dwolla.model.UploadDocumentRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

public class DwollaClientTest {

    private static final String JSON_V1 = "application/vnd.dwolla.v1.hal+json";
    private static final String REQUEST_ID = "some-id";
    private static final URI REQUEST_URI = URI.create("https://api-sandbox.dwolla.com/foo");
    private static final URI AUTH_REQUEST_URI = URI.create("https://api-sandbox.dwolla.com/token");
    private static final Headers HEADERS = new Headers().add("key1", "value1").add("key2", "value2");
    private static final TestRequest REQUEST = new TestRequest("requestTest");
    private static final TestResponse RESPONSE = new TestResponse("responseTest");
    private static final TypeReference<List<TestResponse>> RESPONSES = new TypeReference<List<TestResponse>>() {};

    private RestClient restClient;
    private DwollaClient client;

    @BeforeEach
    public void setUp() {
        restClient = mock(RestClient.class);
        client = new DwollaClient(restClient);
    }

    @Test
    public void testCreateRestClientConfiguresDefaultHeaders() {
        RestClientBuilder builder = mock(RestClientBuilder.class);
        ArgumentCaptor<RestClientOptions> options = ArgumentCaptor.forClass(RestClientOptions.class);
        when(builder.create(options.capture())).thenReturn(restClient);

        RestClient created = DwollaClient.createRestClient(DwollaClientConfig.builder()
                .restClientBuilder(builder)
                .build());

        assertSame(restClient, created);
        assertEquals("dwolla-v2-java/" + DwollaClient.VERSION, options.getValue().defaultHeaders().get("User-Agent"));
        assertEquals(JSON_V1, options.getValue().defaultHeaders().get("Accept"));
    }

    @Test
    public void testGetPassesRequestToTransport() throws Exception {
        RestResponse<TestResponse> response = success(HttpMethod.GET, RESPONSE);
        ArgumentCaptor<RestRequest> captor = ArgumentCaptor.forClass(RestRequest.class);
        when(restClient.sendAsync(captor.capture(), eq(TestResponse.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        RestResponse<TestResponse> actual = client.get(REQUEST_URI, TestResponse.class, HEADERS);

        assertSame(response, actual);
        RestRequest request = captor.getValue();
        assertEquals(HttpMethod.GET, request.method());
        assertEquals(REQUEST_URI, request.uri());
        assertEquals(HEADERS.asMap(), request.headers());
        assertNull(request.body());
    }

    @Test
    public void testGetThrowsOnTransportFailure() {
        RestResponse<TestResponse> response = failure(HttpMethod.GET, REQUEST_URI, "Content");
        when(restClient.sendAsync(any(RestRequest.class), eq(TestResponse.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        DwollaException e = assertThrows(DwollaException.class,
                () -> client.get(REQUEST_URI, TestResponse.class, HEADERS));

        assertEquals(expectedMessage("GET", REQUEST_URI), e.getMessage());
        assertEquals("Content", e.getContent());
        assertSame(response, e.getResponse());
        assertNull(e.getError());
        assertEquals(REQUEST_ID, e.getRequestId());
        assertEquals(500, e.getStatusCode());
    }

    @Test
    public void testGetAsyncCompletesExceptionally() {
        RestResponse<TestResponse> response = failure(HttpMethod.GET, REQUEST_URI, "Content");
        when(restClient.sendAsync(any(RestRequest.class), eq(TestResponse.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        CompletableFuture<RestResponse<TestResponse>> future = client.getAsync(REQUEST_URI, TestResponse.class, HEADERS);

        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(DwollaException.class, e.getCause());
    }

    @Test
    public void testGetWithTypeReference() throws Exception {
        RestResponse<List<TestResponse>> response = success(HttpMethod.GET, List.of(RESPONSE));
        ArgumentCaptor<RestRequest> captor = ArgumentCaptor.forClass(RestRequest.class);
        when(restClient.sendAsync(captor.capture(), eq(RESPONSES)))
                .thenReturn(CompletableFuture.completedFuture(response));

        RestResponse<List<TestResponse>> actual = client.get(REQUEST_URI, RESPONSES, HEADERS);

        assertSame(response, actual);
        assertEquals(List.of(RESPONSE), actual.content());
        assertEquals(HttpMethod.GET, captor.getValue().method());
        assertEquals(HEADERS.asMap(), captor.getValue().headers());
    }

    @Test
    public void testPostWithTypeReferenceThrowsOnTransportFailure() {
        RestResponse<List<TestResponse>> response = failure(HttpMethod.POST, REQUEST_URI, "Content");
        when(restClient.sendAsync(any(RestRequest.class), eq(RESPONSES)))
                .thenReturn(CompletableFuture.completedFuture(response));

        DwollaException e = assertThrows(DwollaException.class,
                () -> client.post(REQUEST_URI, REQUEST, RESPONSES, HEADERS));

        assertEquals(expectedMessage("POST", REQUEST_URI), e.getMessage());
        assertSame(response, e.getResponse());
    }

    @Test
    public void testDeleteWithTypeReferenceSendsBody() throws Exception {
        RestResponse<List<TestResponse>> response = success(HttpMethod.DELETE, List.of(RESPONSE));
        ArgumentCaptor<RestRequest> captor = ArgumentCaptor.forClass(RestRequest.class);
        when(restClient.sendAsync(captor.capture(), eq(RESPONSES)))
                .thenReturn(CompletableFuture.completedFuture(response));

        RestResponse<List<TestResponse>> actual = client.delete(REQUEST_URI, REQUEST, RESPONSES, HEADERS);

        assertSame(response, actual);
        assertEquals(HttpMethod.DELETE, captor.getValue().method());
        assertEquals("{\"message\":\"requestTest\"}", captor.getValue().body().asString());
    }

    @Test
    public void testPostSerializesBodyAsHalJson() throws Exception {
        RestResponse<TestResponse> response = success(HttpMethod.POST, RESPONSE);
        ArgumentCaptor<RestRequest> captor = ArgumentCaptor.forClass(RestRequest.class);
        when(restClient.sendAsync(captor.capture(), eq(TestResponse.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        RestResponse<TestResponse> actual = client.post(REQUEST_URI, REQUEST, TestResponse.class, HEADERS);

        assertSame(response, actual);
        RestRequest request = captor.getValue();
        assertEquals(HttpMethod.POST, request.method());
        assertEquals(HEADERS.asMap(), request.headers());
        assertEquals("{\"message\":\"requestTest\"}", request.body().asString());
        assertEquals(JSON_V1 + "; charset=utf-8", request.body().contentType());
    }

    @Test
    public void testPostThrowsOnTransportFailure() {
        RestResponse<TestResponse> response = failure(HttpMethod.POST, REQUEST_URI, "Content");
        when(restClient.sendAsync(any(RestRequest.class), eq(TestResponse.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        DwollaException e = assertThrows(DwollaException.class,
                () -> client.post(REQUEST_URI, REQUEST, TestResponse.class, HEADERS));

        assertEquals(expectedMessage("POST", REQUEST_URI), e.getMessage());
        assertEquals("Content", e.getContent());
        assertNull(e.getError());
    }

    @Test
    public void testPostWithoutResponseModel() throws Exception {
        RestResponse<Void> response = success(HttpMethod.POST, null);
        ArgumentCaptor<RestRequest> captor = ArgumentCaptor.forClass(RestRequest.class);
        when(restClient.sendAsync(captor.capture(), eq(Void.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        RestResponse<Void> actual = client.post(REQUEST_URI, REQUEST, HEADERS);

        assertSame(response, actual);
        assertEquals("{\"message\":\"requestTest\"}", captor.getValue().body().asString());
    }

    @Test
    public void testPostWithoutResponseModelThrowsOnTransportFailure() {
        RestResponse<Void> response = failure(HttpMethod.POST, REQUEST_URI, "Content");
        when(restClient.sendAsync(any(RestRequest.class), eq(Void.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        DwollaException e = assertThrows(DwollaException.class, () -> client.post(REQUEST_URI, REQUEST, HEADERS));

        assertEquals(expectedMessage("POST", REQUEST_URI), e.getMessage());
        assertSame(response, e.getResponse());
    }

    @Test
    public void testUploadSendsMultipartBody() throws Exception {
        RestResponse<Void> response = success(HttpMethod.POST, null);
        ArgumentCaptor<RestRequest> captor = ArgumentCaptor.forClass(RestRequest.class);
        when(restClient.sendAsync(captor.capture(), eq(Void.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        RestResponse<Void> actual = client.upload(REQUEST_URI, uploadRequest(), HEADERS);

        assertSame(response, actual);
        RestRequest request = captor.getValue();
        assertEquals(HttpMethod.POST, request.method());
        assertEquals(HEADERS.asMap(), request.headers());
        String content = request.body().asString();
        assertTrue(content.contains("----------Upload"));
        assertTrue(content.contains("name=\"documentType\""));
        assertTrue(content.contains("Content-Disposition: form-data; name=\"file\"; filename=\"test.png\""));
        assertTrue(content.contains("Content-Type: image/png"));
        assertEquals("multipart/form-data; boundary=\"----------Upload\"", request.body().contentType());
    }

    @Test
    public void testUploadThrowsOnTransportFailure() {
        RestResponse<Void> response = failure(HttpMethod.POST, REQUEST_URI, "Content");
        when(restClient.sendAsync(any(RestRequest.class), eq(Void.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        DwollaException e = assertThrows(DwollaException.class,
                () -> client.upload(REQUEST_URI, uploadRequest(), HEADERS));

        assertEquals(expectedMessage("POST", REQUEST_URI), e.getMessage());
        assertEquals("Content", e.getContent());
    }

    @Test
    public void testDeleteWithBody() throws Exception {
        RestResponse<Void> response = success(HttpMethod.DELETE, null);
        ArgumentCaptor<RestRequest> captor = ArgumentCaptor.forClass(RestRequest.class);
        when(restClient.sendAsync(captor.capture(), eq(Void.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        RestResponse<Void> actual = client.delete(REQUEST_URI, REQUEST, Void.class, HEADERS);

        assertSame(response, actual);
        RestRequest request = captor.getValue();
        assertEquals(HttpMethod.DELETE, request.method());
        assertEquals(HEADERS.asMap(), request.headers());
        assertEquals("{\"message\":\"requestTest\"}", request.body().asString());
        assertEquals(JSON_V1 + "; charset=utf-8", request.body().contentType());
    }

    @Test
    public void testDeleteWithoutBodySendsNoContent() throws Exception {
        RestResponse<Void> response = success(HttpMethod.DELETE, null);
        ArgumentCaptor<RestRequest> captor = ArgumentCaptor.forClass(RestRequest.class);
        when(restClient.sendAsync(captor.capture(), eq(Void.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        RestResponse<Void> actual = client.delete(REQUEST_URI, null, Void.class, HEADERS);

        assertSame(response, actual);
        assertNull(captor.getValue().body());
    }

    @Test
    public void testDeleteThrowsOnTransportFailure() {
        RestResponse<Void> response = failure(HttpMethod.DELETE, REQUEST_URI, "Content");
        when(restClient.sendAsync(any(RestRequest.class), eq(Void.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        DwollaException e = assertThrows(DwollaException.class,
                () -> client.delete(REQUEST_URI, REQUEST, Void.class, HEADERS));

        assertEquals(expectedMessage("DELETE", REQUEST_URI), e.getMessage());
        assertNull(e.getError());
    }

    @Test
    public void testPostAuthUsesPlainJsonAndNoHeaders() throws Exception {
        RestResponse<TestResponse> response = success(HttpMethod.POST, RESPONSE);
        ArgumentCaptor<RestRequest> captor = ArgumentCaptor.forClass(RestRequest.class);
        when(restClient.sendAsync(captor.capture(), eq(TestResponse.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        RestResponse<TestResponse> actual = client.postAuth(AUTH_REQUEST_URI, REQUEST, TestResponse.class);

        assertSame(response, actual);
        RestRequest request = captor.getValue();
        assertEquals(HttpMethod.POST, request.method());
        assertEquals(AUTH_REQUEST_URI, request.uri());
        assertTrue(request.headers().isEmpty());
        assertEquals("{\"message\":\"requestTest\"}", request.body().asString());
        assertEquals("application/json; charset=utf-8", request.body().contentType());
    }

    @Test
    public void testPostAuthThrowsOnTransportFailure() {
        RestResponse<TestResponse> response = failure(HttpMethod.POST, AUTH_REQUEST_URI, "Content");
        when(restClient.sendAsync(any(RestRequest.class), eq(TestResponse.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        DwollaException e = assertThrows(DwollaException.class,
                () -> client.postAuth(AUTH_REQUEST_URI, REQUEST, TestResponse.class));

        assertEquals(expectedMessage("POST", AUTH_REQUEST_URI), e.getMessage());
        assertEquals("Content", e.getContent());
        assertNull(e.getError());
    }

    @Test
    public void testDeserializesErrorPayload() {
        URI uri = URI.create("https://api-sandbox.example.com/foo");
        RestResponse<TestResponse> response = failure(HttpMethod.GET, uri,
                "{\"code\":\"ExpiredAccessToken\",\"message\":\"Access token expired.\"}");
        when(restClient.sendAsync(any(RestRequest.class), eq(TestResponse.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        DwollaException e = assertThrows(DwollaException.class, () -> client.get(uri, TestResponse.class, HEADERS));

        assertEquals("API Error, Resource=\"GET https://api-sandbox.example.com/foo\", RequestId=\"some-id\"",
                e.getMessage());
        assertEquals("ExpiredAccessToken", e.getCode());
        assertEquals("ExpiredAccessToken", e.getError().code());
        assertEquals("Access token expired.", e.getError().message());
    }

    @Test
    public void testJsonNullErrorBodyKeepsResourceAndRequestId() {
        assertNonErrorPayload("null");
    }

    @Test
    public void testJsonArrayErrorBodyKeepsResourceAndRequestId() {
        assertNonErrorPayload("[]");
    }

    @Test
    public void testJsonStringErrorBodyKeepsResourceAndRequestId() {
        assertNonErrorPayload("\"text\"");
    }

    private void assertNonErrorPayload(String content) {
        URI uri = URI.create("https://api-sandbox.example.com/foo");
        RestResponse<TestResponse> response = failure(HttpMethod.GET, uri, content);
        when(restClient.sendAsync(any(RestRequest.class), eq(TestResponse.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        DwollaException e = assertThrows(DwollaException.class, () -> client.get(uri, TestResponse.class, HEADERS));

        assertEquals("API Error, Resource=\"GET https://api-sandbox.example.com/foo\", RequestId=\"some-id\"",
                e.getMessage());
        assertNull(e.getError());
        assertNull(e.getCode());
        assertEquals(content, e.getContent());
        assertSame(response, e.getResponse());
        assertEquals(500, e.getStatusCode());
    }

    @Test
    public void testMissingRequestIdLeavesItEmpty() {
        RestRequest request = RestRequest.builder().method(HttpMethod.GET).uri(REQUEST_URI).build();
        RestResponse<TestResponse> response = RestResponse.failure(request, 0, Map.of(), null,
                new RestException("Request failed: Connection refused", new java.net.ConnectException("Connection refused")));
        when(restClient.sendAsync(any(RestRequest.class), eq(TestResponse.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        DwollaException e = assertThrows(DwollaException.class,
                () -> client.get(REQUEST_URI, TestResponse.class, null));

        assertEquals("API Error, Resource=\"GET https://api-sandbox.dwolla.com/foo\", RequestId=\"\"", e.getMessage());
        assertEquals(0, e.getStatusCode());
        assertNull(e.getContent());
        assertInstanceOf(RestException.class, e.getCause());
    }

    @Test
    public void testUnserializableBodyIsNotSent() {
        Object unserializable = new Object();

        DwollaException e = assertThrows(DwollaException.class,
                () -> client.post(REQUEST_URI, unserializable, HEADERS));

        assertNull(e.getResponse());
        verifyNoInteractions(restClient);
    }

    @Test
    public void testUriResolvesAgainstApiUrl() {
        DwollaClient local = new DwollaClient(restClient, URI.create("http://localhost:8080/"));

        assertEquals(URI.create("http://localhost:8080/customers"), local.uri("/customers"));
        assertEquals(URI.create("http://localhost:8080/customers"), local.uri("customers"));
        assertEquals(URI.create("https://api.dwolla.com/transfers/1"), local.uri("https://api.dwolla.com/transfers/1"));
    }

    private static UploadDocumentRequest uploadRequest() {
        return new UploadDocumentRequest("idCard", new DocumentFile("image/png", "test.png",
                new ByteArrayInputStream("PNG".getBytes(StandardCharsets.UTF_8))));
    }

    private static <T> RestResponse<T> success(HttpMethod method, T content) {
        RestRequest request = RestRequest.builder().method(method).uri(REQUEST_URI).build();
        return RestResponse.success(request, 200, Map.of("x-request-id", List.of(REQUEST_ID)), content, null);
    }

    private static <T> RestResponse<T> failure(HttpMethod method, URI uri, String content) {
        RestRequest request = RestRequest.builder().method(method).uri(uri).body(
                method == HttpMethod.GET ? null : RequestBody.utf8(JSON_V1, "{}")).build();
        return RestResponse.failure(request, 500, Map.of("x-request-id", List.of(REQUEST_ID)), content,
                new RestException("RestMessage", 500, content));
    }

    private static String expectedMessage(String method, URI uri) {
        return "API Error, Resource=\"" + method + " " + uri + "\", RequestId=\"" + REQUEST_ID + "\"";
    }

    public record TestRequest(String message) {
    }

    public record TestResponse(String message) {
    }
}
