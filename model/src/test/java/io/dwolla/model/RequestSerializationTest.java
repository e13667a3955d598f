package io.dwolla.model;

import static io.dwolla.util.Utils.marshal;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.net.URI;

import org.junit.jupiter.api.Test;

public class RequestSerializationTest {

    @Test
    void testCreateCustomerRequestOmitsUnsetFields() throws Exception {
        CreateCustomerRequest request = CreateCustomerRequest.builder()
                .firstName("Jane")
                .lastName("Doe")
                .email("jane@example.com")
                .build();

        assertEquals("{\"firstName\":\"Jane\",\"lastName\":\"Doe\",\"email\":\"jane@example.com\"}", marshal(request));
    }

    @Test
    void testCreateCustomerRequestRequiresEmail() {
        assertThrows(IllegalArgumentException.class,
                () -> CreateCustomerRequest.builder().firstName("Jane").lastName("Doe").build());
    }

    @Test
    void testCreateTransferRequestWritesLinks() throws Exception {
        CreateTransferRequest request = CreateTransferRequest.of(
                URI.create("https://api-sandbox.dwolla.com/funding-sources/a"),
                URI.create("https://api-sandbox.dwolla.com/funding-sources/b"),
                Money.usd(new BigDecimal("10")));

        assertEquals("{\"_links\":{"
                + "\"source\":{\"href\":\"https://api-sandbox.dwolla.com/funding-sources/a\"},"
                + "\"destination\":{\"href\":\"https://api-sandbox.dwolla.com/funding-sources/b\"}},"
                + "\"amount\":{\"value\":\"10.00\",\"currency\":\"USD\"}}", marshal(request));
    }

    @Test
    void testAppTokenRequestUsesOAuthNames() throws Exception {
        AppTokenRequest request = AppTokenRequest.clientCredentials("key", "secret");

        assertEquals("{\"client_id\":\"key\",\"client_secret\":\"secret\",\"grant_type\":\"client_credentials\"}",
                marshal(request));
        assertFalse(request.toString().contains("secret"));
    }

    @Test
    void testUploadDocumentRequestValidation() {
        DocumentFile file = new DocumentFile("image/png", "id.png", new ByteArrayInputStream(new byte[0]));

        assertThrows(IllegalArgumentException.class, () -> new UploadDocumentRequest(" ", file));
        assertEquals("idCard", new UploadDocumentRequest("idCard", file).documentType());
    }
}
