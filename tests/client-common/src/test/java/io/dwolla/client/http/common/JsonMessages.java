package io.dwolla.client.http.common;

/**
 * Canned API payloads for transport tests.
 */
public final class JsonMessages {

    public static final String CUSTOMER = """
            {"id":"1","firstName":"Jane","status":"verified"}""";

    public static final String CUSTOMERS = """
            [{"id":"1","firstName":"Jane","status":"verified"},{"id":"2","firstName":"John","status":"unverified"}]""";

    public static final String CREATE_CUSTOMER = """
            {"firstName":"Jane","lastName":"Doe","email":"jane@example.com"}""";

    public static final String EXPIRED_TOKEN = """
            {"code":"ExpiredAccessToken","message":"Access token expired."}""";

    public static final String ROOT = """
            {"_links":{"account":{"href":"https://api-sandbox.dwolla.com/accounts/abc"}}}""";

    private JsonMessages() {
    }

    public record Customer(String id, String firstName, String status) {
    }
}
