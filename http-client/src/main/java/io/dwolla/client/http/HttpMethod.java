package io.dwolla.client.http;

/**
 * HTTP methods used by the API.
 */
public enum HttpMethod {
    GET,
    POST,
    DELETE
}
