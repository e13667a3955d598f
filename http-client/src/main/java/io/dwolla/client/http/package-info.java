/**
 * Pluggable HTTP transport for the Dwolla client.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link io.dwolla.client.http.RestClient} - transport contract, sends a prepared request</li>
 *   <li>{@link io.dwolla.client.http.RestRequest} - method, URI, headers and encoded body</li>
 *   <li>{@link io.dwolla.client.http.RestResponse} - parsed content or raw failure context</li>
 *   <li>{@link io.dwolla.client.http.MultipartBody} - {@code multipart/form-data} encoder</li>
 *   <li>{@link io.dwolla.client.http.RestClientBuilder} - factory, defaults to the JDK transport</li>
 * </ul>
 *
 * <h2>Provider System</h2>
 * <p>{@link io.dwolla.client.http.RestClientBuilder#DEFAULT_FACTORY} creates a transport backed by
 * {@link java.net.http.HttpClient}. A Vert.x based transport is available as a separate artifact.
 */
@NullMarked
package io.dwolla.client.http;

import org.jspecify.annotations.NullMarked;
