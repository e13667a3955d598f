/**
 * Typed client for the Dwolla v2 API.
 * <p>
 * {@link io.dwolla.client.DwollaClient} sends requests, {@link io.dwolla.client.TokenManager}
 * keeps an application token and {@link io.dwolla.client.DwollaClientConfig} selects the
 * environment and transport.
 */
@NullMarked
package io.dwolla.client;

import org.jspecify.annotations.NullMarked;
