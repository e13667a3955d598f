/**
 * Wire models of the Dwolla v2 API.
 *
 * <p>Resource representations are HAL+JSON documents: links to related resources live under
 * {@code _links} and nested collections under {@code _embedded}. Every representation type
 * implements {@link io.dwolla.model.HalResource}.
 *
 * <p>Request types validate their required fields on construction and throw
 * {@link java.lang.IllegalArgumentException} when one is missing.
 */
@NullMarked
package io.dwolla.model;

import org.jspecify.annotations.NullMarked;
