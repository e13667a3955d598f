@NullMarked
package io.dwolla.client.http.vertx;

import org.jspecify.annotations.NullMarked;
