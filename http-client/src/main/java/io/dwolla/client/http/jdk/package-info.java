@NullMarked
package io.dwolla.client.http.jdk;

import org.jspecify.annotations.NullMarked;
