@NullMarked
package io.dwolla.util;

import org.jspecify.annotations.NullMarked;
