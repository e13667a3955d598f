package io.dwolla.examples.cli;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the console command a {@link CommandTask} answers to.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Task {

    /**
     * @return the command typed at the prompt, e.g. {@code customers:list}
     */
    String command();

    /**
     * @return the one line shown by {@code help}
     */
    String description();
}
