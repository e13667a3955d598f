package io.dwolla.examples.cli;

import io.dwolla.client.DwollaException;

/**
 * A console command. Implementations are annotated with {@link Task}.
 */
public interface CommandTask {

    void run(TaskContext context) throws DwollaException;
}
