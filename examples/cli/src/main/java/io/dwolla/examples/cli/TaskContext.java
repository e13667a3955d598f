package io.dwolla.examples.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.net.URI;

import io.dwolla.client.DwollaClient;
import io.dwolla.client.DwollaException;
import io.dwolla.client.TokenManager;
import io.dwolla.model.Headers;
import io.dwolla.util.Assert;

/**
 * Everything a {@link CommandTask} needs: the API client, the application token and the console.
 */
public class TaskContext {

    private final DwollaClient client;
    private final TokenManager tokenManager;
    private final TaskRegistry registry;
    private final BufferedReader in;
    private final PrintStream out;
    private boolean exitRequested;

    public TaskContext(DwollaClient client, TokenManager tokenManager, TaskRegistry registry,
                       BufferedReader in, PrintStream out) {
        this.client = Assert.checkNotNullParam("client", client);
        this.tokenManager = Assert.checkNotNullParam("tokenManager", tokenManager);
        this.registry = Assert.checkNotNullParam("registry", registry);
        this.in = Assert.checkNotNullParam("in", in);
        this.out = Assert.checkNotNullParam("out", out);
    }

    public DwollaClient client() {
        return client;
    }

    public TaskRegistry registry() {
        return registry;
    }

    public PrintStream out() {
        return out;
    }

    public URI uri(String path) {
        return client.uri(path);
    }

    /**
     * @return {@code Authorization} headers carrying a valid application token
     */
    public Headers headers() throws DwollaException {
        return tokenManager.authorizationHeaders();
    }

    /**
     * Prints {@code label} and reads one line from the console.
     *
     * @return the trimmed line, empty at end of input
     */
    public String prompt(String label) {
        out.print(label + ": ");
        out.flush();
        return readLine().trim();
    }

    String readLine() {
        try {
            String line = in.readLine();
            if (line == null) {
                exitRequested = true;
                return "";
            }
            return line;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void requestExit() {
        exitRequested = true;
    }

    public boolean isExitRequested() {
        return exitRequested;
    }
}
