package io.dwolla.examples.cli;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import io.dwolla.client.DwollaClient;
import io.dwolla.client.DwollaClientConfig;
import io.dwolla.client.DwollaException;
import io.dwolla.client.TokenManager;
import io.dwolla.examples.cli.tasks.CreateCustomerTask;
import io.dwolla.examples.cli.tasks.CreateTransferTask;
import io.dwolla.examples.cli.tasks.CreateWebhookSubscriptionTask;
import io.dwolla.examples.cli.tasks.DeleteWebhookSubscriptionTask;
import io.dwolla.examples.cli.tasks.ExitTask;
import io.dwolla.examples.cli.tasks.GetCustomerTask;
import io.dwolla.examples.cli.tasks.GetTransferTask;
import io.dwolla.examples.cli.tasks.HelpTask;
import io.dwolla.examples.cli.tasks.ListCustomersTask;
import io.dwolla.examples.cli.tasks.ListFundingSourcesTask;
import io.dwolla.examples.cli.tasks.ListWebhookSubscriptionsTask;
import io.dwolla.examples.cli.tasks.RootTask;
import io.dwolla.examples.cli.tasks.UploadDocumentTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interactive console for trying the API against the sandbox.
 * <p>
 * Credentials are read from {@code DWOLLA_APP_KEY} and {@code DWOLLA_APP_SECRET}.
 */
public class ExampleApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExampleApp.class);

    static final String PROMPT = "What would you like to do? (Press ? for options)";

    private final TaskContext context;

    public ExampleApp(TaskContext context) {
        this.context = context;
    }

    public static TaskRegistry defaultRegistry() {
        return new TaskRegistry(List.of(
                new HelpTask(),
                new ExitTask(),
                new RootTask(),
                new ListCustomersTask(),
                new CreateCustomerTask(),
                new GetCustomerTask(),
                new ListFundingSourcesTask(),
                new CreateTransferTask(),
                new GetTransferTask(),
                new ListWebhookSubscriptionsTask(),
                new CreateWebhookSubscriptionTask(),
                new DeleteWebhookSubscriptionTask(),
                new UploadDocumentTask()));
    }

    /**
     * Reads commands until {@code exit} or end of input.
     */
    public void run() {
        PrintStream out = context.out();
        while (!context.isExitRequested()) {
            out.println();
            out.println(PROMPT);
            String command = context.readLine().trim();
            if (command.isEmpty()) {
                continue;
            }
            if (command.equals("?")) {
                command = HelpTask.COMMAND;
            }

            CommandTask task = context.registry().get(command);
            if (task == null) {
                out.println("Unknown command '" + command + "'. Press ? for options.");
                continue;
            }

            try {
                task.run(context);
            } catch (DwollaException e) {
                LOGGER.debug("{} failed", command, e);
                printError(out, e);
            } catch (IllegalArgumentException | ArithmeticException e) {
                out.println("Invalid input: " + e.getMessage());
            }
        }
    }

    static void printError(PrintStream out, DwollaException e) {
        if (e.getError() != null) {
            out.println("Error: " + e.getError().code() + " - " + e.getError().message());
            e.getError().errors().forEach(detail ->
                    out.println("  " + detail.path() + ": " + detail.message()));
        } else {
            out.println("Error: " + e.getMessage());
        }
        if (e.getRequestId() != null) {
            out.println("Request id: " + e.getRequestId());
        }
    }

    public static void main(String[] args) {
        DwollaClientConfig config = DwollaClientConfig.fromEnvironment(System.getenv());
        LOGGER.info("Using {}", config);
        try (DwollaClient client = DwollaClient.create(config)) {
            TokenManager tokenManager = TokenManager.create(client, config);
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            new ExampleApp(new TaskContext(client, tokenManager, defaultRegistry(), in, System.out)).run();
        }
    }
}
