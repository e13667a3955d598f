package io.dwolla.examples.cli.tasks;

import java.util.Map;

import io.dwolla.client.DwollaException;
import io.dwolla.examples.cli.CommandTask;
import io.dwolla.examples.cli.Task;
import io.dwolla.examples.cli.TaskContext;
import io.dwolla.model.Link;
import io.dwolla.model.RootResponse;

@Task(command = "root", description = "Show the links available to this application")
public class RootTask implements CommandTask {

    @Override
    public void run(TaskContext context) throws DwollaException {
        RootResponse root = context.client().get(context.uri("/"), RootResponse.class, context.headers()).content();
        if (root == null || root.links() == null) {
            return;
        }
        for (Map.Entry<String, Link> link : root.links().entrySet()) {
            context.out().println(link.getKey() + ": " + link.getValue().href());
        }
    }
}
