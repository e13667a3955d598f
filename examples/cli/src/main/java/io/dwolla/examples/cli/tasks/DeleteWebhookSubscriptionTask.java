package io.dwolla.examples.cli.tasks;

import io.dwolla.client.DwollaException;
import io.dwolla.examples.cli.CommandTask;
import io.dwolla.examples.cli.Task;
import io.dwolla.examples.cli.TaskContext;

@Task(command = "webhook-subscriptions:delete", description = "Delete a webhook subscription")
public class DeleteWebhookSubscriptionTask implements CommandTask {

    @Override
    public void run(TaskContext context) throws DwollaException {
        String id = context.prompt("Webhook subscription id");
        context.client().delete(context.uri("/webhook-subscriptions/" + id), null, Void.class, context.headers());
        context.out().println("Deleted " + id);
    }
}
