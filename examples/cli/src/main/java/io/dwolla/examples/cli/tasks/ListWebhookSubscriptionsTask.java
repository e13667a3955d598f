package io.dwolla.examples.cli.tasks;

import io.dwolla.client.DwollaException;
import io.dwolla.examples.cli.CommandTask;
import io.dwolla.examples.cli.Task;
import io.dwolla.examples.cli.TaskContext;
import io.dwolla.model.GetWebhookSubscriptionsResponse;
import io.dwolla.model.WebhookSubscription;

@Task(command = "webhook-subscriptions:list", description = "List webhook subscriptions")
public class ListWebhookSubscriptionsTask implements CommandTask {

    @Override
    public void run(TaskContext context) throws DwollaException {
        GetWebhookSubscriptionsResponse response = context.client()
                .get(context.uri("/webhook-subscriptions"), GetWebhookSubscriptionsResponse.class, context.headers())
                .content();
        if (response == null) {
            return;
        }
        for (WebhookSubscription subscription : response.webhookSubscriptions()) {
            context.out().println(" - ID: " + subscription.id() + "  " + subscription.url()
                    + (subscription.paused() ? " (paused)" : ""));
        }
    }
}
