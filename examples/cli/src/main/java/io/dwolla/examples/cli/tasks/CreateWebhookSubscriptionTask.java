package io.dwolla.examples.cli.tasks;

import io.dwolla.client.DwollaException;
import io.dwolla.client.http.RestResponse;
import io.dwolla.examples.cli.CommandTask;
import io.dwolla.examples.cli.Task;
import io.dwolla.examples.cli.TaskContext;
import io.dwolla.model.CreateWebhookSubscriptionRequest;

@Task(command = "webhook-subscriptions:create", description = "Subscribe a URL to webhooks")
public class CreateWebhookSubscriptionTask implements CommandTask {

    @Override
    public void run(TaskContext context) throws DwollaException {
        CreateWebhookSubscriptionRequest request = new CreateWebhookSubscriptionRequest(
                context.prompt("Webhook URL"), context.prompt("Secret"));

        RestResponse<Void> response = context.client()
                .post(context.uri("/webhook-subscriptions"), request, context.headers());
        context.out().println("Created " + response.location());
    }
}
