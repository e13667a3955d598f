package io.dwolla.examples.cli.tasks;

import io.dwolla.client.DwollaException;
import io.dwolla.client.http.RestResponse;
import io.dwolla.examples.cli.CommandTask;
import io.dwolla.examples.cli.Task;
import io.dwolla.examples.cli.TaskContext;
import io.dwolla.model.CreateTransferRequest;
import io.dwolla.model.Money;

@Task(command = "transfers:create", description = "Transfer USD between two funding sources")
public class CreateTransferTask implements CommandTask {

    @Override
    public void run(TaskContext context) throws DwollaException {
        String source = context.prompt("Source funding source id");
        String destination = context.prompt("Destination funding source id");
        String amount = context.prompt("Amount (USD)");

        CreateTransferRequest request = CreateTransferRequest.of(
                context.uri("/funding-sources/" + source),
                context.uri("/funding-sources/" + destination),
                Money.usd(amount));

        RestResponse<Void> response = context.client().post(context.uri("/transfers"), request, context.headers());
        context.out().println("Created " + response.location());
    }
}
