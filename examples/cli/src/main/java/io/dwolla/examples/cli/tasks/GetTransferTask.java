package io.dwolla.examples.cli.tasks;

import io.dwolla.client.DwollaException;
import io.dwolla.examples.cli.CommandTask;
import io.dwolla.examples.cli.Task;
import io.dwolla.examples.cli.TaskContext;
import io.dwolla.model.Transfer;

@Task(command = "transfers:get", description = "Show a transfer")
public class GetTransferTask implements CommandTask {

    @Override
    public void run(TaskContext context) throws DwollaException {
        String id = context.prompt("Transfer id");
        Transfer transfer = context.client()
                .get(context.uri("/transfers/" + id), Transfer.class, context.headers())
                .content();
        if (transfer != null) {
            String amount = transfer.amount() == null ? "?" : transfer.amount().value() + " " + transfer.amount().currency();
            context.out().println(transfer.id() + ": " + amount + " " + transfer.status());
        }
    }
}
