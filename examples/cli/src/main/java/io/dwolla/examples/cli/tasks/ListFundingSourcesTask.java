package io.dwolla.examples.cli.tasks;

import io.dwolla.client.DwollaException;
import io.dwolla.examples.cli.CommandTask;
import io.dwolla.examples.cli.Task;
import io.dwolla.examples.cli.TaskContext;
import io.dwolla.model.FundingSource;
import io.dwolla.model.GetFundingSourcesResponse;

@Task(command = "funding-sources:list", description = "List a customer's funding sources")
public class ListFundingSourcesTask implements CommandTask {

    @Override
    public void run(TaskContext context) throws DwollaException {
        String customerId = context.prompt("Customer id");
        GetFundingSourcesResponse response = context.client()
                .get(context.uri("/customers/" + customerId + "/funding-sources"), GetFundingSourcesResponse.class,
                        context.headers())
                .content();
        if (response == null) {
            return;
        }
        for (FundingSource fundingSource : response.fundingSources()) {
            context.out().println(" - ID: " + fundingSource.id() + "  " + fundingSource.name()
                    + " (" + fundingSource.type() + ", " + fundingSource.status() + ")");
        }
    }
}
