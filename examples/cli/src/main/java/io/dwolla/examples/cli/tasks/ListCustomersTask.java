package io.dwolla.examples.cli.tasks;

import io.dwolla.client.DwollaException;
import io.dwolla.examples.cli.CommandTask;
import io.dwolla.examples.cli.Task;
import io.dwolla.examples.cli.TaskContext;
import io.dwolla.model.Customer;
import io.dwolla.model.GetCustomersResponse;

@Task(command = "customers:list", description = "List the first 10 customers")
public class ListCustomersTask implements CommandTask {

    @Override
    public void run(TaskContext context) throws DwollaException {
        GetCustomersResponse response = context.client()
                .get(context.uri("/customers?limit=10"), GetCustomersResponse.class, context.headers())
                .content();
        if (response == null) {
            return;
        }
        for (Customer customer : response.customers()) {
            context.out().println(" - ID: " + customer.id() + "  " + customer.firstName() + " " + customer.lastName()
                    + " (" + customer.status() + ")");
        }
    }
}
