package io.dwolla.examples.cli.tasks;

import io.dwolla.client.DwollaException;
import io.dwolla.examples.cli.CommandTask;
import io.dwolla.examples.cli.Task;
import io.dwolla.examples.cli.TaskContext;
import io.dwolla.model.Customer;

@Task(command = "customers:get", description = "Show a customer")
public class GetCustomerTask implements CommandTask {

    @Override
    public void run(TaskContext context) throws DwollaException {
        String id = context.prompt("Customer id");
        Customer customer = context.client()
                .get(context.uri("/customers/" + id), Customer.class, context.headers())
                .content();
        if (customer != null) {
            context.out().println(customer.id() + ": " + customer.firstName() + " " + customer.lastName()
                    + " <" + customer.email() + "> " + customer.status());
        }
    }
}
