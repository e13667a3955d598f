package io.dwolla.examples.cli.tasks;

import io.dwolla.client.DwollaException;
import io.dwolla.client.http.RestResponse;
import io.dwolla.examples.cli.CommandTask;
import io.dwolla.examples.cli.Task;
import io.dwolla.examples.cli.TaskContext;
import io.dwolla.model.CreateCustomerRequest;

@Task(command = "customers:create", description = "Create an unverified customer")
public class CreateCustomerTask implements CommandTask {

    @Override
    public void run(TaskContext context) throws DwollaException {
        CreateCustomerRequest request = CreateCustomerRequest.builder()
                .firstName(context.prompt("First name"))
                .lastName(context.prompt("Last name"))
                .email(context.prompt("Email"))
                .build();

        RestResponse<Void> response = context.client().post(context.uri("/customers"), request, context.headers());
        context.out().println("Created " + response.location());
    }
}
