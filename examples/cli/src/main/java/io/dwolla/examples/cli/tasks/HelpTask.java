package io.dwolla.examples.cli.tasks;

import java.util.Map;

import io.dwolla.examples.cli.CommandTask;
import io.dwolla.examples.cli.Task;
import io.dwolla.examples.cli.TaskContext;

@Task(command = HelpTask.COMMAND, description = "List the available commands")
public class HelpTask implements CommandTask {

    public static final String COMMAND = "help";

    @Override
    public void run(TaskContext context) {
        for (Map.Entry<String, String> entry : context.registry().descriptions().entrySet()) {
            context.out().printf("  %-30s %s%n", entry.getKey(), entry.getValue());
        }
    }
}
