package io.dwolla.examples.cli.tasks;

import io.dwolla.examples.cli.CommandTask;
import io.dwolla.examples.cli.Task;
import io.dwolla.examples.cli.TaskContext;

@Task(command = "exit", description = "Quit")
public class ExitTask implements CommandTask {

    @Override
    public void run(TaskContext context) {
        context.requestExit();
    }
}
