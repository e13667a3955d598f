package io.dwolla.examples.cli;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;

/**
 * Ordered table of console commands, built from {@link Task}-annotated {@link CommandTask}s.
 */
public class TaskRegistry {

    private final Map<String, CommandTask> tasks = new LinkedHashMap<>();
    private final Map<String, String> descriptions = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if a task is not annotated with {@link Task} or two tasks
     *                                  declare the same command
     */
    public TaskRegistry(List<? extends CommandTask> tasks) {
        for (CommandTask task : tasks) {
            Task annotation = task.getClass().getAnnotation(Task.class);
            if (annotation == null) {
                throw new IllegalArgumentException(task.getClass().getName() + " is not annotated with @Task");
            }
            if (this.tasks.containsKey(annotation.command())) {
                throw new IllegalArgumentException("Duplicate command " + annotation.command() + " declared by "
                        + task.getClass().getName() + " and " + this.tasks.get(annotation.command()).getClass().getName());
            }
            this.tasks.put(annotation.command(), task);
            descriptions.put(annotation.command(), annotation.description());
        }
    }

    public @Nullable CommandTask get(String command) {
        return tasks.get(command);
    }

    /**
     * @return command to description, in registration order
     */
    public Map<String, String> descriptions() {
        return Collections.unmodifiableMap(descriptions);
    }
}
