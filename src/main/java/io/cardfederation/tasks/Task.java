package io.cardfederation.tasks;

/**
 * Interface for recurring background tasks of the federation service.
 * Each task decides on every tick whether it is due.
 */
public interface Task {

    /**
     * Execute the task
     *
     * @param context TaskContext giving access to the federation service
     * @return Task execution result status
     */
    String execute(TaskContext context);

    /**
     * Get task name/identifier
     */
    String getName();
}
