package io.cardfederation.tasks;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static io.cardfederation.config.Constants.TASK_STATUS_FAILED;

/**
 * Runs the recurring federation tasks on a fixed delay. A failing task never stops the loop.
 * Every tick runs under a fresh {@link CancellationToken}; {@link #stop()} cancels the running tick.
 */
@Slf4j
public class SyncTaskManager {

    private final TaskContext taskContext;
    private final List<Task> tasks;
    private final long intervalSeconds;

    private final ScheduledExecutorService scheduler;
    private volatile boolean isRunning = false;
    private volatile CancellationToken currentTick = CancellationToken.NONE;

    public SyncTaskManager(TaskContext taskContext, List<Task> tasks, long intervalSeconds) {
        this.taskContext = taskContext;
        this.tasks = List.copyOf(tasks);
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    public void start() {
        log.info("Starting sync task manager with {} tasks every {}s", tasks.size(), intervalSeconds);
        isRunning = true;
        scheduler.scheduleWithFixedDelay(
                this::processTaskLoop,
                intervalSeconds,
                intervalSeconds,
                TimeUnit.SECONDS
        );
    }

    public void stop() {
        log.info("Stopping sync task manager");
        isRunning = false;
        CancellationToken tick = currentTick;
        if (tick != CancellationToken.NONE) {
            tick.cancel();
        }
        scheduler.shutdownNow();
    }

    public boolean isRunning() {
        return isRunning;
    }

    void processTaskLoop() {
        CancellationToken tick = CancellationToken.create();
        currentTick = tick;
        TaskContext tickContext = taskContext.withCancellationToken(tick);
        try {
            for (Task task : tasks) {
                if (tick.isCancelled()) {
                    log.info("Task loop cancelled before task {}", task.getName());
                    break;
                }
                String result = executeTask(task, tickContext);
                log.debug("Task {} finished with result: {}", task.getName(), result);
            }
        } finally {
            if (currentTick == tick) {
                currentTick = CancellationToken.NONE;
            }
        }
    }

    CancellationToken getCurrentTick() {
        return currentTick;
    }

    private String executeTask(Task task, TaskContext context) {
        try {
            return task.execute(context);
        } catch (Exception e) {
            log.error("Failed to execute task {}: {}", task.getName(), e.getMessage(), e);
            return TASK_STATUS_FAILED;
        }
    }
}
