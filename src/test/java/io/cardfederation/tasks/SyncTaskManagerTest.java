package io.cardfederation.tasks;

import io.cardfederation.federation.FederationService;
import io.cardfederation.models.FederationSettings;
import io.cardfederation.tasks.impl.PollPlatformsTask;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static io.cardfederation.config.Constants.TASK_STATUS_COMPLETED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SyncTaskManagerTest {

    private final TaskContext context = new TaskContext(mock(FederationService.class), Clock.systemUTC());

    private static Task task(String name, List<String> executed, boolean fail) {
        return new Task() {
            @Override
            public String execute(TaskContext ctx) {
                executed.add(name);
                if (fail) {
                    throw new IllegalStateException(name + " broke");
                }
                return TASK_STATUS_COMPLETED;
            }

            @Override
            public String getName() {
                return name;
            }
        };
    }

    @Test
    void testProcessTaskLoop_RunsAllTasksInOrder() {
        List<String> executed = new ArrayList<>();
        SyncTaskManager manager = new SyncTaskManager(context,
                List.of(task("connections", executed, false), task("poll", executed, false)), 60);

        manager.processTaskLoop();

        assertThat(executed).containsExactly("connections", "poll");
    }

    @Test
    void testProcessTaskLoop_FailingTaskDoesNotStopOthers() {
        List<String> executed = new ArrayList<>();
        SyncTaskManager manager = new SyncTaskManager(context,
                List.of(task("connections", executed, true), task("poll", executed, false)), 60);

        manager.processTaskLoop();

        assertThat(executed).containsExactly("connections", "poll");
    }

    @Test
    void testStartStop() {
        SyncTaskManager manager = new SyncTaskManager(context, List.of(), 60);

        manager.start();
        assertThat(manager.isRunning()).isTrue();

        manager.stop();
        assertThat(manager.isRunning()).isFalse();
    }

    @Test
    void testProcessTaskLoop_EachTickGetsItsOwnToken() {
        List<CancellationToken> seen = new ArrayList<>();
        Task recorder = new Task() {
            @Override
            public String execute(TaskContext ctx) {
                seen.add(ctx.getCancellationToken());
                return TASK_STATUS_COMPLETED;
            }

            @Override
            public String getName() {
                return "recorder";
            }
        };
        SyncTaskManager manager = new SyncTaskManager(context, List.of(recorder), 60);

        manager.processTaskLoop();
        manager.processTaskLoop();

        assertThat(seen).hasSize(2);
        assertThat(seen.get(0)).isNotSameAs(CancellationToken.NONE).isNotSameAs(seen.get(1));
        assertThat(manager.getCurrentTick()).isSameAs(CancellationToken.NONE);
    }

    @Test
    void testStop_CancelsInFlightPoll() throws Exception {
        // Given
        FederationService federationService = mock(FederationService.class);
        FederationSettings settings = FederationSettings.defaults("http://localhost:3456");
        settings.setAutoSync(true);
        when(federationService.getSettings()).thenReturn(settings);

        CountDownLatch pollStarted = new CountDownLatch(1);
        AtomicReference<CancellationToken> pollToken = new AtomicReference<>();
        AtomicBoolean cancellationObserved = new AtomicBoolean();
        when(federationService.pollAllPlatforms(any(CancellationToken.class))).thenAnswer(invocation -> {
            CancellationToken token = invocation.getArgument(0);
            pollToken.set(token);
            pollStarted.countDown();
            long deadline = System.currentTimeMillis() + 5000;
            while (!token.isCancelled() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            cancellationObserved.set(token.isCancelled());
            return List.of();
        });

        SyncTaskManager manager = new SyncTaskManager(new TaskContext(federationService, Clock.systemUTC()),
                List.of(new PollPlatformsTask()), 60);
        Thread tick = new Thread(manager::processTaskLoop, "test-tick");
        tick.start();
        assertThat(pollStarted.await(5, TimeUnit.SECONDS)).isTrue();

        // When
        manager.stop();
        tick.join(5000);

        // Then
        assertThat(tick.isAlive()).isFalse();
        assertThat(cancellationObserved).isTrue();
        assertThat(pollToken.get().isCancelled()).isTrue();
    }
}
