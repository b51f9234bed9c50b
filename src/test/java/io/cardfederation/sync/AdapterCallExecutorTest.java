package io.cardfederation.sync;

import io.cardfederation.enums.FailureKind;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.exceptions.AdapterCallException;
import io.cardfederation.exceptions.OperationCancelledException;
import io.cardfederation.tasks.CancellationToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdapterCallExecutorTest {

    private final AdapterCallExecutor executor =
            new AdapterCallExecutor(Executors.newCachedThreadPool(), Duration.ofMillis(300));

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void testCall_ReturnsValue() {
        assertThat(executor.call(PlatformId.HUB, "push", () -> "h-1", CancellationToken.NONE)).isEqualTo("h-1");
    }

    @Test
    void testCall_SlowCallTimesOutAndIsInterrupted() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThatThrownBy(() -> executor.call(PlatformId.HUB, "push", () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return "late";
        }, CancellationToken.NONE))
                .isInstanceOfSatisfying(AdapterCallException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(FailureKind.TIMEOUT);
                    assertThat(e.getPlatform()).isEqualTo(PlatformId.HUB);
                });
        assertThat(interrupted.await(1, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void testCall_AdapterFailurePassesThrough() {
        AdapterCallException failure = new AdapterCallException(PlatformId.ARCHIVE, FailureKind.CLIENT_ERROR, "rejected");

        assertThatThrownBy(() -> executor.call(PlatformId.ARCHIVE, "push", () -> {
            throw failure;
        }, CancellationToken.NONE)).isSameAs(failure);
    }

    @Test
    void testCall_UnclassifiedFailureIsUnexpected() {
        assertThatThrownBy(() -> executor.call(PlatformId.ARCHIVE, "push", () -> {
            throw new IllegalStateException("boom");
        }, CancellationToken.NONE))
                .isInstanceOfSatisfying(AdapterCallException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(FailureKind.UNEXPECTED);
                    assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
                });
    }

    @Test
    void testCall_CancelledTokenNeverRuns() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        AtomicBoolean ran = new AtomicBoolean();

        assertThatThrownBy(() -> executor.call(PlatformId.HUB, "push", () -> {
            ran.set(true);
            return "x";
        }, token)).isInstanceOf(OperationCancelledException.class);
        assertThat(ran).isFalse();
    }

    @Test
    void testCall_CancelWhileRunning() throws Exception {
        AdapterCallExecutor slowBudget = new AdapterCallExecutor(Executors.newCachedThreadPool(), Duration.ofSeconds(10));
        CancellationToken token = CancellationToken.create();
        CountDownLatch started = new CountDownLatch(1);
        try {
            Thread canceller = new Thread(() -> {
                try {
                    started.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                token.cancel();
            });
            canceller.start();

            assertThatThrownBy(() -> slowBudget.call(PlatformId.HUB, "list", () -> {
                started.countDown();
                Thread.sleep(10_000);
                return "late";
            }, token)).isInstanceOf(OperationCancelledException.class);
        } finally {
            slowBudget.shutdown();
        }
    }
}
