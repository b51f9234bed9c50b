package io.cardfederation.tasks;

import io.cardfederation.federation.FederationService;
import lombok.Getter;

import java.time.Clock;

/**
 * Context object providing access to shared components for task execution.
 * The task manager hands each tick its own copy carrying that tick's cancellation token.
 */
@Getter
public class TaskContext {

    private final FederationService federationService;
    private final Clock clock;
    private final CancellationToken cancellationToken;

    public TaskContext(FederationService federationService, Clock clock) {
        this(federationService, clock, CancellationToken.NONE);
    }

    public TaskContext(FederationService federationService, Clock clock, CancellationToken cancellationToken) {
        this.federationService = federationService;
        this.clock = clock;
        this.cancellationToken = cancellationToken;
    }

    public TaskContext withCancellationToken(CancellationToken token) {
        return new TaskContext(federationService, clock, token);
    }
}
