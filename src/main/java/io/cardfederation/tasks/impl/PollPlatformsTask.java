package io.cardfederation.tasks.impl;

import io.cardfederation.federation.FederationService;
import io.cardfederation.models.FederationSettings;
import io.cardfederation.models.PollReport;
import io.cardfederation.tasks.Task;
import io.cardfederation.tasks.TaskContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static io.cardfederation.config.Constants.TASK_POLL_PLATFORMS;
import static io.cardfederation.config.Constants.TASK_STATUS_COMPLETED;
import static io.cardfederation.config.Constants.TASK_STATUS_FAILED;
import static io.cardfederation.config.Constants.TASK_STATUS_SKIPPED;

/**
 * Reconciles every enabled platform when auto sync is on, once per sync interval.
 */
@Slf4j
public class PollPlatformsTask implements Task {

    private final IntervalGate gate = new IntervalGate();

    @Override
    public String getName() {
        return TASK_POLL_PLATFORMS;
    }

    @Override
    public String execute(TaskContext context) {
        FederationService federationService = context.getFederationService();
        FederationSettings settings = federationService.getSettings();
        Instant now = context.getClock().instant();

        if (!settings.isAutoSync()) {
            log.debug("Auto sync is off, not polling");
            return TASK_STATUS_SKIPPED;
        }
        if (!gate.isDue(now, Duration.ofMinutes(settings.getSyncIntervalMinutes()))) {
            return TASK_STATUS_SKIPPED;
        }
        gate.markRun(now);

        List<PollReport> reports = federationService.pollAllPlatforms(context.getCancellationToken());
        long failed = reports.stream().filter(report -> !report.isSuccessful() && !report.isSkipped()).count();
        log.info("Auto sync polled {} platforms, {} failed", reports.size(), failed);
        return failed > 0 ? TASK_STATUS_FAILED : TASK_STATUS_COMPLETED;
    }
}
