package io.cardfederation.tasks.impl;

import io.cardfederation.enums.PlatformId;
import io.cardfederation.federation.FederationService;
import io.cardfederation.models.FederationSettings;
import io.cardfederation.models.PlatformConfig;
import io.cardfederation.tasks.CancellationToken;
import io.cardfederation.tasks.Task;
import io.cardfederation.tasks.TaskContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static io.cardfederation.config.Constants.TASK_PROBE_CONNECTIONS;
import static io.cardfederation.config.Constants.TASK_STATUS_COMPLETED;
import static io.cardfederation.config.Constants.TASK_STATUS_SKIPPED;

/**
 * Refreshes the cached connection status of enabled remote platforms when auto sync is on.
 */
@Slf4j
public class ProbeConnectionsTask implements Task {

    private final IntervalGate gate = new IntervalGate();

    @Override
    public String getName() {
        return TASK_PROBE_CONNECTIONS;
    }

    @Override
    public String execute(TaskContext context) {
        FederationService federationService = context.getFederationService();
        FederationSettings settings = federationService.getSettings();
        Instant now = context.getClock().instant();

        if (!settings.isAutoSync() || !gate.isDue(now, Duration.ofMinutes(settings.getSyncIntervalMinutes()))) {
            return TASK_STATUS_SKIPPED;
        }
        gate.markRun(now);

        CancellationToken token = context.getCancellationToken();
        int probed = 0;
        for (Map.Entry<PlatformId, PlatformConfig> entry : settings.getPlatforms().entrySet()) {
            if (token.isCancelled()) {
                log.info("Connection probes cancelled after {} platforms", probed);
                break;
            }
            if (entry.getKey().isLocal() || !entry.getValue().isEnabled()) {
                continue;
            }
            federationService.testConnection(entry.getKey(), token);
            probed++;
        }
        log.debug("Probed {} platforms", probed);
        return TASK_STATUS_COMPLETED;
    }
}
