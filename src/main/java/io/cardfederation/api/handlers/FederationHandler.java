package io.cardfederation.api.handlers;

import io.cardfederation.api.models.requests.SettingsRequest;
import io.cardfederation.api.models.responses.ErrorResponse;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.exceptions.ConfigurationException;
import io.cardfederation.exceptions.SyncOperationException;
import io.cardfederation.federation.FederationService;
import io.cardfederation.models.CardSyncState;
import io.cardfederation.models.PlatformConfigPatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * REST API handler for the federation service.
 *
 * Supported operations:
 * - GET    /federation/status - Service state, last sync result, cached sync states
 * - GET    /federation/settings - Current settings
 * - PUT    /federation/settings - Update autoSync / syncIntervalMinutes
 * - PATCH  /federation/platforms/{platform} - Partial update of one platform config
 * - POST   /federation/platforms/{platform}/_test - Connection test
 * - POST   /federation/platforms/{platform}/_connect - Enable and test
 * - POST   /federation/platforms/{platform}/_disconnect - Disable, keep history
 * - POST   /federation/platforms/{platform}/_poll - Reconcile one platform
 * - POST   /federation/_poll - Reconcile every enabled platform
 * - POST   /federation/cards/{localId}/_sync/{platform} - Push a local card
 * - POST   /federation/platforms/{platform}/cards/{remoteId}/_pull - Pull a remote card into the editor
 * - POST   /federation/cards/{localId}/_record/{platform}?remoteId= - Manual bookkeeping
 * - GET    /federation/sync-states - Cached sync states
 * - GET    /federation/sync-states/_find?platform=&remoteId= - Lookup by remote id
 * - DELETE /federation/sync-states?federatedId= - Drop a record
 *
 * Configuration problems answer 400, failed remote calls 502. Platform API keys are never returned.
 */
@Slf4j
@RestController
@RequestMapping("/federation")
public class FederationHandler {

    private final FederationService federationService;

    public FederationHandler(FederationService federationService) {
        this.federationService = federationService;
    }

    @GetMapping("/status")
    public ResponseEntity<Object> getStatus() {
        return handle("get status", () -> ResponseEntity.ok(federationService.getStatus()));
    }

    @GetMapping("/settings")
    public ResponseEntity<Object> getSettings() {
        return handle("get settings", () -> ResponseEntity.ok(federationService.getSettings().redacted()));
    }

    @PutMapping("/settings")
    public ResponseEntity<Object> updateSettings(@RequestBody SettingsRequest request) {
        return handle("update settings", () -> ResponseEntity.ok(
                federationService.updateSettings(request.getAutoSync(), request.getSyncIntervalMinutes()).redacted()));
    }

    @PatchMapping("/platforms/{platform}")
    public ResponseEntity<Object> updatePlatform(@PathVariable String platform,
                                                 @RequestBody PlatformConfigPatch patch) {
        return handle("update platform " + platform, () -> {
            log.info("Updating config of platform '{}'", platform);
            return ResponseEntity.ok(federationService.updatePlatformConfig(PlatformId.fromId(platform), patch).redacted());
        });
    }

    @PostMapping("/platforms/{platform}/_test")
    public ResponseEntity<Object> testConnection(@PathVariable String platform) {
        return handle("test platform " + platform, () -> {
            boolean connected = federationService.testConnection(PlatformId.fromId(platform));
            return ResponseEntity.ok(Map.of("platform", platform, "connected", connected));
        });
    }

    @PostMapping("/platforms/{platform}/_connect")
    public ResponseEntity<Object> connectPlatform(@PathVariable String platform) {
        return handle("connect platform " + platform, () -> {
            boolean connected = federationService.connectPlatform(PlatformId.fromId(platform));
            return ResponseEntity.ok(Map.of("platform", platform, "connected", connected));
        });
    }

    @PostMapping("/platforms/{platform}/_disconnect")
    public ResponseEntity<Object> disconnectPlatform(@PathVariable String platform) {
        return handle("disconnect platform " + platform, () -> {
            federationService.disconnectPlatform(PlatformId.fromId(platform));
            return ResponseEntity.ok(Map.of("platform", platform, "connected", false));
        });
    }

    @PostMapping("/platforms/{platform}/_poll")
    public ResponseEntity<Object> pollPlatform(@PathVariable String platform) {
        return handle("poll platform " + platform,
                () -> ResponseEntity.ok(federationService.pollPlatformSyncState(PlatformId.fromId(platform))));
    }

    @PostMapping("/_poll")
    public ResponseEntity<Object> pollAllPlatforms() {
        return handle("poll all platforms", () -> ResponseEntity.ok(federationService.pollAllPlatforms()));
    }

    @PostMapping("/cards/{localId}/_sync/{platform}")
    public ResponseEntity<Object> syncCard(@PathVariable String localId, @PathVariable String platform) {
        return handle("sync card " + localId, () -> {
            log.info("Pushing card '{}' to platform '{}'", localId, platform);
            return ResponseEntity.ok(federationService.syncCard(localId, PlatformId.fromId(platform)));
        });
    }

    @PostMapping("/platforms/{platform}/cards/{remoteId}/_pull")
    public ResponseEntity<Object> pullCard(@PathVariable String platform, @PathVariable String remoteId) {
        return handle("pull card " + remoteId, () -> {
            log.info("Pulling card '{}' from platform '{}'", remoteId, platform);
            return ResponseEntity.ok(federationService.pullCard(PlatformId.fromId(platform), remoteId));
        });
    }

    @PostMapping("/cards/{localId}/_record/{platform}")
    public ResponseEntity<Object> recordManualSync(@PathVariable String localId, @PathVariable String platform,
                                                   @RequestParam(value = "remoteId", required = false) String remoteId) {
        return handle("record sync of card " + localId, () -> ResponseEntity.ok(
                federationService.recordManualSync(localId, PlatformId.fromId(platform), remoteId)));
    }

    @GetMapping("/sync-states")
    public ResponseEntity<Object> getSyncStates() {
        return handle("list sync states", () -> ResponseEntity.ok(federationService.getSyncStates()));
    }

    @GetMapping("/sync-states/_find")
    public ResponseEntity<Object> findSyncState(@RequestParam("platform") String platform,
                                                @RequestParam("remoteId") String remoteId) {
        return handle("find sync state", () -> {
            Optional<CardSyncState> state = federationService.findSyncState(PlatformId.fromId(platform), remoteId);
            if (state.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorResponse.notFound("Sync state for " + platform + "/" + remoteId));
            }
            return ResponseEntity.ok(state.get());
        });
    }

    @DeleteMapping("/sync-states")
    public ResponseEntity<Object> clearSyncState(@RequestParam("federatedId") String federatedId) {
        return handle("clear sync state", () -> {
            federationService.clearSyncState(federatedId);
            return ResponseEntity.ok(Map.of("acknowledged", true));
        });
    }

    private ResponseEntity<Object> handle(String action, Supplier<ResponseEntity<Object>> call) {
        try {
            return call.get();
        } catch (IllegalArgumentException | ConfigurationException e) {
            log.error("Invalid request to {}: {}", action, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest(e.getMessage()));
        } catch (SyncOperationException e) {
            log.error("Failed to {}: {}", action, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(ErrorResponse.badGateway(e.getKind().name().toLowerCase(), e.getMessage()));
        } catch (Exception e) {
            log.error("Error while trying to {}: {}", action, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}
