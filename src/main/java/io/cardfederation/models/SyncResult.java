package io.cardfederation.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.enums.SyncOperation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of one push or pull. Not persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncResult {
    private boolean success;
    private SyncOperation operation;
    private PlatformId platform;
    private String localId;
    private String remoteId;
    private String federatedId;
    private Instant timestamp;
    // content was unchanged since the last push, no remote call was made
    private boolean skipped;
    private String error;
}
