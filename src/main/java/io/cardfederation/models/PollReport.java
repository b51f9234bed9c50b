package io.cardfederation.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.cardfederation.enums.PlatformId;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one reconciliation pass against a platform outbox.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PollReport {
    private PlatformId platform;
    private int remoteCount;
    private int localCount;
    private int matched;
    private int created;
    private int unlinked;
    private int deleted;
    // local card names linked to a remote entry shared with another local card
    @Builder.Default
    private List<String> ambiguousNames = new ArrayList<>();
    private boolean skipped;
    private boolean cancelled;
    private String error;
    private Instant completedAt;

    public boolean isSuccessful() {
        return error == null && !cancelled;
    }

    public boolean hasChanges() {
        return matched + created + unlinked + deleted > 0;
    }

    public static PollReport skipped(PlatformId platform, String reason, Instant at) {
        return PollReport.builder().platform(platform).skipped(true).error(reason).completedAt(at).build();
    }

    public static PollReport failed(PlatformId platform, String error, Instant at) {
        return PollReport.builder().platform(platform).error(error).completedAt(at).build();
    }

    public static PollReport cancelled(PlatformId platform, Instant at) {
        return PollReport.builder().platform(platform).cancelled(true).error("cancelled").completedAt(at).build();
    }
}
