package io.cardfederation.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Normalized element of a platform outbox listing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RemoteCardEntry {
    private String remoteId;
    private String name;
}
