package io.cardfederation.api.models.requests;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code PUT /federation/settings}. Absent fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SettingsRequest {

    @JsonProperty("autoSync")
    private Boolean autoSync;

    @JsonProperty("syncIntervalMinutes")
    private Integer syncIntervalMinutes;
}
