package com.example.syncengine.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional body of a blocking sync. Every field may be omitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRunRequest {

    @Min(value = 1, message = "daysBack must be at least 1")
    @Max(value = 365, message = "daysBack must be at most 365")
    private Integer daysBack;

    @Min(value = 1, message = "maxResults must be at least 1")
    @Max(value = 1000, message = "maxResults must be at most 1000")
    private Integer maxResults;

    /**
     * Provider-specific preferences, stored on the session as a snapshot.
     */
    private Map<String, Object> preferences;

    /**
     * Options passed to the provider: the preferences plus daysBack and maxResults when set.
     */
    public Map<String, Object> toProviderOptions() {
        Map<String, Object> options = new LinkedHashMap<>();
        if (preferences != null) {
            options.putAll(preferences);
        }
        if (daysBack != null) {
            options.put("daysBack", daysBack);
        }
        if (maxResults != null) {
            options.put("maxResults", maxResults);
        }
        return options;
    }
}
