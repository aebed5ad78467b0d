package com.example.syncengine.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * Error envelope returned by every endpoint.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        Error error,
        String timestamp
) {

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Error(
            String code,
            String message,
            String field,
            Object details
    ) {
    }
}
