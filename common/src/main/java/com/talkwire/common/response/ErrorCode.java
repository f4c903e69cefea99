package com.talkwire.common.response;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(400, "C001", "Invalid input"),
    RESOURCE_NOT_FOUND(404, "C002", "Resource not found"),
    INTERNAL_ERROR(500, "C003", "Internal server error"),

    // Realtime events
    INVALID_JSON(400, "INVALID_JSON", "Invalid JSON format"),
    UNKNOWN_EVENT(400, "UNKNOWN_EVENT", "Unknown event type"),
    MISSING_FIELD(400, "MISSING_FIELD", "Required field is missing"),
    PROCESSING_ERROR(500, "PROCESSING_ERROR", "Failed to process event"),

    // Collaborators
    STORE_UNAVAILABLE(503, "STORE_UNAVAILABLE", "Message store is unavailable");

    private final int status;
    private final String code;
    private final String message;

    /**
     * Whether a client may retry the request that failed with this code.
     */
    public boolean isRetryable() {
        return status == 503;
    }
}
