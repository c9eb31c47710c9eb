package com.face.attendance.api;

/**
 * Why a submission or enrollment failed as a whole.
 */
public enum ErrorCode {
    INVALID_IMAGE(false),
    DETECTION_FAILED(true),
    EMBEDDING_FAILED(false),
    REGISTRY_UNAVAILABLE(true);

    private final boolean retryable;

    ErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether sending the same request again may succeed.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
