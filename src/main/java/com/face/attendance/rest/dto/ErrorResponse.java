package com.face.attendance.rest.dto;

import com.face.attendance.api.ErrorCode;

import java.time.Instant;

/**
 * Error envelope returned by every endpoint.
 *
 * <p>{@code errorCode} is set when the engine reported a failure code; clients
 * should only resend the same request when {@code retryable} is true.</p>
 */
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        String errorCode,
        boolean retryable,
        Instant timestamp
) {
    private ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, null, false, Instant.now());
    }

    public static ErrorResponse badRequest(String message, String path) {
        return new ErrorResponse(400, "Bad Request", message, path);
    }

    public static ErrorResponse notFound(String message, String path) {
        return new ErrorResponse(404, "Not Found", message, path);
    }

    public static ErrorResponse internalError(String message, String path) {
        return new ErrorResponse(500, "Internal Server Error", message, path);
    }

    /**
     * Maps an engine failure: retryable codes become 503, the rest 400.
     */
    public static ErrorResponse failure(ErrorCode code, String message, String path) {
        if (code == null) {
            return badRequest(message, path);
        }
        if (code.isRetryable()) {
            return new ErrorResponse(503, "Service Unavailable", message, path, code.name(), true, Instant.now());
        }
        return new ErrorResponse(400, "Bad Request", message, path, code.name(), false, Instant.now());
    }
}
