package com.face.attendance.detection;

/**
 * Thrown when an uploaded payload is empty, too large or not a readable image.
 * Raised before detection runs, so no attendance side effects have happened.
 */
public class InvalidImageException extends RuntimeException {

    public InvalidImageException(String message) {
        super(message);
    }

    public InvalidImageException(String message, Throwable cause) {
        super(message, cause);
    }
}
