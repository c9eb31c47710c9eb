package com.face.attendance.detection;

/**
 * Thrown when a detector cannot process a photo at all.
 */
public class DetectionException extends Exception {

    public DetectionException(String message) {
        super(message);
    }

    public DetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
