package com.face.attendance.embedding;

/**
 * Thrown when a signature cannot be computed for one face.
 * Affects only that face; the rest of the submission continues.
 */
public class EmbeddingException extends Exception {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
