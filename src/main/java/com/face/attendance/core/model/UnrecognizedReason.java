package com.face.attendance.core.model;

/**
 * Why a detected face ended up without an identity.
 */
public enum UnrecognizedReason {
    /** The registry returned nothing for the face. */
    NO_CANDIDATE,

    /** Every returned identity scored below the session threshold. */
    BELOW_THRESHOLD,

    /** All of the face's candidates were taken by higher-scoring faces. */
    CLAIMED_BY_STRONGER_MATCH,

    /** The only candidates above threshold are not enrolled in the class. */
    NOT_ON_ROSTER,

    /** No signature could be produced for the face crop. */
    EMBEDDING_FAILED
}
