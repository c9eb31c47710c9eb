package com.face.attendance.roster;

import java.util.Set;

/**
 * Answers which identities are enrolled in a class. Owned by the surrounding
 * application; the engine only reads it.
 */
public interface RosterProvider {

    /**
     * @return the identities enrolled in the class, empty if the class is unknown
     */
    Set<String> rosterFor(String classId);

    /**
     * All classes the identity is enrolled in.
     */
    default Set<String> classesOf(String identityId) {
        return Set.of();
    }
}
