package com.face.attendance.rest.dto;

import java.util.List;

/**
 * Request DTO for adding identities to a class roster.
 */
public record RosterRequest(List<String> identityIds) {
    public RosterRequest {
        if (identityIds == null || identityIds.isEmpty()) {
            throw new IllegalArgumentException("identityIds is required");
        }
        identityIds = List.copyOf(identityIds);
    }
}
