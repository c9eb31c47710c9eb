package com.face.attendance.roster;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Roster kept in memory, for tests and embedded use.
 */
public class InMemoryRosterProvider implements RosterProvider {

    private final Map<String, Set<String>> rosters = new ConcurrentHashMap<>();

    public InMemoryRosterProvider enroll(String classId, String identityId) {
        rosters.computeIfAbsent(classId, k -> ConcurrentHashMap.newKeySet()).add(identityId);
        return this;
    }

    public InMemoryRosterProvider enrollAll(String classId, Collection<String> identityIds) {
        identityIds.forEach(id -> enroll(classId, id));
        return this;
    }

    public boolean unenroll(String classId, String identityId) {
        Set<String> members = rosters.get(classId);
        return members != null && members.remove(identityId);
    }

    @Override
    public Set<String> rosterFor(String classId) {
        Set<String> members = rosters.get(classId);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    @Override
    public Set<String> classesOf(String identityId) {
        return rosters.entrySet().stream()
                .filter(e -> e.getValue().contains(identityId))
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }
}
