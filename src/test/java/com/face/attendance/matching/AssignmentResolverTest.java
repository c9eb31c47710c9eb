package com.face.attendance.matching;

import com.face.attendance.core.model.MatchCandidate;
import com.face.attendance.core.model.ResolvedMatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AssignmentResolver")
class AssignmentResolverTest {

    private final AssignmentResolver resolver = new AssignmentResolver();

    @Test
    @DisplayName("Empty input resolves to nothing")
    void emptyInput() {
        assertTrue(resolver.resolve(List.of()).isEmpty());
    }

    @Test
    @DisplayName("Highest score claims a contested identity")
    void highestScoreWins() {
        List<ResolvedMatch> resolved = resolver.resolve(List.of(
                new MatchCandidate(0, "C", 0.75),
                new MatchCandidate(1, "C", 0.90)));

        assertEquals(List.of(new ResolvedMatch(1, "C", 0.90)), resolved);
    }

    @Test
    @DisplayName("A face matching several identities keeps only its best")
    void oneIdentityPerFace() {
        List<ResolvedMatch> resolved = resolver.resolve(List.of(
                new MatchCandidate(0, "A", 0.70),
                new MatchCandidate(0, "B", 0.85)));

        assertEquals(List.of(new ResolvedMatch(0, "B", 0.85)), resolved);
    }

    @Test
    @DisplayName("The losing face falls back to its next candidate")
    void fallbackToNextCandidate() {
        List<ResolvedMatch> resolved = resolver.resolve(List.of(
                new MatchCandidate(0, "C", 0.75),
                new MatchCandidate(0, "D", 0.65),
                new MatchCandidate(1, "C", 0.90)));

        assertEquals(List.of(
                new ResolvedMatch(0, "D", 0.65),
                new ResolvedMatch(1, "C", 0.90)), resolved);
    }

    @Test
    @DisplayName("Exact ties go to the lower face index, then the lower identity")
    void tieBreaks() {
        List<ResolvedMatch> byFace = resolver.resolve(List.of(
                new MatchCandidate(3, "A", 0.8),
                new MatchCandidate(1, "A", 0.8)));
        assertEquals(1, byFace.get(0).faceIndex());

        List<ResolvedMatch> byIdentity = resolver.resolve(List.of(
                new MatchCandidate(0, "Y", 0.8),
                new MatchCandidate(0, "X", 0.8)));
        assertEquals("X", byIdentity.get(0).identityId());
    }

    @Test
    @DisplayName("Input order does not change the assignment")
    void orderIndependent() {
        List<MatchCandidate> candidates = new ArrayList<>();
        Random random = new Random(42);
        for (int face = 0; face < 12; face++) {
            for (int id = 0; id < 6; id++) {
                double score = Math.round(random.nextDouble() * 20) / 20.0;
                candidates.add(new MatchCandidate(face, "id-" + id, score));
            }
        }
        List<ResolvedMatch> expected = resolver.resolve(candidates);

        for (int run = 0; run < 10; run++) {
            Collections.shuffle(candidates, random);
            assertEquals(expected, resolver.resolve(candidates));
        }
    }

    @Test
    @DisplayName("No face and no identity is credited twice")
    void oneToOne() {
        List<MatchCandidate> candidates = new ArrayList<>();
        for (int face = 0; face < 5; face++) {
            for (int id = 0; id < 3; id++) {
                candidates.add(new MatchCandidate(face, "id-" + id, 0.6 + face * 0.01 + id * 0.02));
            }
        }

        List<ResolvedMatch> resolved = resolver.resolve(candidates);

        assertEquals(3, resolved.size());
        Set<Integer> faces = new HashSet<>();
        Set<String> identities = new HashSet<>();
        for (ResolvedMatch match : resolved) {
            assertTrue(faces.add(match.faceIndex()));
            assertTrue(identities.add(match.identityId()));
        }
    }
}
