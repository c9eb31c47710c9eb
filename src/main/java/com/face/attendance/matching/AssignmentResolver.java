package com.face.attendance.matching;

import com.face.attendance.core.model.MatchCandidate;
import com.face.attendance.core.model.ResolvedMatch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reconciles all candidates of one photo into a one-to-one assignment between
 * faces and identities.
 *
 * <p>Candidates are visited best first ({@link MatchCandidate#RESOLUTION_ORDER}) and
 * a candidate is accepted only when neither its face nor its identity has been
 * claimed yet. Equal inputs always produce equal outputs.</p>
 */
public class AssignmentResolver {

    /**
     * @return accepted matches ordered by face index
     */
    public List<ResolvedMatch> resolve(Collection<MatchCandidate> candidates) {
        List<MatchCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(MatchCandidate.RESOLUTION_ORDER);

        Set<Integer> claimedFaces = new HashSet<>();
        Set<String> claimedIdentities = new HashSet<>();
        List<ResolvedMatch> resolved = new ArrayList<>();
        for (MatchCandidate candidate : ordered) {
            if (claimedFaces.contains(candidate.faceIndex())
                    || claimedIdentities.contains(candidate.identityId())) {
                continue;
            }
            claimedFaces.add(candidate.faceIndex());
            claimedIdentities.add(candidate.identityId());
            resolved.add(ResolvedMatch.from(candidate));
        }
        resolved.sort(Comparator.comparingInt(ResolvedMatch::faceIndex));
        return resolved;
    }
}
