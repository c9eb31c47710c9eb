package com.face.attendance.matching;

import com.face.attendance.core.model.MatchCandidate;
import com.face.attendance.core.model.UnrecognizedReason;

import java.util.List;
import java.util.Map;

/**
 * Output of the similarity matcher for one photo.
 *
 * @param candidates     every above-threshold, on-roster (face, identity) pair
 * @param missReasons    for faces with no candidate at all, why
 * @param belowThreshold registry hits discarded because their score was under the threshold
 * @param attempts       registry attempts used, 1 when the first attempt succeeded
 */
public record CandidateSet(
        List<MatchCandidate> candidates,
        Map<Integer, UnrecognizedReason> missReasons,
        int belowThreshold,
        int attempts
) {

    public CandidateSet {
        candidates = List.copyOf(candidates);
        missReasons = Map.copyOf(missReasons);
    }
}
