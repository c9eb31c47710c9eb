package com.face.attendance.decision;

import com.face.attendance.core.model.AttendanceMethod;
import com.face.attendance.core.model.AttendanceRecord;
import com.face.attendance.core.model.AttendanceStatus;
import com.face.attendance.core.model.FaceOutcome;
import com.face.attendance.core.model.ResolvedMatch;
import com.face.attendance.core.model.SessionContext;
import com.face.attendance.core.model.UnrecognizedReason;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges resolved matches with the session roster and the rows already stored
 * for the session into one intended attendance row per identity.
 *
 * <ul>
 *   <li>matched identities are PRESENT by FACE_MATCH with the match score as confidence</li>
 *   <li>an existing row wins unless the conflict policy allows the match to upgrade it</li>
 *   <li>everyone else on the roster is ABSENT, MANUAL, without confidence</li>
 * </ul>
 */
public class AttendanceDecisionBuilder {

    private final AttendanceConflictPolicy conflictPolicy;
    private final Clock clock;

    public AttendanceDecisionBuilder() {
        this(new AttendanceConflictPolicy(), Clock.systemUTC());
    }

    public AttendanceDecisionBuilder(AttendanceConflictPolicy conflictPolicy, Clock clock) {
        this.conflictPolicy = Objects.requireNonNull(conflictPolicy, "conflictPolicy is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * @param session     class, date and threshold of the submission
     * @param faceIndexes every detected face index
     * @param resolved    the one-to-one matches
     * @param missReasons why each face without candidates went unmatched
     * @param roster      identities enrolled in the class
     * @param existing    rows already stored for (class, date)
     * @param markedBy    actor credited on new rows
     */
    public AttendanceDecision build(SessionContext session,
                                    Collection<Integer> faceIndexes,
                                    List<ResolvedMatch> resolved,
                                    Map<Integer, UnrecognizedReason> missReasons,
                                    Set<String> roster,
                                    Collection<AttendanceRecord> existing,
                                    String markedBy) {
        Objects.requireNonNull(session, "session is required");
        Instant now = clock.instant();

        Map<Integer, ResolvedMatch> byFace = new HashMap<>();
        Map<String, ResolvedMatch> byIdentity = new HashMap<>();
        for (ResolvedMatch match : resolved) {
            byFace.put(match.faceIndex(), match);
            byIdentity.put(match.identityId(), match);
        }

        List<FaceOutcome> outcomes = new ArrayList<>();
        for (Integer faceIndex : new TreeSet<>(faceIndexes)) {
            ResolvedMatch match = byFace.get(faceIndex);
            if (match != null) {
                outcomes.add(new FaceOutcome.Recognized(faceIndex, match.identityId(), match.similarityScore()));
            } else {
                UnrecognizedReason reason = missReasons.getOrDefault(faceIndex,
                        UnrecognizedReason.CLAIMED_BY_STRONGER_MATCH);
                outcomes.add(new FaceOutcome.Unrecognized(faceIndex, reason));
            }
        }

        Map<String, AttendanceRecord> existingByIdentity = new HashMap<>();
        for (AttendanceRecord record : existing) {
            existingByIdentity.put(record.getIdentityId(), record);
        }

        Set<String> identities = new TreeSet<>(roster);
        identities.addAll(byIdentity.keySet());

        List<AttendanceRecord> records = new ArrayList<>(identities.size());
        for (String identityId : identities) {
            ResolvedMatch match = byIdentity.get(identityId);
            AttendanceRecord prior = existingByIdentity.get(identityId);
            if (match != null) {
                AttendanceRecord present = AttendanceRecord.builder()
                        .classId(session.classId())
                        .identityId(identityId)
                        .date(session.date())
                        .status(AttendanceStatus.PRESENT)
                        .method(AttendanceMethod.FACE_MATCH)
                        .confidenceScore(match.similarityScore())
                        .markedBy(markedBy)
                        .createdAt(now)
                        .build();
                records.add(conflictPolicy.resolve(prior, present).record());
            } else if (prior != null) {
                records.add(prior);
            } else {
                records.add(AttendanceRecord.builder()
                        .classId(session.classId())
                        .identityId(identityId)
                        .date(session.date())
                        .status(AttendanceStatus.ABSENT)
                        .method(AttendanceMethod.MANUAL)
                        .markedBy(markedBy)
                        .createdAt(now)
                        .build());
            }
        }
        return new AttendanceDecision(session, records, outcomes);
    }
}
