package com.face.attendance.decision;

import com.face.attendance.core.model.AttendanceRecord;
import com.face.attendance.core.model.FaceOutcome;
import com.face.attendance.core.model.SessionContext;

import java.util.List;

/**
 * Everything one submission decided, before it is written.
 *
 * @param session      the class and date the decision is for
 * @param records      one intended row per identity, ordered by identity id
 * @param faceOutcomes one outcome per detected face, ordered by face index
 */
public record AttendanceDecision(
        SessionContext session,
        List<AttendanceRecord> records,
        List<FaceOutcome> faceOutcomes
) {

    public AttendanceDecision {
        records = List.copyOf(records);
        faceOutcomes = List.copyOf(faceOutcomes);
    }

    public int facesDetected() {
        return faceOutcomes.size();
    }

    public int facesRecognized() {
        return (int) faceOutcomes.stream().filter(FaceOutcome::isRecognized).count();
    }

    public int facesUnrecognized() {
        return facesDetected() - facesRecognized();
    }

    public List<FaceOutcome.Recognized> recognized() {
        return faceOutcomes.stream()
                .filter(o -> o instanceof FaceOutcome.Recognized)
                .map(o -> (FaceOutcome.Recognized) o)
                .toList();
    }

    public List<FaceOutcome.Unrecognized> unrecognized() {
        return faceOutcomes.stream()
                .filter(o -> o instanceof FaceOutcome.Unrecognized)
                .map(o -> (FaceOutcome.Unrecognized) o)
                .toList();
    }
}
