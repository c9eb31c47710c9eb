package com.face.attendance.api;

import com.face.attendance.audit.AuditAction;
import com.face.attendance.audit.AuditService;
import com.face.attendance.core.model.AttendanceRecord;
import com.face.attendance.core.model.DetectedFace;
import com.face.attendance.core.model.FaceOutcome;
import com.face.attendance.core.model.FaceRegion;
import com.face.attendance.core.model.ResolvedMatch;
import com.face.attendance.core.model.SessionContext;
import com.face.attendance.decision.AttendanceDecision;
import com.face.attendance.decision.AttendanceDecisionBuilder;
import com.face.attendance.detection.DecodedImage;
import com.face.attendance.detection.DetectionException;
import com.face.attendance.detection.FaceDetector;
import com.face.attendance.detection.FaceOrdering;
import com.face.attendance.detection.ImageDecoder;
import com.face.attendance.detection.InvalidImageException;
import com.face.attendance.embedding.ParallelEmbedder;
import com.face.attendance.logging.LogContext;
import com.face.attendance.matching.AssignmentResolver;
import com.face.attendance.matching.CandidateSet;
import com.face.attendance.matching.SimilarityMatcher;
import com.face.attendance.metrics.MetricsService;
import com.face.attendance.registry.RegistryUnavailableException;
import com.face.attendance.roster.RosterProvider;
import com.face.attendance.store.AttendanceStore;
import com.face.attendance.store.WriteOutcome;
import com.face.attendance.tracing.Span;
import com.face.attendance.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one photo through the attendance pipeline:
 * decode, detect, embed, match, resolve, decide, write.
 *
 * <p>Problems with single faces are absorbed into the per-face outcomes. Problems
 * with the whole photo (unreadable image, detector failure, registry unavailable)
 * end the submission with {@code success=false} before anything is written.</p>
 */
public class AttendanceSubmissionService {
    private static final Logger log = LoggerFactory.getLogger(AttendanceSubmissionService.class);

    private final ImageDecoder imageDecoder;
    private final FaceDetector faceDetector;
    private final ParallelEmbedder embedder;
    private final SimilarityMatcher matcher;
    private final AssignmentResolver resolver;
    private final AttendanceDecisionBuilder decisionBuilder;
    private final AttendanceStore store;
    private final RosterProvider rosterProvider;
    private final AuditService auditService;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final EngineOptions options;

    public AttendanceSubmissionService(ImageDecoder imageDecoder,
                                       FaceDetector faceDetector,
                                       ParallelEmbedder embedder,
                                       SimilarityMatcher matcher,
                                       AssignmentResolver resolver,
                                       AttendanceDecisionBuilder decisionBuilder,
                                       AttendanceStore store,
                                       RosterProvider rosterProvider,
                                       AuditService auditService,
                                       MetricsService metrics,
                                       TracingService tracing,
                                       EngineOptions options) {
        this.imageDecoder = imageDecoder;
        this.faceDetector = faceDetector;
        this.embedder = embedder;
        this.matcher = matcher;
        this.resolver = resolver;
        this.decisionBuilder = decisionBuilder;
        this.store = store;
        this.rosterProvider = rosterProvider;
        this.auditService = auditService;
        this.metrics = metrics;
        this.tracing = tracing;
        this.options = options;
    }

    public SubmissionResult submit(SubmissionRequest request) {
        String submissionId = LogContext.generateSubmissionId();
        double threshold = request.threshold() != null ? request.threshold() : options.getThreshold();
        String actorId = request.actorId() != null ? request.actorId() : options.getDefaultActorId();
        SessionContext session = new SessionContext(request.classId(), request.date(), threshold);
        long start = System.nanoTime();

        try (LogContext ignored = LogContext.forSubmission(submissionId, session.classId(), session.date());
             Span span = tracing.startSpan("attendance.submit", Map.of(
                     "submissionId", submissionId,
                     "classId", session.classId(),
                     "date", session.date().toString()))) {

            log.info("submission.received submissionId={} classId={} date={} threshold={}",
                    submissionId, session.classId(), session.date(), threshold);

            SubmissionResult result;
            try {
                result = run(submissionId, session, request.image(), actorId, span);
                span.setStatus(Span.SpanStatus.OK);
            } catch (InvalidImageException e) {
                result = fail(submissionId, session, actorId, ErrorCode.INVALID_IMAGE, e.getMessage(), span, e);
            } catch (DetectionException e) {
                result = fail(submissionId, session, actorId, ErrorCode.DETECTION_FAILED, e.getMessage(), span, e);
            } catch (RegistryUnavailableException e) {
                result = fail(submissionId, session, actorId, ErrorCode.REGISTRY_UNAVAILABLE, e.getMessage(), span, e);
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            String outcome = result.isSuccess() ? "success" : result.getErrorCode().name();
            metrics.recordSubmissionDuration(outcome, elapsed);
            return result;
        }
    }

    private SubmissionResult run(String submissionId, SessionContext session, byte[] payload,
                                 String actorId, Span span) throws DetectionException {
        DecodedImage image = imageDecoder.decode(payload);
        List<DetectedFace> faces = locateFaces(image);
        span.setAttribute("facesDetected", faces.size());

        List<DetectedFace> embedded = faces.isEmpty() ? faces : embedder.embedAll(image, faces);

        Set<String> roster = rosterProvider.rosterFor(session.classId());
        CandidateSet candidates = matcher.match(embedded,
                session.threshold(), options.isRestrictToRoster() ? roster : null);
        if (candidates.attempts() > 1) {
            span.setAttribute("registryAttempts", candidates.attempts());
        }

        List<ResolvedMatch> resolved = resolver.resolve(candidates.candidates());

        List<Integer> faceIndexes = new ArrayList<>(embedded.size());
        for (DetectedFace face : embedded) {
            faceIndexes.add(face.faceIndex());
        }
        List<AttendanceRecord> existing = store.findBySession(session.classId(), session.date());
        AttendanceDecision decision = decisionBuilder.build(session, faceIndexes, resolved,
                candidates.missReasons(), roster, existing, actorId);

        List<WriteOutcome> outcomes = store.applyAll(session.classId(), session.date(), decision.records());
        auditService.recordWrites(submissionId, actorId, decision.records(), outcomes);

        return complete(submissionId, session, actorId, decision, outcomes, candidates.belowThreshold());
    }

    private List<DetectedFace> locateFaces(DecodedImage image) throws DetectionException {
        List<FaceRegion> regions = faceDetector.detect(image);
        List<FaceRegion> clipped = new ArrayList<>();
        if (regions != null) {
            for (FaceRegion region : regions) {
                FaceRegion inside = region.clipTo(image.getWidth(), image.getHeight());
                if (inside != null) {
                    clipped.add(inside);
                }
            }
        }
        clipped.sort(FaceOrdering.READING_ORDER);

        List<DetectedFace> faces = new ArrayList<>(clipped.size());
        for (int i = 0; i < clipped.size(); i++) {
            faces.add(new DetectedFace(i, clipped.get(i), null));
        }
        log.debug("detection.completed detector={} faces={}", faceDetector.getName(), faces.size());
        return faces;
    }

    private SubmissionResult complete(String submissionId, SessionContext session, String actorId,
                                      AttendanceDecision decision, List<WriteOutcome> outcomes,
                                      int belowThreshold) {
        List<SubmissionResult.RecognizedStudent> recognized = new ArrayList<>();
        List<SubmissionResult.UnrecognizedFace> unrecognized = new ArrayList<>();
        for (FaceOutcome outcome : decision.faceOutcomes()) {
            if (outcome instanceof FaceOutcome.Recognized r) {
                recognized.add(new SubmissionResult.RecognizedStudent(r.identityId(), r.faceIndex(), r.similarityScore()));
                metrics.recordSimilarityScore(r.similarityScore());
            } else if (outcome instanceof FaceOutcome.Unrecognized u) {
                unrecognized.add(new SubmissionResult.UnrecognizedFace(u.faceIndex(), u.reason()));
                metrics.incrementUnrecognized(u.reason());
            }
        }

        int inserted = 0;
        int upgraded = 0;
        int unchanged = 0;
        for (WriteOutcome outcome : outcomes) {
            metrics.incrementAttendanceWrite(outcome);
            switch (outcome) {
                case INSERTED -> inserted++;
                case UPGRADED -> upgraded++;
                case UNCHANGED -> unchanged++;
            }
        }
        metrics.recordFaceCounts(decision.facesDetected(), recognized.size(), unrecognized.size());

        String message = decision.facesDetected() == 0
                ? "No faces detected in the photo"
                : String.format("Detected %d face(s), recognized %d", decision.facesDetected(), recognized.size());

        auditService.record(AuditAction.SUBMISSION_COMPLETED, submissionId, actorId, Map.of(
                "classId", session.classId(),
                "date", session.date().toString(),
                "facesDetected", decision.facesDetected(),
                "facesRecognized", recognized.size(),
                "inserted", inserted,
                "upgraded", upgraded));

        log.info("submission.completed submissionId={} facesDetected={} recognized={} unrecognized={} " +
                        "belowThreshold={} inserted={} upgraded={} unchanged={}",
                submissionId, decision.facesDetected(), recognized.size(), unrecognized.size(),
                belowThreshold, inserted, upgraded, unchanged);

        return SubmissionResult.builder()
                .success(true)
                .submissionId(submissionId)
                .classId(session.classId())
                .date(session.date())
                .facesDetected(decision.facesDetected())
                .recognizedStudents(recognized)
                .unrecognizedFaces(unrecognized)
                .faceOutcomes(decision.faceOutcomes())
                .attendanceRecords(decision.records())
                .inserted(inserted)
                .upgraded(upgraded)
                .unchanged(unchanged)
                .message(message)
                .build();
    }

    private SubmissionResult fail(String submissionId, SessionContext session, String actorId,
                                  ErrorCode errorCode, String message, Span span, Exception cause) {
        span.recordException(cause);
        span.setStatus(Span.SpanStatus.ERROR);
        log.warn("submission.failed submissionId={} errorCode={} retryable={} reason={}",
                submissionId, errorCode, errorCode.isRetryable(), message);
        auditService.record(AuditAction.SUBMISSION_FAILED, submissionId, actorId, Map.of(
                "classId", session.classId(),
                "date", session.date().toString(),
                "errorCode", errorCode.name()));
        return SubmissionResult.failure(submissionId, session.classId(), session.date(), errorCode, message);
    }
}
