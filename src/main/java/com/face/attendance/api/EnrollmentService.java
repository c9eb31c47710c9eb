package com.face.attendance.api;

import com.face.attendance.audit.AuditAction;
import com.face.attendance.audit.AuditService;
import com.face.attendance.core.model.FaceRegion;
import com.face.attendance.core.model.Signature;
import com.face.attendance.detection.DecodedImage;
import com.face.attendance.detection.DetectionException;
import com.face.attendance.detection.FaceDetector;
import com.face.attendance.detection.FaceOrdering;
import com.face.attendance.detection.ImageDecoder;
import com.face.attendance.detection.InvalidImageException;
import com.face.attendance.embedding.EmbeddingException;
import com.face.attendance.embedding.EmbeddingGenerator;
import com.face.attendance.graph.InputSanitizer;
import com.face.attendance.logging.LogContext;
import com.face.attendance.metrics.MetricsService;
import com.face.attendance.registry.RegistryUnavailableException;
import com.face.attendance.registry.SignatureRegistry;
import com.face.attendance.tracing.Span;
import com.face.attendance.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Enrolls identities into the signature registry from a portrait.
 * When the portrait shows several faces, the largest one is enrolled.
 */
public class EnrollmentService {
    private static final Logger log = LoggerFactory.getLogger(EnrollmentService.class);

    static final String NO_FACE_MESSAGE = "No face detected in the image";

    // largest area first, then reading order
    private static final Comparator<FaceRegion> LARGEST_FIRST =
            Comparator.comparingLong(FaceRegion::area).reversed().thenComparing(FaceOrdering.READING_ORDER);

    private final ImageDecoder imageDecoder;
    private final FaceDetector faceDetector;
    private final EmbeddingGenerator embeddingGenerator;
    private final SignatureRegistry registry;
    private final AuditService auditService;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final String defaultActorId;

    public EnrollmentService(ImageDecoder imageDecoder, FaceDetector faceDetector,
                             EmbeddingGenerator embeddingGenerator, SignatureRegistry registry,
                             AuditService auditService, MetricsService metrics, TracingService tracing,
                             String defaultActorId) {
        this.imageDecoder = imageDecoder;
        this.faceDetector = faceDetector;
        this.embeddingGenerator = embeddingGenerator;
        this.registry = registry;
        this.auditService = auditService;
        this.metrics = metrics;
        this.tracing = tracing;
        this.defaultActorId = defaultActorId;
    }

    public EnrollmentResult enroll(EnrollmentRequest request) {
        String identityId = request.identityId();
        InputSanitizer.validateIdentifier("identityId", identityId);
        String actorId = request.actorId() != null ? request.actorId() : defaultActorId;

        try (LogContext ignored = LogContext.forEnrollment(identityId);
             Span span = tracing.startSpan("attendance.enroll", Map.of("identityId", identityId))) {
            EnrollmentResult result = doEnroll(identityId, request.image(), span);
            metrics.incrementEnrollment(result.success());
            if (result.success()) {
                span.setStatus(Span.SpanStatus.OK);
                auditService.record(result.replaced() ? AuditAction.SIGNATURE_REPLACED : AuditAction.SIGNATURE_ENROLLED,
                        identityId, actorId, Map.of("facesDetected", result.facesDetected()));
                log.info("enrollment.completed identityId={} replaced={} facesDetected={}",
                        identityId, result.replaced(), result.facesDetected());
            } else {
                span.setStatus(Span.SpanStatus.ERROR);
                auditService.record(AuditAction.ENROLLMENT_FAILED, identityId, actorId,
                        Map.of("reason", String.valueOf(result.message())));
                log.warn("enrollment.failed identityId={} errorCode={} reason={}",
                        identityId, result.errorCode(), result.message());
            }
            return result;
        }
    }

    private EnrollmentResult doEnroll(String identityId, byte[] payload, Span span) {
        DecodedImage image;
        try {
            image = imageDecoder.decode(payload);
        } catch (InvalidImageException e) {
            return EnrollmentResult.failed(identityId, 0, e.getMessage(), ErrorCode.INVALID_IMAGE);
        }

        List<FaceRegion> faces = new ArrayList<>();
        try {
            List<FaceRegion> detected = faceDetector.detect(image);
            if (detected != null) {
                for (FaceRegion region : detected) {
                    FaceRegion inside = region.clipTo(image.getWidth(), image.getHeight());
                    if (inside != null) {
                        faces.add(inside);
                    }
                }
            }
        } catch (DetectionException e) {
            span.recordException(e);
            return EnrollmentResult.failed(identityId, 0, e.getMessage(), ErrorCode.DETECTION_FAILED);
        }
        span.setAttribute("facesDetected", faces.size());
        if (faces.isEmpty()) {
            return EnrollmentResult.failed(identityId, 0, NO_FACE_MESSAGE, null);
        }

        faces.sort(LARGEST_FIRST);
        FaceRegion chosen = faces.get(0);

        Signature signature;
        try {
            signature = embeddingGenerator.embed(image, chosen);
        } catch (EmbeddingException e) {
            span.recordException(e);
            return EnrollmentResult.failed(identityId, faces.size(),
                    "Could not compute a face signature: " + e.getMessage(), ErrorCode.EMBEDDING_FAILED);
        }
        if (signature == null || signature.dimension() != registry.dimension()) {
            return EnrollmentResult.failed(identityId, faces.size(),
                    "Face signature has the wrong dimension", ErrorCode.EMBEDDING_FAILED);
        }

        try {
            boolean replaced = registry.upsert(identityId, signature);
            return EnrollmentResult.enrolled(identityId, replaced, faces.size());
        } catch (RegistryUnavailableException e) {
            span.recordException(e);
            return EnrollmentResult.failed(identityId, faces.size(), e.getMessage(), ErrorCode.REGISTRY_UNAVAILABLE);
        }
    }

    /**
     * Removes an identity's signature.
     *
     * @return true if the identity was enrolled
     * @throws RegistryUnavailableException if the registry cannot be reached
     */
    public boolean removeEnrollment(String identityId, String actorId) {
        InputSanitizer.validateIdentifier("identityId", identityId);
        boolean removed = registry.remove(identityId);
        if (removed) {
            auditService.record(AuditAction.SIGNATURE_REMOVED, identityId,
                    actorId != null ? actorId : defaultActorId);
        }
        log.info("enrollment.removed identityId={} removed={}", identityId, removed);
        return removed;
    }
}
