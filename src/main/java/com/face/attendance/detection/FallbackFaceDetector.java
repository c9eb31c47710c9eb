package com.face.attendance.detection;

import com.face.attendance.core.model.FaceRegion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs a fast primary detector and falls back to a slower, more thorough one
 * only when the primary finds no faces.
 */
public class FallbackFaceDetector implements FaceDetector {

    private static final Logger log = LoggerFactory.getLogger(FallbackFaceDetector.class);

    private final FaceDetector primary;
    private final FaceDetector secondary;

    public FallbackFaceDetector(FaceDetector primary, FaceDetector secondary) {
        this.primary = Objects.requireNonNull(primary, "primary is required");
        this.secondary = Objects.requireNonNull(secondary, "secondary is required");
    }

    @Override
    public List<FaceRegion> detect(DecodedImage image) throws DetectionException {
        List<FaceRegion> faces = primary.detect(image);
        if (faces != null && !faces.isEmpty()) {
            return faces;
        }
        log.debug("detection.fallback primary={} secondary={} image={}",
                primary.getName(), secondary.getName(), image);
        List<FaceRegion> fallback = secondary.detect(image);
        return fallback != null ? fallback : List.of();
    }

    @Override
    public String getName() {
        return primary.getName() + "->" + secondary.getName();
    }
}
