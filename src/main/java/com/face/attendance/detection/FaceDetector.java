package com.face.attendance.detection;

import com.face.attendance.core.model.FaceRegion;

import java.util.List;

/**
 * Locates faces in a decoded photo.
 *
 * <p>Implementations may return regions in any order; the engine sorts them with
 * {@link FaceOrdering#READING_ORDER} before assigning face indexes. An empty list
 * is a valid result and means "no faces".</p>
 */
public interface FaceDetector {

    /**
     * Detects faces in the image.
     *
     * @param image a decoded, validated image
     * @return the detected regions, never null
     * @throws DetectionException if the photo could not be processed at all
     */
    List<FaceRegion> detect(DecodedImage image) throws DetectionException;

    /**
     * Returns a short name for logs and health output.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
