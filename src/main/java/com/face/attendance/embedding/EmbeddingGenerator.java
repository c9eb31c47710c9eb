package com.face.attendance.embedding;

import com.face.attendance.core.model.FaceRegion;
import com.face.attendance.core.model.Signature;
import com.face.attendance.detection.DecodedImage;

/**
 * Converts a face region of a photo into a fixed-length signature.
 *
 * <p>Implementations must be thread-safe; the engine embeds the faces of one
 * photo in parallel.</p>
 */
public interface EmbeddingGenerator {

    /**
     * @param image  the photo the region belongs to
     * @param region a region returned by the detector, clipped to the image
     * @return the signature, with exactly {@link #dimension()} components
     * @throws EmbeddingException if no signature could be produced for this face
     */
    Signature embed(DecodedImage image, FaceRegion region) throws EmbeddingException;

    /**
     * Dimension of every signature this generator produces.
     */
    int dimension();
}
