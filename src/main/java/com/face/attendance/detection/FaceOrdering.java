package com.face.attendance.detection;

import com.face.attendance.core.model.FaceRegion;

import java.util.Comparator;

/**
 * Orders detected regions so face indexes are stable for a given photo.
 */
public final class FaceOrdering {

    /**
     * Left edge ascending, then top edge ascending, then larger area first.
     */
    public static final Comparator<FaceRegion> READING_ORDER =
            Comparator.comparingInt(FaceRegion::left)
                    .thenComparingInt(FaceRegion::top)
                    .thenComparing(Comparator.comparingLong(FaceRegion::area).reversed());

    private FaceOrdering() {
    }
}
