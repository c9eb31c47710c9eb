package com.face.attendance.detection;

import com.face.attendance.core.model.FaceRegion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FaceOrdering")
class FaceOrderingTest {

    @Test
    @DisplayName("Sorts by left edge, then top edge, then larger area first")
    void readingOrder() {
        FaceRegion right = FaceRegion.of(300, 10, 50, 50);
        FaceRegion lowerLeft = FaceRegion.of(10, 200, 50, 50);
        FaceRegion upperLeftSmall = FaceRegion.of(10, 20, 30, 30);
        FaceRegion upperLeftLarge = FaceRegion.of(10, 20, 60, 60);

        List<FaceRegion> regions = new ArrayList<>(List.of(right, lowerLeft, upperLeftSmall, upperLeftLarge));
        regions.sort(FaceOrdering.READING_ORDER);

        assertEquals(List.of(upperLeftLarge, upperLeftSmall, lowerLeft, right), regions);
    }
}
