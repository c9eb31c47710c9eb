package com.face.attendance.core.model;

/**
 * Bounding box of a detected face in pixel coordinates.
 *
 * @param left       x of the left edge
 * @param top        y of the top edge
 * @param width      box width, positive
 * @param height     box height, positive
 * @param confidence detector confidence in [0,1]
 */
public record FaceRegion(int left, int top, int width, int height, double confidence) {

    public FaceRegion {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Face region must have positive width and height");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }

    public static FaceRegion of(int left, int top, int width, int height) {
        return new FaceRegion(left, top, width, height, 1.0);
    }

    public int right() {
        return left + width;
    }

    public int bottom() {
        return top + height;
    }

    public long area() {
        return (long) width * height;
    }

    /**
     * Clips this region to an image of the given size.
     *
     * @return the clipped region, or null if nothing of it lies inside the image
     */
    public FaceRegion clipTo(int imageWidth, int imageHeight) {
        int l = Math.max(0, left);
        int t = Math.max(0, top);
        int r = Math.min(imageWidth, right());
        int b = Math.min(imageHeight, bottom());
        if (r <= l || b <= t) {
            return null;
        }
        if (l == left && t == top && r == right() && b == bottom()) {
            return this;
        }
        return new FaceRegion(l, t, r - l, b - t, confidence);
    }
}
