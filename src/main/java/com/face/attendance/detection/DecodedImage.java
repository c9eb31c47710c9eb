package com.face.attendance.detection;

import java.util.Objects;

/**
 * An image payload that has been read and validated.
 * Keeps the original bytes so remote detectors receive exactly what was uploaded.
 */
public final class DecodedImage {

    private final byte[] data;
    private final String format;
    private final int width;
    private final int height;

    public DecodedImage(byte[] data, String format, int width, int height) {
        Objects.requireNonNull(data, "data is required");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive");
        }
        this.data = data.clone();
        this.format = format != null ? format : "unknown";
        this.width = width;
        this.height = height;
    }

    public byte[] getData() {
        return data.clone();
    }

    public int getSizeBytes() {
        return data.length;
    }

    public String getFormat() {
        return format;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    @Override
    public String toString() {
        return "DecodedImage{format='" + format + "', " + width + "x" + height + ", bytes=" + data.length + '}';
    }
}
