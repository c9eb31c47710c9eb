package com.face.attendance.detection;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Validates an uploaded payload and reads its format and dimensions.
 * Pixel data is not kept; detectors receive the original bytes.
 */
public class ImageDecoder {

    public static final int DEFAULT_MAX_BYTES = 10 * 1024 * 1024;

    private final int maxBytes;

    public ImageDecoder() {
        this(DEFAULT_MAX_BYTES);
    }

    public ImageDecoder(int maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        this.maxBytes = maxBytes;
    }

    /**
     * @throws InvalidImageException if the payload is empty, too large or not a readable image
     */
    public DecodedImage decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new InvalidImageException("Image payload is empty");
        }
        if (payload.length > maxBytes) {
            throw new InvalidImageException("Image payload exceeds " + maxBytes + " bytes");
        }
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(payload))) {
            if (in == null) {
                throw new InvalidImageException("Image payload could not be read");
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new InvalidImageException("Unsupported or corrupt image payload");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if (width <= 0 || height <= 0) {
                    throw new InvalidImageException("Image has no pixels");
                }
                return new DecodedImage(payload, reader.getFormatName().toLowerCase(), width, height);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new InvalidImageException("Unsupported or corrupt image payload", e);
        }
    }

    public int getMaxBytes() {
        return maxBytes;
    }
}
