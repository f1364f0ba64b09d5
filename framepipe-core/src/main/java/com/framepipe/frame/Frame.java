package com.framepipe.frame;

import java.util.Objects;

/**
 * One generated image: packed 8-bit BGR pixels plus the time it was produced.
 *
 * <p>A frame has exactly one owner at a time. The producer owns it until it is pushed,
 * the queue while it is buffered, and a single worker once popped. The pixel array is
 * not copied and must not be shared across owners.
 *
 * @param width        width in pixels
 * @param height       height in pixels
 * @param pixels       row-major BGR bytes, {@code width * height * CHANNELS} long
 * @param createdNanos {@link System#nanoTime()} at generation
 */
public record Frame(int width, int height, byte[] pixels, long createdNanos) {

    /** Bytes per pixel (blue, green, red). */
    public static final int CHANNELS = 3;

    public Frame {
        Objects.requireNonNull(pixels, "pixels");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Frame dimensions must be positive: " + width + "x" + height);
        }
        long expected = (long) width * height * CHANNELS;
        if (pixels.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "Pixel buffer holds %d bytes, expected %d for %dx%d", pixels.length, expected, width, height));
        }
    }

    /**
     * Returns the age of this frame relative to the given {@link System#nanoTime()} reading.
     */
    public long ageNanos(long nowNanos) {
        return nowNanos - createdNanos;
    }
}
