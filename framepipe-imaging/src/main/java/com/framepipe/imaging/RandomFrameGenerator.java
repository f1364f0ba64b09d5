package com.framepipe.imaging;

import com.framepipe.frame.Frame;
import com.framepipe.frame.FrameGenerator;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates frames of fixed dimensions filled with uniformly random BGR bytes.
 * Random content defeats JPEG compression, so every frame costs close to its worst-case size on disk.
 */
public class RandomFrameGenerator implements FrameGenerator {

    private final int width;
    private final int height;

    public RandomFrameGenerator(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Frame dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    @Override
    public Frame generate() {
        byte[] pixels = new byte[width * height * Frame.CHANNELS];
        ThreadLocalRandom.current().nextBytes(pixels);
        return new Frame(width, height, pixels, System.nanoTime());
    }
}
