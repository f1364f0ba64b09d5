package com.framepipe.pipeline;

/**
 * Frames the producer pushed during one observation window of roughly one second.
 *
 * @param epochMillis    wall-clock time the window closed
 * @param framesInWindow frames pushed in the window
 */
public record RateSample(long epochMillis, int framesInWindow) {
}
