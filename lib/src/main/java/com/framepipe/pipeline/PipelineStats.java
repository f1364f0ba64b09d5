package com.framepipe.pipeline;

/**
 * Point-in-time copy of the shared pipeline counters.
 *
 * @param generated    frames pushed by the producer
 * @param saved        frames persisted successfully
 * @param failed       frames whose persistence failed
 * @param bytesWritten total bytes reported by successful persists
 */
public record PipelineStats(long generated, long saved, long failed, long bytesWritten) {
}
