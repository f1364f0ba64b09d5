package com.framepipe.pipeline;

import java.util.List;
import java.util.Locale;

/**
 * Final figures of one pipeline run, built by {@link LifecycleController} after every actor has been joined.
 *
 * @param generated        frames pushed by the producer
 * @param saved            frames persisted successfully
 * @param failed           frames whose persistence failed
 * @param bytesWritten     total encoded bytes written
 * @param elapsedMillis    wall time between start and the end of the join
 * @param averageRate      {@code generated * 1000 / elapsedMillis}
 * @param queuedAtReport   items left in the queue when the report was built
 * @param evicted          items discarded by drop-oldest overflow
 * @param rateSamples      per-second producer observations
 * @param producerFailure  the exception that ended the producer early, or null
 */
public record PipelineReport(long generated,
                             long saved,
                             long failed,
                             long bytesWritten,
                             long elapsedMillis,
                             double averageRate,
                             int queuedAtReport,
                             long evicted,
                             List<RateSample> rateSamples,
                             RuntimeException producerFailure) {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    public PipelineReport {
        rateSamples = List.copyOf(rateSamples);
    }

    static double averageRate(long generated, long elapsedMillis) {
        if (elapsedMillis <= 0) {
            return 0.0;
        }
        return generated * 1000.0 / elapsedMillis;
    }

    public double megabytesWritten() {
        return bytesWritten / BYTES_PER_MB;
    }

    public boolean producerFailed() {
        return producerFailure != null;
    }

    /**
     * Renders the summary block printed at the end of a command-line run.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("----- SUMMARY -----").append(System.lineSeparator());
        sb.append("Generated frames : ").append(generated).append(System.lineSeparator());
        sb.append("Saved frames     : ").append(saved).append(System.lineSeparator());
        sb.append("Failed saves     : ").append(failed).append(System.lineSeparator());
        sb.append("Evicted frames   : ").append(evicted).append(System.lineSeparator());
        sb.append("Data written     : ")
                .append(String.format(Locale.ROOT, "%.2f", megabytesWritten())).append(" MB")
                .append(System.lineSeparator());
        sb.append("Elapsed          : ").append(elapsedMillis).append(" ms").append(System.lineSeparator());
        sb.append("Average rate     : ")
                .append(String.format(Locale.ROOT, "%.2f", averageRate)).append(" frames/s")
                .append(System.lineSeparator());
        sb.append("Left in queue    : ").append(queuedAtReport).append(System.lineSeparator());
        if (producerFailure != null) {
            sb.append("Producer failure : ").append(producerFailure).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
