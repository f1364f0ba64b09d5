package com.framepipe.frame;

/**
 * Base exception for failures while storing a single frame.
 * A worker that catches one drops the frame and carries on.
 */
public class FramePersistenceException extends RuntimeException {
    private final long sequenceNumber;

    public FramePersistenceException(String message, long sequenceNumber) {
        super(String.format("%s (sequence: %d)", message, sequenceNumber));
        this.sequenceNumber = sequenceNumber;
    }

    public FramePersistenceException(String message, long sequenceNumber, Throwable cause) {
        super(String.format("%s (sequence: %d)", message, sequenceNumber), cause);
        this.sequenceNumber = sequenceNumber;
    }

    public long getSequenceNumber() {
        return sequenceNumber;
    }

    /**
     * Thrown when the frame cannot be encoded into the target image format.
     */
    public static class EncodingFailedException extends FramePersistenceException {
        public EncodingFailedException(String message, long sequenceNumber) {
            super(message, sequenceNumber);
        }

        public EncodingFailedException(String message, long sequenceNumber, Throwable cause) {
            super(message, sequenceNumber, cause);
        }
    }

    /**
     * Thrown when the encoded bytes cannot be written to storage.
     */
    public static class WriteFailedException extends FramePersistenceException {
        public WriteFailedException(String message, long sequenceNumber, Throwable cause) {
            super(message, sequenceNumber, cause);
        }
    }
}
