package com.chronoread.exception;

/**
 * Exception thrown when a finished physical plan fails validation.
 *
 * <p>The typical cause is a storage read that was never bounded in time. The
 * offending bucket is kept so callers can report it without parsing the
 * message.
 *
 * @see com.chronoread.optimizer.PlanValidator
 */
public class ValidationException extends RuntimeException {

    private final String bucket;

    /**
     * Creates a validation exception.
     *
     * @param message the error message
     * @param bucket the bucket of the invalid read (may be null)
     */
    public ValidationException(String message, String bucket) {
        super(message);
        this.bucket = bucket;
    }

    /**
     * Creates a validation exception that is not tied to a bucket.
     *
     * @param message the error message
     */
    public ValidationException(String message) {
        this(message, null);
    }

    /**
     * Returns the bucket named by the invalid read.
     *
     * @return the bucket, or null if not available
     */
    public String getBucket() {
        return bucket;
    }
}
