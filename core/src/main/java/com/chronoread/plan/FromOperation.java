package com.chronoread.plan;

import com.chronoread.exception.ConfigurationException;

/**
 * User-facing read operation naming the bucket to read from.
 *
 * <p>Exactly one of {@code bucket} and {@code bucketID} must be given:
 * <pre>
 *   FromOperation.create("telegraf/autogen", null)   -- by name
 *   FromOperation.create(null, "0389eade5af4b000")   -- by id
 * </pre>
 */
public final class FromOperation {

    private final String bucket;
    private final String bucketId;

    private FromOperation(String bucket, String bucketId) {
        this.bucket = bucket;
        this.bucketId = bucketId;
    }

    /**
     * Creates a read operation from its arguments.
     *
     * @param bucket the bucket name (null or empty when absent)
     * @param bucketId the bucket id (null or empty when absent)
     * @return the operation
     * @throws ConfigurationException if neither or both arguments are present
     */
    public static FromOperation create(String bucket, String bucketId) {
        String name = bucket == null ? "" : bucket;
        String id = bucketId == null ? "" : bucketId;
        if (name.isEmpty() && id.isEmpty()) {
            throw new ConfigurationException("must specify one of bucket or bucketID");
        }
        if (!name.isEmpty() && !id.isEmpty()) {
            throw new ConfigurationException("must specify only one of bucket or bucketID");
        }
        return new FromOperation(name, id);
    }

    /**
     * Returns the bucket name.
     *
     * @return the bucket name, or an empty string when reading by id
     */
    public String bucket() {
        return bucket;
    }

    /**
     * Returns the bucket id.
     *
     * @return the bucket id, or an empty string when reading by name
     */
    public String bucketId() {
        return bucketId;
    }

    @Override
    public String toString() {
        return bucket.isEmpty() ? "from(bucketID: " + bucketId + ")" : "from(bucket: " + bucket + ")";
    }
}
