package com.chronoread.plan;

import com.chronoread.exception.ValidationException;
import java.util.Objects;

/**
 * Logical read from a bucket, before any time bounds are known.
 *
 * <p>A logical read cannot be executed. It is always converted into a
 * {@link PhysicalFromSpec}; one that survives until physical validation is
 * reported as unbounded.
 */
public final class FromSpec implements ProcedureSpec {

    private final String bucket;
    private final String bucketId;

    /**
     * Creates a logical read spec.
     *
     * @param bucket the bucket name (empty when reading by id)
     * @param bucketId the bucket id (empty when reading by name)
     */
    public FromSpec(String bucket, String bucketId) {
        this.bucket = Objects.requireNonNull(bucket, "bucket must not be null");
        this.bucketId = Objects.requireNonNull(bucketId, "bucketId must not be null");
    }

    /**
     * Creates the logical read spec for a user-facing read operation.
     *
     * @param operation the operation
     * @return the spec
     */
    public static FromSpec fromOperation(FromOperation operation) {
        return new FromSpec(operation.bucket(), operation.bucketId());
    }

    public String bucket() {
        return bucket;
    }

    public String bucketId() {
        return bucketId;
    }

    @Override
    public ProcedureKind kind() {
        return ProcedureKind.FROM;
    }

    @Override
    public FromSpec copy() {
        return new FromSpec(bucket, bucketId);
    }

    @Override
    public void postPhysicalValidate(NodeId id) {
        String label = bucket.isEmpty() ? bucketId : bucket;
        throw new ValidationException(
            String.format("%s: results from \"%s\" must be bounded", id, label), label);
    }

    @Override
    public String toString() {
        return String.format("From(bucket=%s, bucketID=%s)", bucket, bucketId);
    }
}
