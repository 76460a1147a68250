package com.chronoread.plan;

import com.chronoread.exception.ValidationException;
import com.chronoread.expression.FunctionExpression;
import com.chronoread.time.Bounds;
import com.chronoread.time.TimeRange;
import com.chronoread.time.Window;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Storage read with everything pushed down into it so far.
 *
 * <p>A physical read starts as a plain, unbounded copy of a logical read and is
 * enriched field by field as rewrite rules merge operations into it:
 * <ul>
 *   <li>time bounds from a range</li>
 *   <li>a row predicate from a filter</li>
 *   <li>grouping from a group</li>
 *   <li>a one-point-per-series limit from distinct or keys</li>
 * </ul>
 *
 * <p>Each optional part is guarded by a {@code ...Set} flag; the value fields
 * are meaningless while their flag is false. Instances are mutable only
 * between {@link #copy()} and the moment the copy is handed to the plan graph.
 */
public final class PhysicalFromSpec implements ProcedureSpec {

    /** Points limit meaning "first point of every series only". */
    public static final long FIRST_POINT_ONLY = -1L;

    private String bucket;
    private String bucketId;

    private boolean boundsSet;
    private Bounds bounds;

    private boolean filterSet;
    private FunctionExpression filter;

    private boolean descendingSet;
    private boolean descending;

    private boolean limitSet;
    private long pointsLimit;
    private long seriesLimit;
    private long seriesOffset;

    private boolean windowSet;
    private Window window;

    private boolean groupingSet;
    private boolean orderByTime;
    private GroupMode groupMode = GroupMode.NONE;
    private List<String> groupKeys = new ArrayList<>();

    private boolean aggregateSet;
    private String aggregateMethod = "";

    private PhysicalFromSpec() {
    }

    /**
     * Creates an unbounded physical read for the bucket of a logical read.
     *
     * @param logical the logical read
     */
    public PhysicalFromSpec(FromSpec logical) {
        Objects.requireNonNull(logical, "logical must not be null");
        this.bucket = logical.bucket();
        this.bucketId = logical.bucketId();
    }

    @Override
    public ProcedureKind kind() {
        return ProcedureKind.PHYSICAL_FROM;
    }

    @Override
    public PhysicalFromSpec copy() {
        PhysicalFromSpec ns = new PhysicalFromSpec();

        ns.bucket = bucket;
        ns.bucketId = bucketId;

        ns.boundsSet = boundsSet;
        ns.bounds = bounds;

        ns.filterSet = filterSet;
        ns.filter = filter;

        ns.descendingSet = descendingSet;
        ns.descending = descending;

        ns.limitSet = limitSet;
        ns.pointsLimit = pointsLimit;
        ns.seriesLimit = seriesLimit;
        ns.seriesOffset = seriesOffset;

        ns.windowSet = windowSet;
        ns.window = window;

        ns.groupingSet = groupingSet;
        ns.orderByTime = orderByTime;
        ns.groupMode = groupMode;
        ns.groupKeys = new ArrayList<>(groupKeys);

        ns.aggregateSet = aggregateSet;
        ns.aggregateMethod = aggregateMethod;

        return ns;
    }

    /**
     * Returns the absolute time range this read covers.
     *
     * @return the resolved bounds, or empty when the read is still unbounded
     */
    public Optional<TimeRange> timeBounds() {
        if (!boundsSet) {
            return Optional.empty();
        }
        return Optional.of(bounds.resolve());
    }

    /**
     * Returns whether the read is already capped to the first point of each series.
     *
     * @return true if {@link #FIRST_POINT_ONLY} is in effect
     */
    public boolean isFirstPointOnly() {
        return limitSet && pointsLimit == FIRST_POINT_ONLY;
    }

    /**
     * Returns the bucket name, or the bucket id when reading by id.
     *
     * @return a label identifying the bucket
     */
    public String bucketLabel() {
        return bucket.isEmpty() ? bucketId : bucket;
    }

    @Override
    public void postPhysicalValidate(NodeId id) {
        if (!boundsSet || bounds.isZero()) {
            throw new ValidationException(
                String.format("%s: results from \"%s\" must be bounded", id, bucketLabel()), bucketLabel());
        }
        if (!bucketId.isEmpty()) {
            throw new ValidationException(
                String.format("%s: cannot refer to buckets by their id in 1.x (bucketID \"%s\")", id, bucketId),
                bucketId);
        }
    }

    // ==================== Accessors ====================

    public String getBucket() {
        return bucket;
    }

    public String getBucketId() {
        return bucketId;
    }

    public boolean isBoundsSet() {
        return boundsSet;
    }

    public Bounds getBounds() {
        return bounds;
    }

    /**
     * Sets the time bounds and marks them as set.
     *
     * @param bounds the bounds
     */
    public void setBounds(Bounds bounds) {
        this.bounds = Objects.requireNonNull(bounds, "bounds must not be null");
        this.boundsSet = true;
    }

    public boolean isFilterSet() {
        return filterSet;
    }

    public FunctionExpression getFilter() {
        return filter;
    }

    /**
     * Sets the pushed-down predicate and marks it as set.
     *
     * @param filter the predicate function
     */
    public void setFilter(FunctionExpression filter) {
        this.filter = Objects.requireNonNull(filter, "filter must not be null");
        this.filterSet = true;
    }

    public boolean isDescendingSet() {
        return descendingSet;
    }

    public boolean isDescending() {
        return descending;
    }

    public void setDescending(boolean descending) {
        this.descending = descending;
        this.descendingSet = true;
    }

    public boolean isLimitSet() {
        return limitSet;
    }

    public long getPointsLimit() {
        return pointsLimit;
    }

    public long getSeriesLimit() {
        return seriesLimit;
    }

    public long getSeriesOffset() {
        return seriesOffset;
    }

    /**
     * Sets the per-series points limit and marks limits as set.
     *
     * @param pointsLimit the limit, or {@link #FIRST_POINT_ONLY}
     */
    public void setPointsLimit(long pointsLimit) {
        this.pointsLimit = pointsLimit;
        this.limitSet = true;
    }

    /**
     * Sets series pagination and marks limits as set.
     *
     * @param seriesLimit the maximum number of series
     * @param seriesOffset the number of series to skip
     */
    public void setSeriesLimit(long seriesLimit, long seriesOffset) {
        this.seriesLimit = seriesLimit;
        this.seriesOffset = seriesOffset;
        this.limitSet = true;
    }

    public boolean isWindowSet() {
        return windowSet;
    }

    public Window getWindow() {
        return window;
    }

    public void setWindow(Window window) {
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.windowSet = true;
    }

    public boolean isGroupingSet() {
        return groupingSet;
    }

    public boolean isOrderByTime() {
        return orderByTime;
    }

    public void setOrderByTime(boolean orderByTime) {
        this.orderByTime = orderByTime;
    }

    public GroupMode getGroupMode() {
        return groupMode;
    }

    /**
     * Returns the group keys.
     *
     * @return an unmodifiable list of keys
     */
    public List<String> getGroupKeys() {
        return Collections.unmodifiableList(groupKeys);
    }

    /**
     * Sets grouping and marks it as set.
     *
     * @param mode the group mode
     * @param keys the group keys
     */
    public void setGrouping(GroupMode mode, List<String> keys) {
        this.groupMode = Objects.requireNonNull(mode, "mode must not be null");
        this.groupKeys = new ArrayList<>(Objects.requireNonNull(keys, "keys must not be null"));
        this.groupingSet = true;
    }

    public boolean isAggregateSet() {
        return aggregateSet;
    }

    public String getAggregateMethod() {
        return aggregateMethod;
    }

    public void setAggregateMethod(String aggregateMethod) {
        this.aggregateMethod = Objects.requireNonNull(aggregateMethod, "aggregateMethod must not be null");
        this.aggregateSet = true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PhysicalFrom(bucket=").append(bucketLabel());
        if (boundsSet) {
            sb.append(", bounds=").append(bounds);
        }
        if (filterSet) {
            sb.append(", filter=").append(filter);
        }
        if (limitSet) {
            sb.append(", pointsLimit=").append(pointsLimit);
        }
        if (groupingSet) {
            sb.append(", group=").append(groupMode).append(groupKeys);
        }
        if (aggregateSet) {
            sb.append(", aggregate=").append(aggregateMethod);
        }
        return sb.append(')').toString();
    }
}
