package com.chronoread.source;

import com.chronoread.expression.FunctionExpression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * What a {@link Reader} is asked to read, with the bucket resolved to a
 * database and retention policy.
 *
 * <p>Built once per source from a validated physical read and shared by
 * every window's storage call; immutable.
 */
public final class ReadSpec {

    private final String database;
    private final String retentionPolicy;

    private final long ramLimit;
    private final List<String> hosts;
    private final FunctionExpression predicate;
    private final long pointsLimit;
    private final long seriesLimit;
    private final long seriesOffset;
    private final boolean descending;

    private final String aggregateMethod;

    // Produce all series for a time before any series for a later time
    private final boolean orderByTime;
    private final StorageGroupMode groupMode;
    private final List<String> groupKeys;

    private ReadSpec(Builder builder) {
        this.database = Objects.requireNonNull(builder.database, "database must not be null");
        this.retentionPolicy = Objects.requireNonNull(builder.retentionPolicy, "retentionPolicy must not be null");
        this.ramLimit = builder.ramLimit;
        this.hosts = Collections.unmodifiableList(new ArrayList<>(builder.hosts));
        this.predicate = builder.predicate;
        this.pointsLimit = builder.pointsLimit;
        this.seriesLimit = builder.seriesLimit;
        this.seriesOffset = builder.seriesOffset;
        this.descending = builder.descending;
        this.aggregateMethod = builder.aggregateMethod;
        this.orderByTime = builder.orderByTime;
        this.groupMode = builder.groupMode;
        this.groupKeys = Collections.unmodifiableList(new ArrayList<>(builder.groupKeys));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String database() {
        return database;
    }

    public String retentionPolicy() {
        return retentionPolicy;
    }

    public long ramLimit() {
        return ramLimit;
    }

    public List<String> hosts() {
        return hosts;
    }

    /**
     * Returns the row predicate storage evaluates.
     *
     * @return the predicate, or empty to read every row
     */
    public Optional<FunctionExpression> predicate() {
        return Optional.ofNullable(predicate);
    }

    public long pointsLimit() {
        return pointsLimit;
    }

    public long seriesLimit() {
        return seriesLimit;
    }

    public long seriesOffset() {
        return seriesOffset;
    }

    public boolean descending() {
        return descending;
    }

    public String aggregateMethod() {
        return aggregateMethod;
    }

    public boolean orderByTime() {
        return orderByTime;
    }

    public StorageGroupMode groupMode() {
        return groupMode;
    }

    public List<String> groupKeys() {
        return groupKeys;
    }

    @Override
    public String toString() {
        return String.format("ReadSpec(db=%s, rp=%s, predicate=%s, pointsLimit=%d, groupMode=%s, groupKeys=%s)",
            database, retentionPolicy, predicate, pointsLimit, groupMode, groupKeys);
    }

    public static class Builder {
        private String database;
        private String retentionPolicy;
        private long ramLimit;
        private List<String> hosts = new ArrayList<>();
        private FunctionExpression predicate;
        private long pointsLimit;
        private long seriesLimit;
        private long seriesOffset;
        private boolean descending;
        private String aggregateMethod = "";
        private boolean orderByTime;
        private StorageGroupMode groupMode = StorageGroupMode.DEFAULT;
        private List<String> groupKeys = new ArrayList<>();

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder retentionPolicy(String retentionPolicy) {
            this.retentionPolicy = retentionPolicy;
            return this;
        }

        public Builder ramLimit(long ramLimit) {
            this.ramLimit = ramLimit;
            return this;
        }

        public Builder hosts(List<String> hosts) {
            this.hosts = new ArrayList<>(hosts);
            return this;
        }

        public Builder predicate(FunctionExpression predicate) {
            this.predicate = predicate;
            return this;
        }

        public Builder pointsLimit(long pointsLimit) {
            this.pointsLimit = pointsLimit;
            return this;
        }

        public Builder seriesLimit(long seriesLimit) {
            this.seriesLimit = seriesLimit;
            return this;
        }

        public Builder seriesOffset(long seriesOffset) {
            this.seriesOffset = seriesOffset;
            return this;
        }

        public Builder descending(boolean descending) {
            this.descending = descending;
            return this;
        }

        public Builder aggregateMethod(String aggregateMethod) {
            this.aggregateMethod = Objects.requireNonNull(aggregateMethod, "aggregateMethod must not be null");
            return this;
        }

        public Builder orderByTime(boolean orderByTime) {
            this.orderByTime = orderByTime;
            return this;
        }

        public Builder groupMode(StorageGroupMode groupMode) {
            this.groupMode = Objects.requireNonNull(groupMode, "groupMode must not be null");
            return this;
        }

        public Builder groupKeys(List<String> groupKeys) {
            this.groupKeys = new ArrayList<>(groupKeys);
            return this;
        }

        public ReadSpec build() {
            return new ReadSpec(this);
        }
    }
}
