package com.chronoread.source;

import com.chronoread.exception.AuthenticationException;
import com.chronoread.exception.CatalogException;
import com.chronoread.exception.PlanningException;
import com.chronoread.plan.PhysicalFromSpec;
import com.chronoread.time.TimeRange;
import com.chronoread.time.Window;
import java.time.Clock;
import java.util.Collections;
import java.util.Objects;
import org.apache.arrow.memory.BufferAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link WindowedSource}s from validated physical reads.
 *
 * <p>Construction resolves the bucket against the catalog and checks access
 * before any data is read:
 * <ol>
 *   <li>buckets referenced by id are rejected</li>
 *   <li>the bucket {@code db/rp} is split on its first {@code /}; a bucket
 *       without one names only the database</li>
 *   <li>the database must exist</li>
 *   <li>with auth enabled, the query must run as a user holding read
 *       privilege on the database</li>
 *   <li>a missing retention policy defaults to the database's default, and
 *       the resolved policy must exist</li>
 * </ol>
 *
 * <p>Without an explicit window, the whole bounded interval is read in one
 * window.
 *
 * <p>Example usage:
 * <pre>
 *   StorageSourceFactory factory = new StorageSourceFactory(deps);
 *   WindowedSource source = factory.createSource(spec, DatasetId.of("read0"), ctx, allocator);
 *   source.addTransformation(consumer);
 *   source.run(ctx);
 * </pre>
 */
public class StorageSourceFactory {

    private static final Logger logger = LoggerFactory.getLogger(StorageSourceFactory.class);

    private final Dependencies dependencies;
    private final SourceConfig config;
    private final Clock clock;

    /**
     * Creates a factory configured from system properties.
     *
     * @param dependencies the source collaborators
     */
    public StorageSourceFactory(Dependencies dependencies) {
        this(dependencies, SourceConfig.fromSystemProperties(), Clock.systemUTC());
    }

    /**
     * Creates a factory.
     *
     * @param dependencies the source collaborators
     * @param config the source configuration
     * @param clock clock for processing-time heartbeats
     * @throws com.chronoread.exception.ConfigurationException if a collaborator is missing
     */
    public StorageSourceFactory(Dependencies dependencies, SourceConfig config, Clock clock) {
        this.dependencies = Objects.requireNonNull(dependencies, "dependencies must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        dependencies.validate();
    }

    /**
     * Creates the source for a physical read.
     *
     * @param spec the validated physical read
     * @param id the dataset the source produces
     * @param ctx the query context
     * @param allocator allocator for table memory
     * @return the source, not yet running
     * @throws PlanningException if the read cannot be served by this backend
     * @throws CatalogException if the database or retention policy does not exist
     * @throws AuthenticationException if auth is enabled and no user is attached
     * @throws com.chronoread.exception.AuthorizationException if the user may not read the database
     */
    public WindowedSource createSource(PhysicalFromSpec spec, DatasetId id, ExecutionContext ctx,
                                       BufferAllocator allocator) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(ctx, "ctx must not be null");

        if (!spec.getBucketId().isEmpty()) {
            throw new PlanningException("cannot refer to buckets by their id in 1.x");
        }

        String bucket = spec.getBucket();
        String db;
        String rp;
        int slash = bucket.indexOf('/');
        if (slash == -1) {
            db = bucket;
            rp = "";
        } else {
            db = bucket.substring(0, slash);
            rp = bucket.substring(slash + 1);
        }

        DatabaseInfo di = dependencies.metaClient().database(db)
            .orElseThrow(() -> new CatalogException("no database", db, null));

        if (dependencies.authEnabled()) {
            User user = ctx.user()
                .orElseThrow(() -> new AuthenticationException("createFromSource: no user"));
            dependencies.authorizer().authorizeDatabase(user, Privilege.READ, db);
        }

        if (rp.isEmpty()) {
            rp = di.defaultRetentionPolicy();
        }
        if (di.retentionPolicy(rp).isEmpty()) {
            throw new CatalogException("invalid retention policy", db, rp);
        }

        TimeRange bounds = spec.timeBounds()
            .orElseThrow(() -> new PlanningException(
                String.format("read of \"%s\" has no bounds", spec.bucketLabel())));
        Window window = windowFor(spec, bounds);
        long currentTime = firstWindowStop(bounds, window);

        ReadSpec readSpec = ReadSpec.builder()
            .database(db)
            .retentionPolicy(rp)
            .ramLimit(0)
            .hosts(Collections.emptyList())
            .predicate(spec.isFilterSet() ? spec.getFilter() : null)
            .pointsLimit(spec.getPointsLimit())
            .seriesLimit(spec.getSeriesLimit())
            .seriesOffset(spec.getSeriesOffset())
            .descending(spec.isDescending())
            .orderByTime(spec.isOrderByTime())
            .groupMode(StorageGroupMode.from(spec.getGroupMode()))
            .groupKeys(spec.getGroupKeys())
            .aggregateMethod(spec.getAggregateMethod())
            .build();

        logger.info("Created source {} for {}/{} over {} with {}", id, db, rp, bounds, window);
        return new WindowedSource(id, dependencies.reader(), readSpec, bounds, window, currentTime,
            allocator, config.readErrorPolicy(), clock);
    }

    private static Window windowFor(PhysicalFromSpec spec, TimeRange bounds) {
        if (spec.isWindowSet()) {
            Window window = spec.getWindow();
            if (window.every() <= 0 || window.period() <= 0) {
                throw new PlanningException("window every and period must be positive: " + window);
            }
            return window;
        }
        if (bounds.isEmpty()) {
            return new Window(0, 0, 0);
        }
        try {
            return Window.covering(bounds);
        } catch (ArithmeticException e) {
            throw new PlanningException(
                String.format("bounds %s of \"%s\" are too wide to read", bounds, spec.bucketLabel()), e);
        }
    }

    private static long firstWindowStop(TimeRange bounds, Window window) {
        try {
            return Math.addExact(bounds.start(), window.period());
        } catch (ArithmeticException e) {
            throw new PlanningException(
                String.format("first window of %s with period %d leaves the time domain", bounds, window.period()), e);
        }
    }
}
