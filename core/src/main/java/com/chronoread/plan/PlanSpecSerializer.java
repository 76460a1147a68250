package com.chronoread.plan;

import com.chronoread.time.Bounds;
import com.chronoread.time.TimeValue;
import com.chronoread.time.Window;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Serializes physical read specs to JSON for explain output and plan caching.
 *
 * <p>Every field of the spec is written under its own name, including the
 * {@code ...Set} flags and values whose flag is off, so two specs serialize
 * identically exactly when they are field-for-field equal:
 * <pre>
 * {
 *   "bucket": "telegraf/autogen", "bucketID": "",
 *   "boundsSet": true, "bounds": {"start": ..., "stop": ..., "now": ...},
 *   "filterSet": false, "filter": null,
 *   ...
 * }
 * </pre>
 */
public final class PlanSpecSerializer {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private PlanSpecSerializer() {}

    /**
     * Converts a physical read spec to a JSON tree.
     *
     * @param spec the spec
     * @return the JSON object
     */
    public static ObjectNode toJson(PhysicalFromSpec spec) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("bucket", spec.getBucket());
        root.put("bucketID", spec.getBucketId());

        root.put("boundsSet", spec.isBoundsSet());
        if (spec.getBounds() == null) {
            root.putNull("bounds");
        } else {
            root.set("bounds", boundsJson(spec.getBounds()));
        }

        root.put("filterSet", spec.isFilterSet());
        if (spec.getFilter() == null) {
            root.putNull("filter");
        } else {
            root.put("filter", spec.getFilter().render());
        }

        root.put("descendingSet", spec.isDescendingSet());
        root.put("descending", spec.isDescending());

        root.put("limitSet", spec.isLimitSet());
        root.put("pointsLimit", spec.getPointsLimit());
        root.put("seriesLimit", spec.getSeriesLimit());
        root.put("seriesOffset", spec.getSeriesOffset());

        root.put("windowSet", spec.isWindowSet());
        if (spec.getWindow() == null) {
            root.putNull("window");
        } else {
            root.set("window", windowJson(spec.getWindow()));
        }

        root.put("groupingSet", spec.isGroupingSet());
        root.put("orderByTime", spec.isOrderByTime());
        root.put("groupMode", spec.getGroupMode().name().toLowerCase());
        ArrayNode keys = root.putArray("groupKeys");
        spec.getGroupKeys().forEach(keys::add);

        root.put("aggregateSet", spec.isAggregateSet());
        root.put("aggregateMethod", spec.getAggregateMethod());
        return root;
    }

    /**
     * Serializes a physical read spec to a JSON string.
     *
     * @param spec the spec
     * @return the JSON text
     */
    public static String toJsonString(PhysicalFromSpec spec) {
        try {
            return objectMapper.writeValueAsString(toJson(spec));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize read spec for " + spec.bucketLabel(), e);
        }
    }

    private static ObjectNode boundsJson(Bounds bounds) {
        ObjectNode node = objectMapper.createObjectNode();
        node.set("start", timeJson(bounds.start()));
        node.set("stop", timeJson(bounds.stop()));
        if (bounds.now() == null) {
            node.putNull("now");
        } else {
            node.put("now", bounds.now().toString());
        }
        return node;
    }

    private static ObjectNode timeJson(TimeValue time) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("relative", time.isRelative());
        node.put("nanos", time.nanos());
        return node;
    }

    private static ObjectNode windowJson(Window window) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("every", window.every());
        node.put("period", window.period());
        node.put("offset", window.offset());
        return node;
    }
}
