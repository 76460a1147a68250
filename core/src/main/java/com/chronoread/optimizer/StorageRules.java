package com.chronoread.optimizer;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The fixed catalog of storage pushdown rules.
 */
public final class StorageRules {

    private StorageRules() {} // Utility class

    /**
     * Returns a fresh instance of every storage rule, in registration order.
     *
     * @return the rules
     */
    public static List<RewriteRule> all() {
        return Collections.unmodifiableList(Arrays.asList(
            new FromConversionRule(),
            new MergeFromRangeRule(),
            new MergeFromFilterRule(),
            new FromDistinctRule(),
            new MergeFromGroupRule(),
            new FromKeysRule()
        ));
    }
}
