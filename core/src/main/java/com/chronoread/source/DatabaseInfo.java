package com.chronoread.source;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Catalog entry for a database and its retention policies.
 */
public final class DatabaseInfo {

    private final String name;
    private final String defaultRetentionPolicy;
    private final Map<String, RetentionPolicyInfo> retentionPolicies = new LinkedHashMap<>();

    /**
     * Creates a database entry.
     *
     * @param name the database name
     * @param defaultRetentionPolicy the policy used when a bucket names none
     * @param retentionPolicies the database's retention policies
     */
    public DatabaseInfo(String name, String defaultRetentionPolicy, List<RetentionPolicyInfo> retentionPolicies) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.defaultRetentionPolicy = Objects.requireNonNull(defaultRetentionPolicy,
            "defaultRetentionPolicy must not be null");
        for (RetentionPolicyInfo rp : retentionPolicies) {
            this.retentionPolicies.put(rp.name(), rp);
        }
    }

    public String name() {
        return name;
    }

    public String defaultRetentionPolicy() {
        return defaultRetentionPolicy;
    }

    /**
     * Looks up a retention policy by name.
     *
     * @param name the policy name
     * @return the policy, or empty if the database has none by that name
     */
    public Optional<RetentionPolicyInfo> retentionPolicy(String name) {
        return Optional.ofNullable(retentionPolicies.get(name));
    }

    @Override
    public String toString() {
        return String.format("DatabaseInfo(name=%s, defaultRetentionPolicy=%s, retentionPolicies=%s)",
            name, defaultRetentionPolicy, retentionPolicies.keySet());
    }
}
