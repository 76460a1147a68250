package com.chronoread.source;

import com.chronoread.exception.ConfigurationException;

/**
 * Collaborators a storage source needs, passed explicitly to
 * {@link StorageSourceFactory}.
 *
 * <pre>
 *   Dependencies deps = Dependencies.builder()
 *       .reader(reader)
 *       .metaClient(metaClient)
 *       .authorizer(authorizer)
 *       .authEnabled(true)
 *       .build();  // validates
 * </pre>
 */
public final class Dependencies {

    private final Reader reader;
    private final MetaClient metaClient;
    private final Authorizer authorizer;
    private final boolean authEnabled;

    private Dependencies(Builder builder) {
        this.reader = builder.reader;
        this.metaClient = builder.metaClient;
        this.authorizer = builder.authorizer;
        this.authEnabled = builder.authEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks that every required collaborator is present.
     *
     * @throws ConfigurationException naming the first missing collaborator
     */
    public void validate() {
        if (reader == null) {
            throw new ConfigurationException("missing reader dependency");
        }
        if (metaClient == null) {
            throw new ConfigurationException("missing meta client dependency");
        }
        if (authEnabled && authorizer == null) {
            throw new ConfigurationException("validate Dependencies: missing Authorizer");
        }
    }

    public Reader reader() {
        return reader;
    }

    public MetaClient metaClient() {
        return metaClient;
    }

    /**
     * Returns the authorizer.
     *
     * @return the authorizer, possibly null when auth is disabled
     */
    public Authorizer authorizer() {
        return authorizer;
    }

    public boolean authEnabled() {
        return authEnabled;
    }

    public static class Builder {
        private Reader reader;
        private MetaClient metaClient;
        private Authorizer authorizer;
        private boolean authEnabled;

        public Builder reader(Reader reader) {
            this.reader = reader;
            return this;
        }

        public Builder metaClient(MetaClient metaClient) {
            this.metaClient = metaClient;
            return this;
        }

        public Builder authorizer(Authorizer authorizer) {
            this.authorizer = authorizer;
            return this;
        }

        public Builder authEnabled(boolean authEnabled) {
            this.authEnabled = authEnabled;
            return this;
        }

        /**
         * Builds and validates the dependencies.
         *
         * @return the dependencies
         * @throws ConfigurationException if a required collaborator is missing
         */
        public Dependencies build() {
            Dependencies deps = new Dependencies(this);
            deps.validate();
            return deps;
        }
    }
}
