package com.chronoread.exception;

/**
 * Exception thrown when the metadata catalog does not know a database or a
 * retention policy named by a read.
 */
public class CatalogException extends RuntimeException {

    private final String database;
    private final String retentionPolicy;

    /**
     * Creates a catalog exception.
     *
     * @param message the error message
     * @param database the database being resolved
     * @param retentionPolicy the retention policy being resolved (may be null)
     */
    public CatalogException(String message, String database, String retentionPolicy) {
        super(message);
        this.database = database;
        this.retentionPolicy = retentionPolicy;
    }

    /**
     * Returns the database being resolved when the lookup failed.
     *
     * @return the database name
     */
    public String getDatabase() {
        return database;
    }

    /**
     * Returns the retention policy being resolved when the lookup failed.
     *
     * @return the retention policy, or null if the database itself was missing
     */
    public String getRetentionPolicy() {
        return retentionPolicy;
    }
}
