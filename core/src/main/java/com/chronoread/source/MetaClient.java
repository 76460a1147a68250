package com.chronoread.source;

import java.util.Optional;

/**
 * Read access to the metadata catalog.
 */
public interface MetaClient {

    /**
     * Looks up a database by name.
     *
     * @param name the database name
     * @return the database, or empty if it does not exist
     */
    Optional<DatabaseInfo> database(String name);
}
