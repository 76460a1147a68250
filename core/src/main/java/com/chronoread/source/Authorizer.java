package com.chronoread.source;

/**
 * Decides whether a user may access a database.
 */
public interface Authorizer {

    /**
     * Checks that a user holds a privilege on a database.
     *
     * @param user the user
     * @param privilege the required privilege
     * @param database the database name
     * @throws com.chronoread.exception.AuthorizationException if access is denied
     */
    void authorizeDatabase(User user, Privilege privilege, String database);
}
