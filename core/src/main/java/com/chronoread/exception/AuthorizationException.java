package com.chronoread.exception;

/**
 * Exception thrown when a user lacks the privilege required to read a database.
 */
public class AuthorizationException extends RuntimeException {

    private final String user;
    private final String database;

    /**
     * Creates an authorization exception.
     *
     * @param message the error message
     * @param user the user that was denied
     * @param database the database the user tried to read
     */
    public AuthorizationException(String message, String user, String database) {
        super(message);
        this.user = user;
        this.database = database;
    }

    public String getUser() {
        return user;
    }

    public String getDatabase() {
        return database;
    }
}
