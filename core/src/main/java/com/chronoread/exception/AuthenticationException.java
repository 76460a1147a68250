package com.chronoread.exception;

/**
 * Exception thrown when authorization is enabled but the executing context
 * carries no user at all.
 *
 * <p>Kept apart from {@link AuthorizationException}: a missing user means the
 * request never crossed the trust boundary, while a denial means a known user
 * lacks a privilege.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }
}
