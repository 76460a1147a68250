package com.chronoread.source;

/**
 * Database privileges checked by an {@link Authorizer}.
 */
public enum Privilege {
    READ,
    WRITE,
    ALL
}
