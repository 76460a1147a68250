package com.chronoread.source;

import java.util.Objects;

/**
 * An authenticated user on whose behalf a query runs.
 */
public final class User {

    private final String name;

    public User(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof User)) return false;
        return name.equals(((User) obj).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "User(" + name + ")";
    }
}
