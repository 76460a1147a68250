package com.chronoread.source;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-query context handed to sources and readers.
 *
 * <p>Carries the user the query runs as, if any, and a cooperative
 * cancellation flag. Sources never enforce cancellation themselves; they pass
 * the context to the {@link Reader}, which is expected to check it.
 */
public final class ExecutionContext {

    private final User user;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private ExecutionContext(User user) {
        this.user = user;
    }

    /**
     * Creates a context for a query run by a user.
     *
     * @param user the user
     * @return the context
     */
    public static ExecutionContext forUser(User user) {
        return new ExecutionContext(Objects.requireNonNull(user, "user must not be null"));
    }

    /**
     * Creates a context with no user attached.
     *
     * @return the context
     */
    public static ExecutionContext anonymous() {
        return new ExecutionContext(null);
    }

    /**
     * Returns the user the query runs as.
     *
     * @return the user, or empty when none is attached
     */
    public Optional<User> user() {
        return Optional.ofNullable(user);
    }

    /**
     * Requests cancellation of the query.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
