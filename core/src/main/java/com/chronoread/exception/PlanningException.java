package com.chronoread.exception;

/**
 * Exception thrown when a plan cannot be rewritten or turned into a source.
 *
 * <p>Raised for structural failures during graph surgery (a node that is not
 * part of the graph, a merge across an edge that does not exist) and for
 * read specifications the storage backend cannot serve. A planning error
 * aborts planning for the whole query.
 */
public class PlanningException extends RuntimeException {

    /**
     * Creates a planning exception.
     *
     * @param message the error message
     */
    public PlanningException(String message) {
        super(message);
    }

    /**
     * Creates a planning exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
