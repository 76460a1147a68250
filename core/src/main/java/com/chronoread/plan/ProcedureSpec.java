package com.chronoread.plan;

/**
 * Specification of the operation carried by a plan node.
 *
 * <p>Specs held by a plan graph are never modified in place by rules. A rule
 * that needs a different spec calls {@link #copy()}, changes the copy, and
 * hands it to the graph, which swaps it in.
 */
public interface ProcedureSpec {

    /**
     * Returns the kind tag of this spec.
     *
     * @return the kind
     */
    ProcedureKind kind();

    /**
     * Returns a deep copy of this spec that shares no mutable state with it.
     *
     * @return the copy
     */
    ProcedureSpec copy();

    /**
     * Checks that this spec can be executed once physical planning is over.
     *
     * @param id the id of the node carrying this spec
     * @throws com.chronoread.exception.ValidationException if the spec cannot be executed
     */
    default void postPhysicalValidate(NodeId id) {
    }
}
