package com.chronoread.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node in a plan graph: one operation plus its data-flow edges.
 *
 * <p>Predecessors produce the node's input; successors consume its output.
 * Edges and the spec are changed only through {@link PlanGraph}, which keeps
 * both directions of every edge consistent.
 */
public final class PlanNode {

    private final NodeId id;
    private ProcedureSpec spec;
    private final List<PlanNode> predecessors = new ArrayList<>();
    private final List<PlanNode> successors = new ArrayList<>();

    PlanNode(NodeId id, ProcedureSpec spec) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.spec = Objects.requireNonNull(spec, "spec must not be null");
    }

    public NodeId id() {
        return id;
    }

    public ProcedureSpec spec() {
        return spec;
    }

    /**
     * Returns the kind tag of this node's spec.
     *
     * @return the kind
     */
    public ProcedureKind kind() {
        return spec.kind();
    }

    /**
     * Returns the nodes feeding this node.
     *
     * @return an unmodifiable list of predecessors
     */
    public List<PlanNode> predecessors() {
        return Collections.unmodifiableList(predecessors);
    }

    /**
     * Returns the nodes consuming this node's output.
     *
     * @return an unmodifiable list of successors
     */
    public List<PlanNode> successors() {
        return Collections.unmodifiableList(successors);
    }

    void setSpec(ProcedureSpec spec) {
        this.spec = spec;
    }

    List<PlanNode> mutablePredecessors() {
        return predecessors;
    }

    List<PlanNode> mutableSuccessors() {
        return successors;
    }

    @Override
    public String toString() {
        return id + ":" + spec;
    }
}
