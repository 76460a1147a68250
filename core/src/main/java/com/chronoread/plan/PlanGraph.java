package com.chronoread.plan;

import com.chronoread.exception.PlanningException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Directed acyclic graph of plan nodes keyed by stable ids.
 *
 * <p>Rewrite rules never edit edges themselves. They compute a new spec and
 * ask the graph for one of three operations:
 * <ul>
 *   <li>{@link #replaceSpec(PlanNode, ProcedureSpec)} - swap a node's spec, keeping its kind</li>
 *   <li>{@link #replaceNode(PlanNode, ProcedureSpec)} - swap a node for one of a different kind under the same id</li>
 *   <li>{@link #mergeToPhysicalNode(PlanNode, PlanNode, ProcedureSpec)} - collapse a node and its
 *       sole predecessor into one node</li>
 * </ul>
 *
 * <p>Example:
 * <pre>
 *   PlanGraph graph = new PlanGraph();
 *   PlanNode from = graph.add("from0", new FromSpec("telegraf", ""));
 *   PlanNode range = graph.add("range1", new RangeSpec(bounds), from);
 *   PlanNode filter = graph.add("filter2", new FilterSpec(fn), range);
 * </pre>
 *
 * <p>Not thread-safe; a graph belongs to the planner that is rewriting it.
 */
public final class PlanGraph {

    private final Map<NodeId, PlanNode> nodes = new LinkedHashMap<>();

    /**
     * Adds a node fed by the given predecessors.
     *
     * @param id the node id, unique within the graph
     * @param spec the node's spec
     * @param predecessors nodes already in the graph that feed the new node
     * @return the new node
     * @throws PlanningException if the id is taken or a predecessor is not in the graph
     */
    public PlanNode add(NodeId id, ProcedureSpec spec, PlanNode... predecessors) {
        Objects.requireNonNull(id, "id must not be null");
        if (nodes.containsKey(id)) {
            throw new PlanningException("duplicate plan node id " + id);
        }
        PlanNode node = new PlanNode(id, spec);
        for (PlanNode pred : predecessors) {
            requireMember(pred);
            node.mutablePredecessors().add(pred);
            pred.mutableSuccessors().add(node);
        }
        nodes.put(id, node);
        return node;
    }

    /**
     * Adds a node fed by the given predecessors.
     *
     * @param id the node id, unique within the graph
     * @param spec the node's spec
     * @param predecessors nodes already in the graph that feed the new node
     * @return the new node
     */
    public PlanNode add(String id, ProcedureSpec spec, PlanNode... predecessors) {
        return add(NodeId.of(id), spec, predecessors);
    }

    /**
     * Looks up a node by id.
     *
     * @param id the id
     * @return the node, or empty if no node has this id
     */
    public Optional<PlanNode> node(NodeId id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * Returns whether the given node object is currently part of this graph.
     *
     * @param node the node
     * @return true if the graph holds exactly this node under its id
     */
    public boolean contains(PlanNode node) {
        return node != null && nodes.get(node.id()) == node;
    }

    /**
     * Returns all nodes, in insertion order.
     *
     * @return an unmodifiable snapshot of the nodes
     */
    public List<PlanNode> nodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes.values()));
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Returns the nodes whose output nobody consumes.
     *
     * @return the result nodes
     */
    public List<PlanNode> roots() {
        List<PlanNode> roots = new ArrayList<>();
        for (PlanNode node : nodes.values()) {
            if (node.successors().isEmpty()) {
                roots.add(node);
            }
        }
        return roots;
    }

    /**
     * Returns all nodes ordered so that every node comes after its predecessors.
     *
     * @return the nodes in data-flow order
     */
    public List<PlanNode> topologicalOrder() {
        List<PlanNode> order = new ArrayList<>(nodes.size());
        Set<NodeId> visited = new HashSet<>();
        for (PlanNode node : nodes.values()) {
            visit(node, visited, order);
        }
        return order;
    }

    private static void visit(PlanNode node, Set<NodeId> visited, List<PlanNode> order) {
        if (!visited.add(node.id())) {
            return;
        }
        for (PlanNode pred : node.predecessors()) {
            visit(pred, visited, order);
        }
        order.add(node);
    }

    /**
     * Replaces a node's spec with another spec of the same kind.
     *
     * @param node the node
     * @param spec the new spec
     * @throws PlanningException if the node is not in the graph or the kinds differ
     */
    public void replaceSpec(PlanNode node, ProcedureSpec spec) {
        requireMember(node);
        Objects.requireNonNull(spec, "spec must not be null");
        if (spec.kind() != node.kind()) {
            throw new PlanningException(String.format(
                "cannot replace spec of %s: kind %s does not match %s",
                node.id(), spec.kind().label(), node.kind().label()));
        }
        node.setSpec(spec);
    }

    /**
     * Replaces a node by a new node with the same id and edges but a new spec,
     * which may be of a different kind.
     *
     * @param node the node to replace
     * @param spec the spec of the replacement
     * @return the replacement node
     * @throws PlanningException if the node is not in the graph
     */
    public PlanNode replaceNode(PlanNode node, ProcedureSpec spec) {
        requireMember(node);
        PlanNode replacement = new PlanNode(node.id(), spec);
        for (PlanNode pred : node.predecessors()) {
            replacement.mutablePredecessors().add(pred);
            rebind(pred.mutableSuccessors(), node, replacement);
        }
        for (PlanNode succ : node.successors()) {
            replacement.mutableSuccessors().add(succ);
            rebind(succ.mutablePredecessors(), node, replacement);
        }
        nodes.put(node.id(), replacement);
        return replacement;
    }

    /**
     * Collapses {@code top} and its only predecessor {@code bottom} into a single
     * node carrying {@code spec}.
     *
     * <p>The merged node takes over the predecessors of {@code bottom} and the
     * successors of {@code top}; both originals leave the graph.
     *
     * @param top the downstream node
     * @param bottom the upstream node, which must feed only {@code top}
     * @param spec the spec of the merged node
     * @return the merged node
     * @throws PlanningException if the two nodes are not linked by a private edge
     */
    public PlanNode mergeToPhysicalNode(PlanNode top, PlanNode bottom, ProcedureSpec spec) {
        requireMember(top);
        requireMember(bottom);
        Objects.requireNonNull(spec, "spec must not be null");
        if (top.predecessors().size() != 1 || top.predecessors().get(0) != bottom
                || bottom.successors().size() != 1) {
            throw new PlanningException(String.format(
                "cannot merge %s and %s due to topological issues", top.id(), bottom.id()));
        }

        NodeId mergedId = NodeId.merged(bottom.id(), top.id());
        if (nodes.containsKey(mergedId)) {
            throw new PlanningException("duplicate plan node id " + mergedId);
        }
        PlanNode merged = new PlanNode(mergedId, spec);
        for (PlanNode pred : bottom.predecessors()) {
            merged.mutablePredecessors().add(pred);
            rebind(pred.mutableSuccessors(), bottom, merged);
        }
        for (PlanNode succ : top.successors()) {
            merged.mutableSuccessors().add(succ);
            rebind(succ.mutablePredecessors(), top, merged);
        }

        nodes.remove(top.id());
        nodes.remove(bottom.id());
        nodes.put(mergedId, merged);
        return merged;
    }

    private static void rebind(List<PlanNode> edges, PlanNode from, PlanNode to) {
        for (int i = 0; i < edges.size(); i++) {
            if (edges.get(i) == from) {
                edges.set(i, to);
            }
        }
    }

    private void requireMember(PlanNode node) {
        Objects.requireNonNull(node, "node must not be null");
        if (!contains(node)) {
            throw new PlanningException("plan node " + node.id() + " is not part of this graph");
        }
    }

    @Override
    public String toString() {
        return "PlanGraph" + topologicalOrder();
    }
}
