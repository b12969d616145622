package com.hegel.fusion.core;

import java.util.*;

/**
 * Node and edge container for one fusion call. Nodes keep insertion order. Edges may reference ids
 * that are not (or no longer) nodes; every consumer skips such edges.
 */
public final class EvidenceGraph {

    private final Map<String, EvidenceNode> nodes = new LinkedHashMap<>();
    private final List<EvidenceEdge> edges = new ArrayList<>();

    /**
     * Inserts a node for {@code evidence} with neutral prior and posterior. Re-adding an id replaces
     * the earlier node.
     */
    public EvidenceNode addEvidence(FuzzyEvidence evidence) {
        EvidenceNode node = EvidenceNode.of(evidence);
        nodes.put(node.getId(), node);
        return node;
    }

    public EvidenceNode addNode(EvidenceNode node) {
        nodes.put(node.getId(), node);
        return node;
    }

    public void addEdge(EvidenceEdge edge) {
        edges.add(Objects.requireNonNull(edge, "edge"));
    }

    public Optional<EvidenceNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    /**
     * Nodes connected to {@code id} by an edge in either direction, in edge order. A neighbour
     * reached through several edges is listed once per edge.
     */
    public List<EvidenceNode> neighbours(String id) {
        List<EvidenceNode> out = new ArrayList<>();
        for (EvidenceEdge e : edges) {
            if (!e.touches(id)) continue;
            EvidenceNode other = nodes.get(e.otherEnd(id));
            if (other != null) out.add(other);
        }
        return out;
    }

    /**
     * Edges whose endpoints are both present.
     */
    public List<EvidenceEdge> resolvedEdges() {
        List<EvidenceEdge> out = new ArrayList<>();
        for (EvidenceEdge e : edges) {
            if (nodes.containsKey(e.fromNode()) && nodes.containsKey(e.toNode())) {
                out.add(e);
            }
        }
        return out;
    }

    public List<FuzzyEvidence> fuzzyEvidence() {
        List<FuzzyEvidence> out = new ArrayList<>();
        for (EvidenceNode n : nodes.values()) {
            n.fuzzyEvidence().ifPresent(out::add);
        }
        return out;
    }

    public long countEdges(EvidenceRelationship relationship) {
        return edges.stream().filter(e -> e.relationship() == relationship).count();
    }

    public Collection<EvidenceNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<EvidenceEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
