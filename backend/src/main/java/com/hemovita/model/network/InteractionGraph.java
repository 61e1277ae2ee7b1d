package com.hemovita.model.network;

import java.util.*;

/**
 * Directed nutrient interaction graph backed by adjacency lists.
 *
 * Holds at most one edge per (source, target) pair; a later row for the same
 * pair replaces the earlier attributes. Node and successor iteration follow
 * first-seen order. Immutable once built.
 */
public final class InteractionGraph {

    private static final InteractionGraph EMPTY = new InteractionGraph(Map.of(), List.of());

    private final Map<String, Map<String, GraphEdge>> adjacency;
    private final List<GraphEdge> edges;

    private InteractionGraph(Map<String, Map<String, GraphEdge>> adjacency, List<GraphEdge> edges) {
        this.adjacency = adjacency;
        this.edges = edges;
    }

    public static InteractionGraph empty() {
        return EMPTY;
    }

    public static InteractionGraph fromEdges(List<GraphEdge> edges) {
        Map<String, Map<String, GraphEdge>> adjacency = new LinkedHashMap<>();
        for (GraphEdge edge : edges) {
            adjacency.computeIfAbsent(edge.source(), k -> new LinkedHashMap<>()).put(edge.target(), edge);
            adjacency.computeIfAbsent(edge.target(), k -> new LinkedHashMap<>());
        }
        Map<String, Map<String, GraphEdge>> frozen = new LinkedHashMap<>();
        adjacency.forEach((node, out) -> frozen.put(node, Collections.unmodifiableMap(out)));
        return new InteractionGraph(Collections.unmodifiableMap(frozen), List.copyOf(edges));
    }

    public boolean isEmpty() {
        return adjacency.isEmpty();
    }

    public boolean hasNode(String node) {
        return adjacency.containsKey(node);
    }

    public Set<String> nodes() {
        return adjacency.keySet();
    }

    public Collection<GraphEdge> outgoing(String node) {
        return adjacency.getOrDefault(node, Map.of()).values();
    }

    /**
     * Edge rows as loaded, in file order, duplicates included.
     */
    public List<GraphEdge> edges() {
        return edges;
    }
}
