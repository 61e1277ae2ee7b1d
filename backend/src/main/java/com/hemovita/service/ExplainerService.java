package com.hemovita.service;

import com.hemovita.config.HemoVitaProperties;
import com.hemovita.model.enums.LabLabel;
import com.hemovita.model.network.GraphEdge;
import com.hemovita.model.network.InteractionGraph;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Explains low markers through causal chains in the interaction network.
 *
 * For every marker labelled low that is a node of the graph, all simple
 * paths of at most maxHops edges from any other node to it are rendered as
 * "a —effect→ b —effect→ c". Per target the strings are deduplicated and
 * sorted; targets without any path are left out.
 */
@Service
public class ExplainerService {

    private final InteractionGraph graph;
    private final int defaultMaxHops;

    public ExplainerService(InteractionGraph graph, HemoVitaProperties properties) {
        this.graph = graph;
        this.defaultMaxHops = properties.getExplainer().getMaxHops();
    }

    public Map<String, List<String>> explain(Map<String, LabLabel> labels) {
        return explain(labels, defaultMaxHops);
    }

    public Map<String, List<String>> explain(Map<String, LabLabel> labels, int maxHops) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        if (graph.isEmpty() || labels == null || maxHops < 1) {
            return out;
        }

        for (Map.Entry<String, LabLabel> entry : labels.entrySet()) {
            String target = entry.getKey();
            if (entry.getValue() != LabLabel.LOW || !graph.hasNode(target)) {
                continue;
            }

            SortedSet<String> rendered = new TreeSet<>();
            for (String source : graph.nodes()) {
                if (source.equals(target)) {
                    continue;
                }
                Deque<GraphEdge> path = new ArrayDeque<>();
                Set<String> visited = new HashSet<>();
                visited.add(source);
                collectPaths(source, target, maxHops, path, visited, rendered);
            }

            if (!rendered.isEmpty()) {
                out.put(target, List.copyOf(rendered));
            }
        }
        return out;
    }

    private void collectPaths(String node,
                              String target,
                              int hopsLeft,
                              Deque<GraphEdge> path,
                              Set<String> visited,
                              SortedSet<String> rendered) {
        if (hopsLeft == 0) {
            return;
        }
        for (GraphEdge edge : graph.outgoing(node)) {
            String next = edge.target();
            if (visited.contains(next)) {
                continue;
            }
            path.addLast(edge);
            if (next.equals(target)) {
                rendered.add(render(path));
            } else {
                visited.add(next);
                collectPaths(next, target, hopsLeft - 1, path, visited, rendered);
                visited.remove(next);
            }
            path.removeLast();
        }
    }

    static String render(Collection<GraphEdge> path) {
        StringBuilder sb = new StringBuilder();
        for (GraphEdge edge : path) {
            if (sb.length() == 0) {
                sb.append(edge.source());
            }
            sb.append(" —").append(edge.effect()).append("→ ").append(edge.target());
        }
        return sb.toString();
    }
}
