package com.hemovita.service;

import com.hemovita.dto.response.NetworkGraphDto;
import com.hemovita.dto.response.NetworkGraphDto.LinkDto;
import com.hemovita.dto.response.NetworkGraphDto.NodeDto;
import com.hemovita.model.enums.NutrientCluster;
import com.hemovita.model.enums.NutrientType;
import com.hemovita.model.enums.RelationType;
import com.hemovita.model.network.GraphEdge;
import com.hemovita.model.network.InteractionGraph;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Builds the node/link view of the interaction network.
 * Every loaded row becomes a link; nodes carry degree-based importance and
 * the mean strength of their links.
 */
@Service
public class NetworkGraphService {

    private final InteractionGraph graph;

    public NetworkGraphService(InteractionGraph graph) {
        this.graph = graph;
    }

    public NetworkGraphDto buildGraph() {
        Map<String, NodeStats> stats = new LinkedHashMap<>();
        List<LinkDto> links = new ArrayList<>();

        for (GraphEdge edge : graph.edges()) {
            double strength = confidenceToStrength(edge.confidence());
            stats.computeIfAbsent(edge.source(), k -> new NodeStats()).add(strength);
            stats.computeIfAbsent(edge.target(), k -> new NodeStats()).add(strength);
            links.add(new LinkDto(
                edge.source(),
                edge.target(),
                RelationType.fromEffect(edge.effect()),
                strength,
                edge.confidence(),
                edge.notes()));
        }

        int maxDegree = Math.max(1, stats.values().stream().mapToInt(s -> s.degree).max().orElse(1));

        List<NodeDto> nodes = new ArrayList<>();
        stats.forEach((id, s) -> nodes.add(new NodeDto(
            id,
            id.replace('_', ' '),
            NutrientType.classify(id),
            NutrientCluster.of(id),
            (double) s.degree / maxDegree,
            id.contains("anemia") ? 1.0 : 0.5,
            s.meanConfidence())));

        return new NetworkGraphDto(nodes, links);
    }

    /**
     * Numeric strength for a confidence label such as "High" or "Moderate-High".
     */
    static double confidenceToStrength(String confidence) {
        String c = confidence == null ? "" : confidence.trim().toLowerCase(Locale.ROOT);
        boolean high = c.contains("high");
        boolean moderate = c.contains("moderate");
        boolean low = c.contains("low");
        if (high && moderate) return 0.75;
        if (high) return 0.9;
        if (moderate && low) return 0.45;
        if (moderate) return 0.6;
        if (low) return 0.3;
        return 0.5;
    }

    private static final class NodeStats {
        private int degree;
        private double confidenceSum;

        void add(double strength) {
            degree++;
            confidenceSum += strength;
        }

        double meanConfidence() {
            return degree == 0 ? 0.5 : confidenceSum / degree;
        }
    }
}
