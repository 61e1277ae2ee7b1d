package com.hemovita.config;

import com.hemovita.model.network.GraphEdge;
import com.hemovita.model.network.InteractionGraph;
import com.hemovita.model.network.InteractionRules;
import com.hemovita.model.reference.AliasTable;
import com.hemovita.model.reference.FoodCatalog;
import com.hemovita.model.reference.NutrientLabels;
import com.hemovita.model.reference.ReferenceStore;
import com.hemovita.repository.ReferenceDataRepository;
import com.hemovita.service.RuleDeriver;
import com.hemovita.service.risk.ContextEncoder;
import com.hemovita.service.risk.LinUcbRiskModel;
import com.hemovita.service.risk.RiskTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the read-only engine state once, while the context starts.
 *
 * Every bean here is immutable after construction. A failure to load a
 * required table propagates and stops the application from starting.
 */
@Configuration
@Slf4j
public class EngineConfig {

    @Bean
    public ReferenceStore referenceStore(ReferenceDataRepository repository) {
        return ReferenceStore.build(
            repository.loadMarkerSpecs(),
            repository.loadCutoffs(),
            repository.loadTierRoles());
    }

    @Bean
    public AliasTable aliasTable(ReferenceDataRepository repository) {
        return new AliasTable(repository.loadAliases());
    }

    @Bean
    public NutrientLabels nutrientLabels(ReferenceDataRepository repository) {
        return new NutrientLabels(repository.loadLabels());
    }

    @Bean
    public FoodCatalog foodCatalog(ReferenceDataRepository repository) {
        return new FoodCatalog(repository.loadFoods());
    }

    @Bean
    public InteractionGraph interactionGraph(ReferenceDataRepository repository) {
        List<GraphEdge> edges = repository.loadRelationships();
        if (edges.isEmpty()) {
            log.warn("Nutrient interaction network is empty; explanations and timing rules are disabled");
            return InteractionGraph.empty();
        }
        InteractionGraph graph = InteractionGraph.fromEdges(edges);
        log.info("Interaction graph built: {} nodes, {} edges", graph.nodes().size(), edges.size());
        return graph;
    }

    @Bean
    public InteractionRules interactionRules(RuleDeriver ruleDeriver, InteractionGraph graph) {
        InteractionRules rules = ruleDeriver.derive(graph.edges());
        log.info("Derived {} booster bundles and {} antagonist entries",
            rules.boosters().size(), rules.antagonists().size());
        return rules;
    }

    @Bean
    public RiskTable riskTable(ReferenceDataRepository repository) {
        RiskTable table = RiskTable.of(repository.loadRiskObservations());
        log.info("Risk environment: {} contexts, {} micronutrient actions",
            table.contexts().size(), table.actions().size());
        return table;
    }

    @Bean
    public LinUcbRiskModel riskModel(RiskTable riskTable, HemoVitaProperties properties) {
        HemoVitaProperties.Risk settings = properties.getRisk();
        LinUcbRiskModel initial = LinUcbRiskModel.initial(
            ContextEncoder.fit(riskTable.contexts()),
            riskTable.actions(),
            settings.getAlpha());
        return initial.train(riskTable, settings.getTrainingSteps(), settings.getSeed());
    }
}
