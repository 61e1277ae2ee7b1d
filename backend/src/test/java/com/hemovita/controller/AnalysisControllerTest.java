package com.hemovita.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "hemovita.risk.training-steps=2000")
@AutoConfigureMockMvc
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("should classify a raw panel")
    void classify() throws Exception {
        mockMvc.perform(post("/api/analysis/classify")
                .with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"labs\": {\"Hemoglobin\": 13.1, \"MCV\": 104, \"selenium\": 1.2}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.Hemoglobin").value("normal"))
            .andExpect(jsonPath("$.MCV").value("high"))
            .andExpect(jsonPath("$.selenium").value("unknown"));
    }

    @Test
    @DisplayName("should schedule from labels and keep antagonists apart")
    void schedule() throws Exception {
        mockMvc.perform(post("/api/analysis/schedule")
                .with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"labels\": {\"ferritin\": \"low\", \"calcium\": \"low\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.supplementPlan.morning", hasItem("iron")))
            .andExpect(jsonPath("$.supplementPlan.midday", hasItem("calcium")))
            .andExpect(jsonPath("$.forcedPlacements").isEmpty());
    }

    @Test
    @DisplayName("should explain low markers through the network")
    void explain() throws Exception {
        mockMvc.perform(post("/api/analysis/explain")
                .with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"labels\": {\"Hemoglobin\": \"low\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.Hemoglobin", hasItem("iron —boosts→ Hemoglobin")));
    }

    @Test
    @DisplayName("should reject a hop limit below one")
    void invalidHops() throws Exception {
        mockMvc.perform(post("/api/analysis/explain")
                .with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"labels\": {\"Hemoglobin\": \"low\"}, \"maxHops\": 0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("maxHops must be at least 1"));
    }

    @Test
    @DisplayName("should reject a hop limit above four")
    void hopsTooDeep() throws Exception {
        mockMvc.perform(post("/api/analysis/explain")
                .with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"labels\": {\"Hemoglobin\": \"low\"}, \"maxHops\": 5}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("should serve the network graph view")
    void networkGraph() throws Exception {
        mockMvc.perform(get("/api/network/graph"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.nodes").isNotEmpty())
            .andExpect(jsonPath("$.links[0].relation").value("booster"));
    }
}
