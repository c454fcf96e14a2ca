package com.apex.decision.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class EngineControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void statusReportsAttachedCollaborators() throws Exception {
        mockMvc.perform(get("/api/engine/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.initialized").value(true))
                .andExpect(jsonPath("$.executionAttached").value(true))
                .andExpect(jsonPath("$.riskAuthority").value("drawdown"))
                .andExpect(jsonPath("$.cooldownMode").value("INERT"))
                .andExpect(jsonPath("$.signalProvider").value("DefaultSignalProvider"));
    }

    @Test
    void tickIsAcceptedAndCounted() throws Exception {
        mockMvc.perform(post("/api/engine/tick")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"EURUSD\",\"bid\":1.0850,\"ask\":1.0852}"))
                .andExpect(status().isAccepted());

        mockMvc.perform(get("/api/instruments/EURUSD/decision"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.symbol").value("EURUSD"));
    }

    @Test
    void tickWithoutSymbolIsRejected() throws Exception {
        mockMvc.perform(post("/api/engine/tick")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"bid\":1.0850,\"ask\":1.0852}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void switchesEchoTheirNewState() throws Exception {
        mockMvc.perform(post("/api/engine/debug")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"enabled\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.debug").value(true));
        mockMvc.perform(post("/api/engine/debug")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"enabled\":false}"))
                .andExpect(jsonPath("$.debug").value(false));

        mockMvc.perform(post("/api/engine/testing-mode")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void maintenanceEndpointsReturnNoContent() throws Exception {
        mockMvc.perform(post("/api/engine/cache/invalidate"))
                .andExpect(status().isNoContent());
        mockMvc.perform(post("/api/engine/trade-transaction")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"EURUSD\",\"ticket\":1,\"type\":\"DEAL_ADD\",\"profit\":0}"))
                .andExpect(status().isAccepted());
        mockMvc.perform(get("/api/engine/trades").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
        mockMvc.perform(get("/api/engine/stats/daily"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trades").isNumber());
    }
}
