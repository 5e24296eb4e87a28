package com.vortex.firewall.controller;

import com.vortex.firewall.model.Severity;
import com.vortex.firewall.service.AlertService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.vortex.firewall.testutil.TestDataFactory.createAlert;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AlertController.class)
class AlertControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AlertService alertService;

    @Test
    void getRecentAlerts_defaultLimit() throws Exception {
        when(alertService.getRecentAlerts(50)).thenReturn(List.of(
                createAlert("A-2", "C-1", Severity.HIGH, 2000L),
                createAlert("A-1", "C-2", Severity.MEDIUM, 1000L)));

        mockMvc.perform(get("/api/v1/alerts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].alertId").value("A-2"))
                .andExpect(jsonPath("$[0].severity").value("HIGH"))
                .andExpect(jsonPath("$[0].alertType").value("SPENDING_SPIKE"))
                .andExpect(jsonPath("$[1].resourceId").value("C-2"));
    }

    @Test
    void getRecentAlerts_customLimit() throws Exception {
        when(alertService.getRecentAlerts(5)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/alerts").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        verify(alertService).getRecentAlerts(5);
    }

    @Test
    void getRecentAlerts_limitOutOfRange_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/alerts").param("limit", "0"))
                .andExpect(status().isBadRequest());

        verify(alertService, never()).getRecentAlerts(anyInt());
    }

    @Test
    void getCampaignAlerts_success() throws Exception {
        when(alertService.getAlertsForCampaign("C-1", 50)).thenReturn(List.of(
                createAlert("A-1", "C-1", Severity.HIGH, 1000L)));

        mockMvc.perform(get("/api/v1/alerts/campaign/C-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].resourceId").value("C-1"))
                .andExpect(jsonPath("$[0].action").value("ALERT"));
    }

    @Test
    void getCampaignAlerts_limitTooLarge_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/alerts/campaign/C-1").param("limit", "501"))
                .andExpect(status().isBadRequest());
    }
}
