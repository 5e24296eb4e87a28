package com.vortex.firewall.controller;

import com.vortex.firewall.model.ScanSummary;
import com.vortex.firewall.service.FirewallScanService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ScanController.class)
class ScanControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FirewallScanService scanService;

    private static ScanSummary summary() {
        return ScanSummary.builder()
                .scanId("scan-1")
                .startedAt(1000L)
                .finishedAt(2000L)
                .campaignsListed(3)
                .campaignsScanned(2)
                .campaignsFailed(1)
                .findings(2)
                .pausesRequested(1)
                .pausesSucceeded(1)
                .build();
    }

    @Test
    void getLastScan_beforeFirstScan_returns404() throws Exception {
        when(scanService.getLastSummary()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/scans/last"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getLastScan_success() throws Exception {
        when(scanService.getLastSummary()).thenReturn(Optional.of(summary()));

        mockMvc.perform(get("/api/v1/scans/last"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scanId").value("scan-1"))
                .andExpect(jsonPath("$.campaignsFailed").value(1))
                .andExpect(jsonPath("$.aborted").value(false));
    }

    @Test
    void runScan_success() throws Exception {
        when(scanService.runScan()).thenReturn(Optional.of(summary()));

        mockMvc.perform(post("/api/v1/scans/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.findings").value(2))
                .andExpect(jsonPath("$.pausesSucceeded").value(1));
    }

    @Test
    void runScan_alreadyRunning_returns409() throws Exception {
        when(scanService.runScan()).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/scans/run"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").exists());
    }
}
