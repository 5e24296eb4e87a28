package com.vortex.firewall.controller;

import com.vortex.firewall.model.MetricType;
import com.vortex.firewall.service.BaselineService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.vortex.firewall.testutil.TestDataFactory.createBaseline;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(BaselineController.class)
class BaselineControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BaselineService baselineService;

    @Test
    void getBaselines_success() throws Exception {
        when(baselineService.getBaselines("C-1")).thenReturn(List.of(
                createBaseline(MetricType.DAILY_SPEND, "C-1", 100.0, 3),
                createBaseline(MetricType.CTR, "C-1", 0.02, 3)));

        mockMvc.perform(get("/api/v1/baselines/C-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].metricType").value("DAILY_SPEND"))
                .andExpect(jsonPath("$[0].value").value(100.0))
                .andExpect(jsonPath("$[1].sampleCount").value(3));
    }

    @Test
    void getBaselines_unknownCampaign_returns404() throws Exception {
        when(baselineService.getBaselines("C-NONE")).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/baselines/C-NONE"))
                .andExpect(status().isNotFound());
    }
}
