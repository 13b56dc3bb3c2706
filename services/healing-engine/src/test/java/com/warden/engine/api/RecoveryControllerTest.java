package com.warden.engine.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.warden.engine.domain.health.HealthProber;
import com.warden.engine.domain.recovery.RecoveryEngine;
import com.warden.engine.domain.recovery.RecoveryResult;
import com.warden.engine.support.TestReports;
import com.warden.observability.HealthReport;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@DisplayName("RecoveryController")
class RecoveryControllerTest {

    private final HealthProber prober = mock(HealthProber.class);
    private final RecoveryEngine recovery = mock(RecoveryEngine.class);

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        when(prober.checkHealth()).thenReturn(TestReports.healthy());
        mockMvc = MockMvcBuilders.standaloneSetup(new RecoveryController(prober, recovery)).build();
    }

    @Test
    @DisplayName("returns the recovery result with the health it ran against")
    void returnsResult() throws Exception {
        when(recovery.handleSystemDegradation(any(HealthReport.class))).thenReturn(new RecoveryResult(true,
                List.of("Requeued 0 stuck jobs"), Map.of(RecoveryResult.STATUS, RecoveryResult.COMPLETED)));

        mockMvc.perform(post("/api/v1/recovery"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.health.status").value("HEALTHY"))
                .andExpect(jsonPath("$.recovery.success").value(true))
                .andExpect(jsonPath("$.recovery.actionsTaken[0]").value("Requeued 0 stuck jobs"));
    }

    @Test
    @DisplayName("answers 409 when a recovery is already running")
    void answersConflictOnSkip() throws Exception {
        when(recovery.handleSystemDegradation(any(HealthReport.class))).thenReturn(new RecoveryResult(false,
                List.of("Recovery already in progress"), Map.of(RecoveryResult.STATUS, RecoveryResult.SKIPPED)));

        mockMvc.perform(post("/api/v1/recovery"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.recovery.actionsTaken[0]").value("Recovery already in progress"));
    }
}
