package com.warden.engine.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.warden.engine.domain.alert.Alert;
import com.warden.engine.domain.alert.AlertCategory;
import com.warden.engine.domain.alert.AlertService;
import com.warden.engine.domain.alert.AlertSeverity;
import com.warden.engine.domain.alert.AlertStatus;
import com.warden.engine.infrastructure.web.GlobalExceptionHandler;
import com.warden.engine.support.InMemoryAlertStore;
import com.warden.engine.support.InMemoryErrorLogStore;
import com.warden.engine.support.MutableClock;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@DisplayName("AlertController")
class AlertControllerTest {

    private final MutableClock clock = new MutableClock();
    private final InMemoryAlertStore store = new InMemoryAlertStore();
    private final AlertService alerts = new AlertService(store, "warden-test", clock);

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AlertController(alerts))
                .setControllerAdvice(new GlobalExceptionHandler(new InMemoryErrorLogStore(), clock))
                .build();
    }

    private Alert raise(AlertSeverity severity, String title) {
        Alert alert = alerts.raise(severity, AlertCategory.SYSTEM, null, title, title, Map.of());
        clock.advance(Duration.ofSeconds(1));
        return alert;
    }

    @Test
    @DisplayName("lists alerts newest first with the active total")
    void listsAlerts() throws Exception {
        raise(AlertSeverity.WARNING, "first");
        raise(AlertSeverity.CRITICAL, "second");

        mockMvc.perform(get("/api/v1/alerts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalActive").value(2))
                .andExpect(jsonPath("$.alerts[0].title").value("second"))
                .andExpect(jsonPath("$.alerts[1].title").value("first"));
    }

    @Test
    @DisplayName("filters by case-insensitive severity")
    void filtersBySeverity() throws Exception {
        raise(AlertSeverity.WARNING, "first");
        raise(AlertSeverity.CRITICAL, "second");

        mockMvc.perform(get("/api/v1/alerts").param("severity", "critical"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alerts.length()").value(1))
                .andExpect(jsonPath("$.alerts[0].severity").value("CRITICAL"));
    }

    @Test
    @DisplayName("rejects an unknown status with 400")
    void rejectsUnknownStatus() throws Exception {
        mockMvc.perform(get("/api/v1/alerts").param("status", "sleeping"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("resolves an alert")
    void resolvesAlert() throws Exception {
        Alert alert = raise(AlertSeverity.ERROR, "disk");

        mockMvc.perform(put("/api/v1/alerts/{id}/resolve", alert.id())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolvedBy\":\"ops\",\"resolutionMessage\":\"freed space\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RESOLVED"))
                .andExpect(jsonPath("$.resolvedBy").value("ops"));

        assertThat(store.findById(alert.id()).orElseThrow().status()).isEqualTo(AlertStatus.RESOLVED);
    }

    @Test
    @DisplayName("answers 404 for an unknown alert")
    void answersNotFound() throws Exception {
        mockMvc.perform(put("/api/v1/alerts/{id}/resolve", "missing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolvedBy\":\"ops\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Alert not found: missing"));
    }

    @Test
    @DisplayName("requires the resolver name")
    void requiresResolver() throws Exception {
        Alert alert = raise(AlertSeverity.ERROR, "disk");

        mockMvc.perform(put("/api/v1/alerts/{id}/resolve", alert.id())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolvedBy\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Error"));
    }
}
