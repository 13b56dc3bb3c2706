package com.warden.engine.domain.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.warden.engine.support.InMemoryAlertStore;
import com.warden.engine.support.MutableClock;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AlertService")
class AlertServiceTest {

    private final MutableClock clock = new MutableClock();

    private InMemoryAlertStore store;
    private AlertService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryAlertStore();
        service = new AlertService(store, "warden-engine", clock);
    }

    private Alert raise(AlertSeverity severity, String title) {
        Alert alert = service.raise(severity, AlertCategory.SYSTEM, "database", title, title + " message", Map.of());
        clock.advance(Duration.ofSeconds(1));
        return alert;
    }

    @Nested
    @DisplayName("Raising")
    class Raising {

        @Test
        @DisplayName("should store an active alert stamped with the source and clock")
        void shouldStoreActiveAlert() {
            Alert alert = service.raise(AlertSeverity.WARNING, AlertCategory.QUEUE, "email", "Queue backlog",
                    "Queue email has 1500 waiting jobs", Map.of("waiting", 1500L));

            assertThat(alert.id()).isNotBlank();
            assertThat(alert.status()).isEqualTo(AlertStatus.ACTIVE);
            assertThat(alert.source()).isEqualTo("warden-engine");
            assertThat(alert.timestamp()).isEqualTo(MutableClock.START);
            assertThat(alert.details()).containsEntry("waiting", 1500L);
            assertThat(store.findById(alert.id())).contains(alert);
        }
    }

    @Nested
    @DisplayName("Listing")
    class Listing {

        @Test
        @DisplayName("should return newest first with the total active count")
        void shouldListNewestFirst() {
            raise(AlertSeverity.INFO, "first");
            raise(AlertSeverity.ERROR, "second");
            Alert resolved = raise(AlertSeverity.WARNING, "third");
            service.resolve(resolved.id(), "ops", "done");

            AlertPage page = service.getAlerts(AlertFilter.all());

            assertThat(page.totalActive()).isEqualTo(2);
            assertThat(page.alerts()).extracting(Alert::title).containsExactly("third", "second", "first");
        }

        @Test
        @DisplayName("should filter by status and severity")
        void shouldFilter() {
            raise(AlertSeverity.INFO, "info");
            raise(AlertSeverity.ERROR, "error");

            AlertPage page = service.getAlerts(new AlertFilter(AlertStatus.ACTIVE, AlertSeverity.ERROR, 0));

            assertThat(page.alerts()).extracting(Alert::title).containsExactly("error");
        }

        @Test
        @DisplayName("should count active alerts for every severity")
        void shouldCountEverySeverity() {
            raise(AlertSeverity.CRITICAL, "a");
            raise(AlertSeverity.CRITICAL, "b");

            Map<AlertSeverity, Long> counts = service.activeCounts();

            assertThat(counts).containsOnlyKeys(AlertSeverity.values());
            assertThat(counts).containsEntry(AlertSeverity.CRITICAL, 2L).containsEntry(AlertSeverity.INFO, 0L);
        }
    }

    @Nested
    @DisplayName("Resolving")
    class Resolving {

        @Test
        @DisplayName("should record who resolved the alert and when")
        void shouldResolve() {
            Alert alert = raise(AlertSeverity.ERROR, "disk full");

            Alert resolved = service.resolve(alert.id(), "alice", "Expanded the volume");

            assertThat(resolved.status()).isEqualTo(AlertStatus.RESOLVED);
            assertThat(resolved.resolvedBy()).isEqualTo("alice");
            assertThat(resolved.resolutionMessage()).isEqualTo("Expanded the volume");
            assertThat(resolved.resolvedAt()).isEqualTo(clock.instant());
            assertThat(store.findById(alert.id())).contains(resolved);
        }

        @Test
        @DisplayName("should return an already resolved alert unchanged")
        void shouldBeIdempotent() {
            Alert alert = raise(AlertSeverity.ERROR, "disk full");
            Alert first = service.resolve(alert.id(), "alice", "fixed");
            clock.advance(Duration.ofMinutes(5));

            Alert second = service.resolve(alert.id(), "bob", "fixed again");

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("should throw for an unknown alert id")
        void shouldRejectUnknownId() {
            assertThatThrownBy(() -> service.resolve("missing", "alice", null))
                    .isInstanceOf(AlertNotFoundException.class)
                    .hasMessage("Alert not found: missing");
        }
    }
}
