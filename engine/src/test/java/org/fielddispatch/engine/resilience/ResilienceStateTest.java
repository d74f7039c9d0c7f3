package org.fielddispatch.engine.resilience;

import org.fielddispatch.engine.domain.model.ServiceMode;
import org.fielddispatch.engine.exception.InvalidConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ResilienceState")
class ResilienceStateTest {

    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");

    private ResilienceState state;

    @BeforeEach
    void setUp() {
        state = ResilienceState.withDefaults(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("All breakers start closed in full mode")
    void startsClosed() {
        assertThat(state.openDependencies()).isEmpty();
        assertThat(state.currentMode()).isEqualTo(ServiceMode.FULL);
        assertThat(state.snapshotAll()).hasSize(Dependency.values().length);
        assertThat(state.snapshot(Dependency.TICKET_DATA).getStatus()).isEqualTo(BreakerStatus.CLOSED);
        assertThat(state.settings(Dependency.TICKET_DATA).getFailureThreshold())
                .isEqualTo(BreakerSettings.DEFAULT_FAILURE_THRESHOLD);
    }

    @Test
    @DisplayName("Mode follows which breakers are open")
    void derivesModeFromOpenBreakers() {
        state.forceOpen(Dependency.NOTIFICATION);
        assertThat(state.derivedMode()).isEqualTo(ServiceMode.FULL);

        state.forceOpen(Dependency.PERMISSION_CHECK);
        assertThat(state.derivedMode()).isEqualTo(ServiceMode.DEGRADED);

        state.reset(Dependency.PERMISSION_CHECK);
        state.forceOpen(Dependency.TICKET_DATA);
        assertThat(state.derivedMode()).isEqualTo(ServiceMode.DEGRADED);

        state.forceOpen(Dependency.EXECUTOR_ROSTER);
        assertThat(state.derivedMode()).isEqualTo(ServiceMode.MINIMAL);

        state.forceOpen(Dependency.PERMISSION_CHECK);
        assertThat(state.derivedMode()).isEqualTo(ServiceMode.EMERGENCY);
        assertThat(state.openDependencies()).hasSize(4);

        state.resetAll();
        assertThat(state.derivedMode()).isEqualTo(ServiceMode.FULL);
    }

    @Test
    @DisplayName("Operator override wins until cleared")
    void overrideWinsOverDerivedMode() {
        state.forceOpen(Dependency.TICKET_DATA);
        state.setOverride(ServiceMode.EMERGENCY, "storm drill");

        assertThat(state.currentMode()).isEqualTo(ServiceMode.EMERGENCY);
        assertThat(state.getOverrideReason()).contains("storm drill");

        state.clearOverride();

        assertThat(state.currentMode()).isEqualTo(ServiceMode.DEGRADED);
        assertThat(state.getOverride()).isEmpty();
        assertThat(state.getOverrideReason()).isEmpty();
    }

    @Test
    @DisplayName("Round-robin cursor cycles over the given size")
    void cursorCycles() {
        assertThat(state.next(3)).isEqualTo(0);
        assertThat(state.next(3)).isEqualTo(1);
        assertThat(state.next(3)).isEqualTo(2);
        assertThat(state.next(3)).isEqualTo(0);
        assertThatThrownBy(() -> state.next(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Per-dependency settings are applied")
    void appliesCustomSettings() {
        Map<Dependency, BreakerSettings> settings = new EnumMap<>(Dependency.class);
        settings.put(Dependency.EXECUTOR_ROSTER, new BreakerSettings(2, Duration.ofSeconds(5)));
        ResilienceState custom = new ResilienceState(settings, Clock.systemUTC());

        assertThat(custom.snapshot(Dependency.EXECUTOR_ROSTER).getFailureThreshold()).isEqualTo(2);
        assertThat(custom.snapshot(Dependency.EXECUTOR_ROSTER).getCoolDown()).isEqualTo(Duration.ofSeconds(5));
        assertThat(custom.snapshot(Dependency.TICKET_DATA).getFailureThreshold())
                .isEqualTo(BreakerSettings.DEFAULT_FAILURE_THRESHOLD);
    }

    @Test
    @DisplayName("Invalid breaker settings are rejected")
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new BreakerSettings(0, Duration.ofSeconds(1)))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new BreakerSettings(3, Duration.ZERO))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThat(new ResilienceState(Collections.emptyMap(), Clock.systemUTC()).currentMode())
                .isEqualTo(ServiceMode.FULL);
    }

    @Test
    @DisplayName("Dependencies resolve by wire name or enum name")
    void resolvesDependencyNames() {
        assertThat(Dependency.fromValue("ticket-data")).isEqualTo(Dependency.TICKET_DATA);
        assertThat(Dependency.fromValue("EXECUTOR_ROSTER")).isEqualTo(Dependency.EXECUTOR_ROSTER);
        assertThatThrownBy(() -> Dependency.fromValue("billing"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
