package com.aegis.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MetricFactory factory = new MetricFactory(registry, "auth-service");

    @Test
    @DisplayName("counters carry the service tag")
    void serviceTag() {
        factory.counter("aegis.auth.login", "logins").increment();

        var counter = registry.get("aegis.auth.login").tag("service", "auth-service").counter();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("recordOutcome counts each outcome separately")
    void outcomes() {
        factory.recordOutcome("aegis.auth.refresh", "success");
        factory.recordOutcome("aegis.auth.refresh", "success");
        factory.recordOutcome("aegis.auth.refresh", "revoked");

        assertThat(registry.get("aegis.auth.refresh").tag("outcome", "success").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("aegis.auth.refresh").tag("outcome", "revoked").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("rejects a missing registry or blank service name")
    void rejectsInvalid() {
        assertThatThrownBy(() -> new MetricFactory(null, "svc")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MetricFactory(registry, " ")).isInstanceOf(IllegalArgumentException.class);
    }
}
