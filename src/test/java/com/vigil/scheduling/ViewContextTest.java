package com.vigil.scheduling;

import com.vigil.source.SourceKind;
import com.vigil.source.SourceRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ViewContext Tests")
class ViewContextTest {
    
    @Test
    @DisplayName("Should fetch the overview sources with the window on windowed ones")
    void shouldPlanOverview() {
        List<SourceRequest> plan = ViewContext.OVERVIEW.plan(900);
        
        assertThat(plan).containsExactly(
            SourceRequest.latest(SourceKind.STATUS),
            SourceRequest.latest(SourceKind.THREAT_SUMMARY),
            SourceRequest.windowed(SourceKind.METRICS, 900),
            SourceRequest.windowed(SourceKind.NETWORK, 900),
            SourceRequest.latest(SourceKind.ALERT_SUMMARY),
            SourceRequest.windowed(SourceKind.LOGS, 900));
    }
    
    @Test
    @DisplayName("Should fetch analytics, alerts and windowed series for analytics")
    void shouldPlanAnalytics() {
        List<SourceRequest> plan = ViewContext.ANALYTICS.plan(86400);
        
        assertThat(plan).contains(
            SourceRequest.latest(SourceKind.ANALYTICS),
            SourceRequest.latest(SourceKind.ALERTS),
            SourceRequest.windowed(SourceKind.METRICS, 86400));
    }
    
    @Test
    @DisplayName("Should request each source at most once per cycle")
    void shouldNotRepeatSources() {
        for (ViewContext context : ViewContext.values()) {
            List<SourceKind> kinds = context.plan(60).stream()
                .map(SourceRequest::getKind)
                .collect(Collectors.toList());
            assertThat(EnumSet.copyOf(kinds)).hasSameSizeAs(kinds);
        }
    }
    
    @Test
    @DisplayName("Should resolve context names and reject unknown ones")
    void shouldResolveNames() {
        assertThat(ViewContext.fromValue("Logs")).isEqualTo(ViewContext.LOGS);
        assertThatThrownBy(() -> ViewContext.fromValue("admin"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("admin");
    }
}
