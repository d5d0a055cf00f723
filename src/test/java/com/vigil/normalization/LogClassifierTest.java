package com.vigil.normalization;

import com.vigil.domain.LogRecord;
import com.vigil.domain.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for LogClassifier
 * Covers keyword precedence for severity, source precedence for type,
 * and idempotence on records that are already labelled.
 */
@DisplayName("LogClassifier Tests")
class LogClassifierTest {
    
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    
    private LogClassifier classifier;
    
    @BeforeEach
    void setUp() {
        classifier = new LogClassifier();
    }
    
    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
        "CRITICAL failure in kernel, CRITICAL",
        "critical alert raised, CRITICAL",
        "Alert: port scan, HIGH",
        "disk usage warning, HIGH",
        "warning and notice, HIGH",
        "Notice: config reloaded, MEDIUM",
        "user logged in, LOW"
    })
    @DisplayName("Should classify severity by keyword precedence")
    void shouldClassifySeverityByKeyword(String content, Severity expected) {
        LogRecord classified = classifier.classify(new LogRecord(T0, "syslog", content));
        
        assertThat(classified.getSeverity()).contains(expected);
    }
    
    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
        "ids-sensor-1, intrusion",
        "snort, intrusion",
        "ids-auth, intrusion",
        "auth.log, authentication",
        "fw01, firewall",
        "firewall-edge, firewall",
        "kernel, system"
    })
    @DisplayName("Should classify type by source precedence")
    void shouldClassifyTypeBySource(String source, String expected) {
        LogRecord classified = classifier.classify(new LogRecord(T0, source, "event"));
        
        assertThat(classified.getType()).contains(expected);
    }
    
    @ParameterizedTest(name = "\"{0}\" -> system")
    @CsvSource({"IDS-Sensor", "SNORT", "Auth.log", "FW01", "Firewall"})
    @DisplayName("Should match source names as given, without folding case")
    void shouldMatchSourceCaseSensitively(String source) {
        LogRecord classified = classifier.classify(new LogRecord(T0, source, "hello"));
        
        assertThat(classified.getType()).contains(LogRecord.TYPE_SYSTEM);
    }
    
    @Test
    @DisplayName("Should default an empty source to system")
    void shouldDefaultEmptySourceToSystem() {
        LogRecord classified = classifier.classify(new LogRecord(T0, null, "event"));
        
        assertThat(classified.getType()).contains(LogRecord.TYPE_SYSTEM);
    }
    
    @Test
    @DisplayName("Should leave existing severity and type untouched")
    void shouldNotOverrideExistingFields() {
        // Given: A record whose labels disagree with the keyword rules
        LogRecord record = new LogRecord(T0, "ids-1", "critical failure", Severity.LOW, "custom", Map.of());
        
        // When: Classified
        LogRecord classified = classifier.classify(record);
        
        // Then: Nothing changes
        assertThat(classified).isEqualTo(record);
    }
    
    @Test
    @DisplayName("Should fill only the missing field")
    void shouldFillOnlyMissingField() {
        LogRecord record = new LogRecord(T0, "auth", "critical failure", null, "custom", Map.of());
        
        LogRecord classified = classifier.classify(record);
        
        assertThat(classified.getSeverity()).contains(Severity.CRITICAL);
        assertThat(classified.getType()).contains("custom");
    }
    
    @Test
    @DisplayName("Should be idempotent")
    void shouldBeIdempotent() {
        LogRecord record = new LogRecord(T0, "snort", "Notice: rule updated");
        
        LogRecord once = classifier.classify(record);
        LogRecord twice = classifier.classify(once);
        
        assertThat(twice).isEqualTo(once);
    }
    
    @Test
    @DisplayName("Should not mutate the input record")
    void shouldNotMutateInput() {
        LogRecord record = new LogRecord(T0, "fw", "blocked");
        
        classifier.classify(record);
        
        assertThat(record.getSeverity()).isEmpty();
        assertThat(record.getType()).isEmpty();
    }
}
