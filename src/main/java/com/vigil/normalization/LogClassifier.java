package com.vigil.normalization;

import com.vigil.domain.LogRecord;
import com.vigil.domain.Severity;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Fills in the severity and type of log records that arrive without them.
 * 
 * Rules are keyword based and applied only to absent fields, first match wins:
 * 
 * Severity (from the content):
 * - "critical" -> critical
 * - "alert" or "warning" -> high
 * - "notice" -> medium
 * - otherwise low
 * 
 * Type (from the source name):
 * - "ids" or "snort" -> intrusion
 * - "auth" -> authentication
 * - "fw" or "firewall" -> firewall
 * - otherwise system
 * 
 * Content keywords match case-insensitively; source names match as given,
 * so "IDS-Sensor" is a system log. The classifier is pure and idempotent:
 * a record that already has both fields is returned unchanged.
 */
@Component
public class LogClassifier {
    
    public LogRecord classify(LogRecord record) {
        LogRecord classified = record;
        if (classified.getSeverity().isEmpty()) {
            classified = classified.withSeverity(classifySeverity(classified.getContent()));
        }
        if (classified.getType().isEmpty()) {
            classified = classified.withType(classifyType(classified.getSource()));
        }
        return classified;
    }
    
    Severity classifySeverity(String content) {
        String text = content.toLowerCase(Locale.ROOT);
        if (text.contains("critical")) {
            return Severity.CRITICAL;
        }
        if (text.contains("alert") || text.contains("warning")) {
            return Severity.HIGH;
        }
        if (text.contains("notice")) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
    
    String classifyType(String source) {
        if (source.contains("ids") || source.contains("snort")) {
            return LogRecord.TYPE_INTRUSION;
        }
        if (source.contains("auth")) {
            return LogRecord.TYPE_AUTHENTICATION;
        }
        if (source.contains("fw") || source.contains("firewall")) {
            return LogRecord.TYPE_FIREWALL;
        }
        return LogRecord.TYPE_SYSTEM;
    }
}
