package com.skillgraph.audit.report;

import java.util.Locale;

public enum ReportFormat {
    TEXT, STRUCTURED;

    public static ReportFormat parse(String value) {
        if (value == null || value.isBlank()) return TEXT;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "text" -> TEXT;
            case "structured", "json" -> STRUCTURED;
            default -> throw new IllegalArgumentException("Unsupported report format: " + value + " (expected text or structured)");
        };
    }
}
