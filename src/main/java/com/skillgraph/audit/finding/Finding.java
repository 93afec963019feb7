package com.skillgraph.audit.finding;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A defect observed while auditing the registry. Findings are data: components return them
 * next to their results and the report merges them.
 */
public record Finding(Severity severity, String code, String message, String subject) {

    public enum Severity { ERROR, WARNING }

    public static Finding error(String code, String message, String subject) {
        return new Finding(Severity.ERROR, code, message, subject);
    }

    public static Finding warning(String code, String message, String subject) {
        return new Finding(Severity.WARNING, code, message, subject);
    }

    @JsonIgnore
    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
