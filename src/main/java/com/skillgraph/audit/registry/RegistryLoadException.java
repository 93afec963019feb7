package com.skillgraph.audit.registry;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Fatal problem with the registry export. No derived computation runs once this is raised.
 *
 * Carries every issue found while loading, not only the first one, so a single run
 * points at all offending records.
 */
public class RegistryLoadException extends RuntimeException {

    public enum Kind { MALFORMED_RECORD, DUPLICATE_RECORD }

    /** One offending record: its kind (skill, module, ...), id if known and source line (0 when unknown). */
    public record LoadIssue(Kind kind, String recordKind, String recordId, int line, String message) {
        public String describe() {
            String where = line > 0 ? " (line " + line + ")" : "";
            String id = recordId == null ? "<no id>" : recordId;
            return "[" + kind + "] " + recordKind + " " + id + where + ": " + message;
        }
    }

    private final Kind kind;
    private final List<LoadIssue> issues;

    public RegistryLoadException(List<LoadIssue> issues) {
        super(issues.stream().map(LoadIssue::describe).collect(Collectors.joining("; ")));
        if (issues.isEmpty()) {
            throw new IllegalArgumentException("RegistryLoadException needs at least one issue");
        }
        this.kind = issues.get(0).kind();
        this.issues = List.copyOf(issues);
    }

    public Kind getKind() { return kind; }

    public List<LoadIssue> getIssues() { return issues; }
}
