package com.skillgraph.audit.registry;

import com.skillgraph.audit.registry.RegistryLoadException.Kind;
import com.skillgraph.audit.registry.RegistryLoadException.LoadIssue;
import com.skillgraph.audit.registry.RegistryModels.RegistryExport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class RegistryLoader {
    private static final Logger log = LoggerFactory.getLogger(RegistryLoader.class);

    /**
     * Validates the export and builds the snapshot.
     *
     * @throws RegistryLoadException when any record is malformed or duplicated
     */
    public Snapshot load(RegistryExport export) {
        List<LoadIssue> issues = new ArrayList<>();

        export.skills().forEach(s -> required("skill", s.id(), s.line(), issues, "id", s.id(), "name", s.name()));
        export.modules().forEach(m -> required("module", m.id(), m.line(), issues, "id", m.id(), "name", m.name()));
        export.codeBlocks().forEach(c -> required("codeblock", c.id(), c.line(), issues, "id", c.id(), "name", c.name()));
        export.lessons().forEach(l -> required("lesson", l.id(), l.line(), issues, "id", l.id(), "title", l.title()));
        export.edges().forEach(e -> required("dependency", e.fromSkillId(), e.line(), issues,
                "skill", e.fromSkillId(), "target", e.targetName()));

        duplicate(rows(export.skills(), s -> s.id(), s -> s.line()), "skill", "id", issues);
        duplicate(rows(export.skills(), s -> s.name(), s -> s.line()), "skill", "name", issues);
        duplicate(rows(export.modules(), m -> m.id(), m -> m.line()), "module", "id", issues);
        duplicate(rows(export.modules(), m -> m.name(), m -> m.line()), "module", "name", issues);
        duplicate(rows(export.codeBlocks(), c -> c.id(), c -> c.line()), "codeblock", "id", issues);
        duplicate(rows(export.lessons(), l -> l.id(), l -> l.line()), "lesson", "id", issues);

        Set<String> skillIds = export.skills().stream().map(s -> s.id()).filter(Objects::nonNull).collect(Collectors.toSet());
        export.edges().stream()
                .filter(e -> !isBlank(e.fromSkillId()) && !skillIds.contains(e.fromSkillId()))
                .forEach(e -> issues.add(new LoadIssue(Kind.MALFORMED_RECORD, "dependency", e.fromSkillId(), e.line(),
                        "Dependency declared by unknown skill id: " + e.fromSkillId())));

        if (!issues.isEmpty()) {
            throw new RegistryLoadException(issues);
        }

        Snapshot snapshot = new Snapshot(export.skills(), export.modules(), export.codeBlocks(), export.lessons(), export.edges());
        log.debug("Loaded snapshot: {} skills, {} modules, {} code blocks, {} lessons, {} edges",
                snapshot.skills().size(), snapshot.modules().size(), snapshot.codeBlocks().size(),
                snapshot.lessons().size(), snapshot.edges().size());
        return snapshot;
    }

    /** {@code fields} alternates field name and value; values may be null. */
    private void required(String recordKind, String id, int line, List<LoadIssue> issues, String... fields) {
        for (int i = 0; i + 1 < fields.length; i += 2) {
            if (isBlank(fields[i + 1])) {
                issues.add(new LoadIssue(Kind.MALFORMED_RECORD, recordKind, id, line,
                        recordKind + "." + fields[i] + " required"));
            }
        }
    }

    private void duplicate(List<Row> rows, String recordKind, String field, List<LoadIssue> issues) {
        Map<String, Long> counts = rows.stream()
                .filter(r -> !isBlank(r.key()))
                .collect(Collectors.groupingBy(Row::key, Collectors.counting()));
        rows.forEach(r -> {
            if (!isBlank(r.key()) && counts.getOrDefault(r.key(), 0L) > 1) {
                issues.add(new LoadIssue(Kind.DUPLICATE_RECORD, recordKind, r.key(), r.line(),
                        "Duplicate " + recordKind + " " + field + ": " + r.key()));
            }
        });
    }

    private <T> List<Row> rows(List<T> records, Function<T, String> key, Function<T, Integer> line) {
        return records.stream().map(r -> new Row(key.apply(r), line.apply(r))).toList();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Row(String key, int line) {}
}
