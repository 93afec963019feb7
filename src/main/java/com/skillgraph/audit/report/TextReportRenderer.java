package com.skillgraph.audit.report;

import com.skillgraph.audit.finding.Finding;
import com.skillgraph.audit.report.ReportModels.*;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Plain-text tables for people reading the audit in a terminal. */
@Component
public class TextReportRenderer implements ReportRenderer {

    @Override
    public ReportFormat format() {
        return ReportFormat.TEXT;
    }

    @Override
    public String render(AuditReport report) {
        StringBuilder out = new StringBuilder();

        section(out, "Dependency Matrix");
        table(out, List.of("Skill", "Target", "Kind", "Strength", "Verdict"),
                report.dependencyMatrix().stream()
                        .map(r -> List.of(r.skill(), r.target(), lower(r.declaredKind().name()),
                                r.strength().marker(), r.verdict().name()))
                        .toList());

        section(out, "Module Usage Ranking");
        table(out, List.of("#", "Module", "Skills", "Used by"), numbered(report.usageRanking()));
        if (!report.skillDependencyRanking().isEmpty()) {
            out.append('\n');
            table(out, List.of("#", "Skill (as dependency)", "Skills", "Used by"), numbered(report.skillDependencyRanking()));
        }

        section(out, "Missing References");
        findings(out, report.missingReferences());

        section(out, "Kind Mismatches");
        findings(out, report.kindMismatches());

        section(out, "Orphan Modules");
        if (report.orphansByCategory().isEmpty()) {
            out.append("(none)\n");
        }
        report.orphansByCategory().forEach((category, orphans) -> {
            out.append(category).append(" (").append(orphans.size()).append(")\n");
            table(out, List.of("Module", "Health", "Priority"),
                    orphans.stream()
                            .map(o -> List.of(o.moduleName(), String.valueOf(o.healthScore()), o.upgradePriority().name()))
                            .toList());
        });

        section(out, "Recommendations");
        Recommendations recs = report.recommendations();
        if (recs.proposedSkills().isEmpty() && recs.wiringSuggestions().isEmpty()) {
            out.append("(none)\n");
        }
        recs.proposedSkills().forEach(p -> out.append("Proposed skill ").append(p.suggestedName())
                .append(" [").append(p.category()).append("]: ")
                .append(String.join(", ", p.moduleNames())).append('\n'));
        if (!recs.wiringSuggestions().isEmpty()) {
            table(out, List.of("Orphan module", "Category", "Wire into", "Shared"),
                    recs.wiringSuggestions().stream()
                            .map(w -> List.of(w.moduleName(), w.category(),
                                    w.hasCandidate() ? w.skillName() : "no wiring candidate",
                                    String.valueOf(w.sharedCategoryModules())))
                            .toList());
        }

        section(out, "Summary");
        Summary s = report.summary();
        out.append("Total skills:        ").append(s.totalSkills()).append('\n');
        out.append("Total modules:       ").append(s.totalModules()).append('\n');
        out.append("Orphan modules:      ").append(s.orphanModules())
                .append(String.format(Locale.ROOT, " (%.1f%%)", s.orphanPercent())).append('\n');
        out.append("Missing references:  ").append(s.missingReferences()).append('\n');
        out.append("Warnings:            ").append(s.warnings()).append('\n');
        out.append("Unmapped lessons:    ").append(s.unmappedLessons()).append('\n');

        section(out, "Module Health");
        table(out, List.of("Module", "Lessons", "Skills", "Health", "Priority"),
                report.moduleHealth().stream()
                        .map(h -> List.of(h.moduleName(), String.valueOf(h.lessonCount()), String.valueOf(h.skillRefCount()),
                                String.valueOf(h.healthScore()), h.upgradePriority().name()))
                        .toList());

        section(out, "Structural Warnings");
        findings(out, report.structuralWarnings());

        section(out, "Unmapped Lessons");
        out.append(report.unmappedLessons().isEmpty() ? "(none)" : String.join(", ", report.unmappedLessons())).append('\n');

        return out.toString();
    }

    private List<List<String>> numbered(List<UsageRow> rows) {
        List<List<String>> out = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            UsageRow r = rows.get(i);
            out.add(List.of(String.valueOf(i + 1), r.name(), String.valueOf(r.skillRefCount()), String.join(", ", r.referringSkills())));
        }
        return out;
    }

    private void findings(StringBuilder out, List<Finding> findings) {
        if (findings.isEmpty()) {
            out.append("(none)\n");
            return;
        }
        table(out, List.of("Severity", "Code", "Subject", "Detail"),
                findings.stream().map(f -> List.of(f.severity().name(), f.code(), f.subject(), f.message())).toList());
    }

    private void section(StringBuilder out, String title) {
        if (out.length() > 0) out.append('\n');
        out.append("== ").append(title).append(" ==\n");
    }

    private void table(StringBuilder out, List<String> headers, List<List<String>> rows) {
        if (rows.isEmpty()) {
            out.append("(none)\n");
            return;
        }
        int[] widths = new int[headers.size()];
        for (int i = 0; i < headers.size(); i++) widths[i] = headers.get(i).length();
        for (List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) widths[i] = Math.max(widths[i], row.get(i).length());
        }
        line(out, headers, widths);
        List<String> rule = new ArrayList<>();
        for (int width : widths) rule.add("-".repeat(width));
        line(out, rule, widths);
        rows.forEach(r -> line(out, r, widths));
    }

    private void line(StringBuilder out, List<String> cells, int[] widths) {
        StringBuilder row = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) row.append(" | ");
            row.append(String.format("%-" + widths[i] + "s", cells.get(i)));
        }
        out.append(row.toString().stripTrailing()).append('\n');
    }

    private String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
