package com.skillgraph.audit.report;

import com.skillgraph.audit.consistency.ConsistencyModels.ConsistencyResult;
import com.skillgraph.audit.finding.Finding;
import com.skillgraph.audit.finding.FindingCodes;
import com.skillgraph.audit.gap.GapModels.GapAnalysis;
import com.skillgraph.audit.graph.GraphModels.GraphResult;
import com.skillgraph.audit.health.HealthModels.ModuleHealth;
import com.skillgraph.audit.lesson.LessonModels.LessonMappingResult;
import com.skillgraph.audit.registry.Snapshot;
import com.skillgraph.audit.report.ReportModels.*;
import com.skillgraph.audit.usage.UsageModels.UsageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class ReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(ReportGenerator.class);

    private final Map<ReportFormat, ReportRenderer> renderers;

    public ReportGenerator(List<ReportRenderer> renderers) {
        this.renderers = renderers.stream().collect(Collectors.toMap(ReportRenderer::format, Function.identity()));
    }

    public AuditReport generate(Snapshot snapshot,
                                GraphResult graph,
                                ConsistencyResult consistency,
                                UsageResult usage,
                                LessonMappingResult lessons,
                                List<ModuleHealth> health,
                                GapAnalysis gap) {
        List<MatrixRow> matrix = consistency.resolvedEdges().stream()
                .map(e -> new MatrixRow(e.edge().from(), e.edge().to(), e.edge().declaredKind(), e.edge().strength(), e.verdict()))
                .sorted(Comparator.comparing(MatrixRow::skill).thenComparing(MatrixRow::target)
                        .thenComparing(MatrixRow::declaredKind))
                .toList();

        List<UsageRow> ranking = usage.ranking().stream()
                .map(u -> new UsageRow(u.moduleName(), u.count(), skillNames(snapshot, u.referringSkillIds())))
                .toList();
        List<UsageRow> skillRanking = usage.skillRanking().stream()
                .map(u -> new UsageRow(u.skillName(), u.count(), skillNames(snapshot, u.referringSkillIds())))
                .toList();

        List<Finding> missing = byCode(consistency.findings(), Set.of(FindingCodes.MISSING_REFERENCE));
        List<Finding> mismatches = byCode(consistency.findings(), Set.of(FindingCodes.KIND_MISMATCH, FindingCodes.RESOLVES_TO_BOTH));
        List<Finding> structural = graph.findings().stream().sorted(FINDING_ORDER).toList();

        int warnings = (int) (consistency.findings().stream().filter(f -> !f.isError()).count()
                + graph.findings().stream().filter(f -> !f.isError()).count());
        int totalModules = snapshot.modules().size();
        int orphans = gap.orphanCount();
        double orphanPercent = totalModules == 0 ? 0.0 : Math.round(orphans * 10000.0 / totalModules) / 100.0;

        Summary summary = new Summary(snapshot.skills().size(), totalModules, orphans, orphanPercent,
                missing.size(), warnings, lessons.unmappedLessonIds().size());

        return new AuditReport(matrix, ranking, skillRanking, missing, mismatches, gap.orphansByCategory(),
                new Recommendations(gap.proposedSkills(), gap.wiringSuggestions()),
                summary, health, structural, lessons.unmappedLessonIds());
    }

    public String render(AuditReport report, ReportFormat format) {
        ReportRenderer renderer = renderers.get(format);
        if (renderer == null) {
            throw new IllegalArgumentException("No renderer for format " + format);
        }
        return renderer.render(report);
    }

    /** Writes the rendered report to {@code output}, or to {@code stdout} when no path is given. */
    public void write(AuditReport report, ReportFormat format, Path output, PrintStream stdout) {
        String rendered = render(report, format);
        if (output == null) {
            stdout.print(rendered);
            stdout.flush();
            return;
        }
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(output, rendered, StandardCharsets.UTF_8);
            log.info("Report written to {}", output);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write report to " + output, e);
        }
    }

    private static final Comparator<Finding> FINDING_ORDER = Comparator.comparing(Finding::subject)
            .thenComparing(Finding::code)
            .thenComparing(Finding::message);

    private List<Finding> byCode(List<Finding> findings, Set<String> codes) {
        return findings.stream().filter(f -> codes.contains(f.code())).sorted(FINDING_ORDER).toList();
    }

    private List<String> skillNames(Snapshot snapshot, Set<String> skillIds) {
        return skillIds.stream().map(snapshot::skillName).sorted().toList();
    }
}
