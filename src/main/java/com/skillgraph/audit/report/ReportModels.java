package com.skillgraph.audit.report;

import com.skillgraph.audit.consistency.ConsistencyModels.Verdict;
import com.skillgraph.audit.finding.Finding;
import com.skillgraph.audit.gap.GapModels.OrphanModule;
import com.skillgraph.audit.gap.GapModels.ProposedSkill;
import com.skillgraph.audit.gap.GapModels.WiringSuggestion;
import com.skillgraph.audit.health.HealthModels.ModuleHealth;
import com.skillgraph.audit.registry.RegistryModels.DeclaredKind;
import com.skillgraph.audit.registry.RegistryModels.Strength;

import java.util.List;
import java.util.Map;

public class ReportModels {
    /** Sections in rendering order. */
    public record AuditReport(List<MatrixRow> dependencyMatrix,
                              List<UsageRow> usageRanking,
                              List<UsageRow> skillDependencyRanking,
                              List<Finding> missingReferences,
                              List<Finding> kindMismatches,
                              Map<String, List<OrphanModule>> orphansByCategory,
                              Recommendations recommendations,
                              Summary summary,
                              List<ModuleHealth> moduleHealth,
                              List<Finding> structuralWarnings,
                              List<String> unmappedLessons) {}

    public record MatrixRow(String skill, String target, DeclaredKind declaredKind, Strength strength, Verdict verdict) {}

    public record UsageRow(String name, int skillRefCount, List<String> referringSkills) {}

    public record Recommendations(List<ProposedSkill> proposedSkills, List<WiringSuggestion> wiringSuggestions) {}

    public record Summary(int totalSkills,
                          int totalModules,
                          int orphanModules,
                          double orphanPercent,
                          int missingReferences,
                          int warnings,
                          int unmappedLessons) {}
}
