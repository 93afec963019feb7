package com.skillgraph.audit.gap;

import com.skillgraph.audit.consistency.ConsistencyModels.ResolvedEdge;
import com.skillgraph.audit.consistency.ConsistencyModels.Verdict;
import com.skillgraph.audit.gap.GapModels.*;
import com.skillgraph.audit.health.HealthModels.ModuleHealth;
import com.skillgraph.audit.registry.RegistryModels.DependencyEdge;
import com.skillgraph.audit.registry.RegistryModels.Module;
import com.skillgraph.audit.registry.RegistryModels.Skill;
import com.skillgraph.audit.registry.Snapshot;
import com.skillgraph.audit.usage.UsageModels.UsageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Finds modules no skill uses and suggests where they could go.
 *
 * Orphans sharing a category form a cluster. A cluster of at least {@code minClusterSize}
 * members that no single skill already declares two of becomes a proposed skill. Every other
 * orphan is matched to the skill already using the most modules of its category.
 * Suggestions only; the snapshot is never touched.
 */
@Component
public class GapAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(GapAnalyzer.class);

    public GapAnalysis analyze(Snapshot snapshot, UsageResult usage, List<ResolvedEdge> resolvedEdges,
                               List<ModuleHealth> health, int minClusterSize) {
        Map<String, ModuleHealth> healthByName = health.stream()
                .collect(Collectors.toMap(ModuleHealth::moduleName, Function.identity()));

        Map<String, List<OrphanModule>> orphansByCategory = new TreeMap<>();
        snapshot.modules().stream()
                .filter(m -> usage.skillRefCount(m.name()) == 0)
                .sorted(Comparator.comparing(Module::name))
                .forEach(m -> {
                    ModuleHealth h = healthByName.get(m.name());
                    orphansByCategory.computeIfAbsent(m.category(), k -> new ArrayList<>())
                            .add(new OrphanModule(m.name(), m.category(), h.healthScore(), h.upgradePriority()));
                });
        orphansByCategory.replaceAll((k, v) -> List.copyOf(v));

        List<ProposedSkill> proposed = new ArrayList<>();
        List<OrphanModule> unclustered = new ArrayList<>();
        orphansByCategory.forEach((category, orphans) -> {
            List<String> names = orphans.stream().map(OrphanModule::moduleName).toList();
            if (names.size() >= minClusterSize && !declaredTogether(snapshot, names)) {
                proposed.add(new ProposedSkill(category + "-suite", category, names));
            } else {
                unclustered.addAll(orphans);
            }
        });

        Map<String, Set<String>> moduleDepsBySkill = moduleDependencies(snapshot, resolvedEdges);
        List<WiringSuggestion> wiring = unclustered.stream()
                .map(o -> wiringSuggestion(snapshot, o, moduleDepsBySkill))
                .toList();

        log.debug("Gap analysis: {} orphans, {} proposed skills, {} wiring suggestions",
                unclustered.size() + proposed.stream().mapToInt(p -> p.moduleNames().size()).sum(),
                proposed.size(), wiring.size());
        return new GapAnalysis(Collections.unmodifiableMap(orphansByCategory), List.copyOf(proposed), wiring);
    }

    /** True when some skill declares two or more of {@code names}, whatever the resolution verdict. */
    private boolean declaredTogether(Snapshot snapshot, List<String> names) {
        Set<String> members = new HashSet<>(names);
        for (Skill skill : snapshot.skills()) {
            long hits = snapshot.edgesOf(skill.id()).stream()
                    .map(DependencyEdge::targetName)
                    .filter(members::contains)
                    .distinct()
                    .count();
            if (hits >= 2) return true;
        }
        return false;
    }

    private Map<String, Set<String>> moduleDependencies(Snapshot snapshot, List<ResolvedEdge> resolvedEdges) {
        Map<String, Set<String>> deps = new TreeMap<>();
        snapshot.skills().forEach(s -> deps.put(s.name(), new HashSet<>()));
        resolvedEdges.stream()
                .filter(e -> e.verdict() == Verdict.RESOLVES_TO_MODULE)
                .forEach(e -> deps.get(e.edge().from()).add(e.edge().to()));
        return deps;
    }

    private WiringSuggestion wiringSuggestion(Snapshot snapshot, OrphanModule orphan, Map<String, Set<String>> moduleDepsBySkill) {
        String best = null;
        int bestScore = 0;
        // TreeMap order: the first skill reaching the top score has the smallest name.
        for (var entry : moduleDepsBySkill.entrySet()) {
            int score = (int) entry.getValue().stream()
                    .map(snapshot::module)
                    .flatMap(Optional::stream)
                    .filter(m -> Objects.equals(m.category(), orphan.category()))
                    .count();
            if (score > bestScore) {
                best = entry.getKey();
                bestScore = score;
            }
        }
        return new WiringSuggestion(orphan.moduleName(), orphan.category(), best, bestScore);
    }
}
