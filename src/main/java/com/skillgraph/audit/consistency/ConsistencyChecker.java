package com.skillgraph.audit.consistency;

import com.skillgraph.audit.consistency.ConsistencyModels.*;
import com.skillgraph.audit.finding.Finding;
import com.skillgraph.audit.finding.FindingCodes;
import com.skillgraph.audit.graph.GraphModels.DependencyGraph;
import com.skillgraph.audit.graph.GraphModels.GraphEdge;
import com.skillgraph.audit.registry.RegistryModels.DeclaredKind;
import com.skillgraph.audit.registry.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Resolves every declared dependency against the module and skill namespaces.
 *
 * Matching is exact and case-sensitive. Nothing here guesses: a target that exists in
 * neither namespace is {@link Verdict#MISSING} even when a code block carries the name.
 */
@Component
public class ConsistencyChecker {
    private static final Logger log = LoggerFactory.getLogger(ConsistencyChecker.class);

    public ConsistencyResult check(Snapshot snapshot, DependencyGraph graph) {
        return check(snapshot, graph, Runnable::run, 1);
    }

    /**
     * Splits the edges into {@code partitions} contiguous slices resolved on {@code executor}.
     * Each slice keeps its own finding list; slices are concatenated in edge order.
     */
    public ConsistencyResult check(Snapshot snapshot, DependencyGraph graph, Executor executor, int partitions) {
        List<GraphEdge> edges = graph.edges();
        int slices = Math.max(1, Math.min(partitions, edges.size()));
        int sliceSize = edges.isEmpty() ? 0 : (edges.size() + slices - 1) / slices;

        List<CompletableFuture<ConsistencyResult>> futures = new ArrayList<>();
        for (int start = 0; start < edges.size(); start += sliceSize) {
            List<GraphEdge> slice = edges.subList(start, Math.min(edges.size(), start + sliceSize));
            futures.add(CompletableFuture.supplyAsync(() -> resolveSlice(snapshot, slice), executor));
        }

        List<ResolvedEdge> resolved = new ArrayList<>(edges.size());
        List<Finding> findings = new ArrayList<>();
        for (CompletableFuture<ConsistencyResult> future : futures) {
            ConsistencyResult part = future.join();
            resolved.addAll(part.resolvedEdges());
            findings.addAll(part.findings());
        }
        log.debug("Resolved {} edges in {} slices, {} findings", resolved.size(), futures.size(), findings.size());
        return new ConsistencyResult(List.copyOf(resolved), List.copyOf(findings));
    }

    public static Verdict resolve(String targetName, DeclaredKind declaredKind, Snapshot snapshot) {
        boolean module = snapshot.isModule(targetName);
        boolean skill = snapshot.isSkill(targetName);
        if (module && skill) return Verdict.RESOLVES_TO_BOTH;
        if (!module && !skill) return Verdict.MISSING;
        DeclaredKind actual = module ? DeclaredKind.MODULE : DeclaredKind.SKILL;
        if (actual != declaredKind) return Verdict.KIND_MISMATCH;
        return actual == DeclaredKind.MODULE ? Verdict.RESOLVES_TO_MODULE : Verdict.RESOLVES_TO_SKILL;
    }

    private ConsistencyResult resolveSlice(Snapshot snapshot, List<GraphEdge> slice) {
        List<ResolvedEdge> resolved = new ArrayList<>(slice.size());
        List<Finding> findings = new ArrayList<>();
        for (GraphEdge edge : slice) {
            Verdict verdict = resolve(edge.to(), edge.declaredKind(), snapshot);
            boolean codeBlockHint = verdict == Verdict.MISSING && snapshot.isCodeBlock(edge.to());
            resolved.add(new ResolvedEdge(edge, verdict, codeBlockHint));
            toFinding(edge, verdict, codeBlockHint).ifPresent(findings::add);
        }
        return new ConsistencyResult(resolved, findings);
    }

    private Optional<Finding> toFinding(GraphEdge edge, Verdict verdict, boolean codeBlockHint) {
        String subject = edge.from() + " -> " + edge.to();
        String declared = edge.declaredKind().name().toLowerCase(Locale.ROOT);
        return switch (verdict) {
            case RESOLVES_TO_MODULE, RESOLVES_TO_SKILL -> Optional.empty();
            case KIND_MISMATCH -> Optional.of(Finding.warning(FindingCodes.KIND_MISMATCH,
                    "Declared as " + declared + " but exists only as " + edge.declaredKind().other().name().toLowerCase(Locale.ROOT), subject));
            case RESOLVES_TO_BOTH -> Optional.of(Finding.warning(FindingCodes.RESOLVES_TO_BOTH,
                    "Name exists as both a module and a skill", subject));
            case MISSING -> Optional.of(Finding.error(FindingCodes.MISSING_REFERENCE,
                    codeBlockHint ? "Declared " + declared + " not found; a code block has this name"
                            : "Declared " + declared + " not found", subject));
        };
    }
}
