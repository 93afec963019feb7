package com.skillgraph.audit.consistency;

import com.skillgraph.audit.finding.Finding;
import com.skillgraph.audit.graph.GraphModels.GraphEdge;

import java.util.List;

public class ConsistencyModels {
    public enum Verdict {
        RESOLVES_TO_MODULE, RESOLVES_TO_SKILL, RESOLVES_TO_BOTH, KIND_MISMATCH, MISSING
    }

    /** An edge plus its verdict; {@code codeBlockHint} is set when a missing target names a code block. */
    public record ResolvedEdge(GraphEdge edge, Verdict verdict, boolean codeBlockHint) {}

    public record ConsistencyResult(List<ResolvedEdge> resolvedEdges, List<Finding> findings) {

        public long count(Verdict verdict) {
            return resolvedEdges.stream().filter(e -> e.verdict() == verdict).count();
        }
    }
}
