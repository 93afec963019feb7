package com.skillgraph.audit.graph;

import com.skillgraph.audit.finding.Finding;
import com.skillgraph.audit.registry.RegistryModels.DeclaredKind;
import com.skillgraph.audit.registry.RegistryModels.Strength;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class GraphModels {
    /** Directed multigraph over skill, module and dangling target names. */
    public record DependencyGraph(Set<String> nodes,
                                  List<GraphEdge> edges,
                                  Map<String, List<GraphEdge>> outgoing) {

        public List<GraphEdge> outgoing(String skillName) {
            return outgoing.getOrDefault(skillName, List.of());
        }
    }

    public record GraphEdge(String fromSkillId, String from, String to, DeclaredKind declaredKind, Strength strength) {}

    public record GraphResult(DependencyGraph graph, List<Finding> findings) {}
}
