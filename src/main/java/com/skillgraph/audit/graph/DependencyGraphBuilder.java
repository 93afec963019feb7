package com.skillgraph.audit.graph;

import com.skillgraph.audit.finding.Finding;
import com.skillgraph.audit.finding.FindingCodes;
import com.skillgraph.audit.graph.GraphModels.*;
import com.skillgraph.audit.registry.RegistryModels.DependencyEdge;
import com.skillgraph.audit.registry.RegistryModels.Skill;
import com.skillgraph.audit.registry.Snapshot;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class DependencyGraphBuilder {

    public GraphResult build(Snapshot snapshot) {
        Set<String> nodes = new LinkedHashSet<>();
        snapshot.skills().forEach(s -> nodes.add(s.name()));
        snapshot.modules().forEach(m -> nodes.add(m.name()));

        List<GraphEdge> edges = new ArrayList<>();
        Map<String, List<GraphEdge>> outgoing = new LinkedHashMap<>();
        for (DependencyEdge e : snapshot.edges()) {
            String from = snapshot.skillName(e.fromSkillId());
            GraphEdge edge = new GraphEdge(e.fromSkillId(), from, e.targetName(), e.declaredKind(), e.strength());
            nodes.add(e.targetName());
            edges.add(edge);
            outgoing.computeIfAbsent(from, k -> new ArrayList<>()).add(edge);
        }
        outgoing.replaceAll((k, v) -> List.copyOf(v));

        DependencyGraph graph = new DependencyGraph(Collections.unmodifiableSet(nodes), List.copyOf(edges),
                Collections.unmodifiableMap(outgoing));

        List<Finding> findings = new ArrayList<>();
        findings.addAll(selfDependencies(snapshot, graph));
        findings.addAll(duplicateDeclarations(snapshot, graph));
        findings.addAll(skillCycles(snapshot, graph));
        return new GraphResult(graph, findings);
    }

    private List<Finding> selfDependencies(Snapshot snapshot, DependencyGraph graph) {
        List<Finding> findings = new ArrayList<>();
        for (Skill skill : snapshot.skills()) {
            graph.outgoing(skill.name()).stream()
                    .filter(e -> e.to().equals(skill.name()))
                    .findFirst()
                    .ifPresent(e -> findings.add(Finding.warning(FindingCodes.SELF_DEPENDENCY,
                            "Skill declares a dependency on itself", skill.name())));
        }
        return findings;
    }

    private List<Finding> duplicateDeclarations(Snapshot snapshot, DependencyGraph graph) {
        List<Finding> findings = new ArrayList<>();
        for (Skill skill : snapshot.skills()) {
            Set<String> seen = new HashSet<>();
            Set<String> reported = new LinkedHashSet<>();
            for (GraphEdge e : graph.outgoing(skill.name())) {
                String key = e.declaredKind().name().toLowerCase(Locale.ROOT) + " " + e.to();
                if (!seen.add(key)) reported.add(key);
            }
            reported.forEach(key -> findings.add(Finding.warning(FindingCodes.DUPLICATE_DECLARATION,
                    "Dependency declared more than once: " + key,
                    skill.name())));
        }
        return findings;
    }

    /** Reports every strongly connected group of two or more skills once. */
    private List<Finding> skillCycles(Snapshot snapshot, DependencyGraph graph) {
        Map<String, List<String>> adj = new TreeMap<>();
        for (Skill skill : snapshot.skills()) {
            List<String> next = graph.outgoing(skill.name()).stream()
                    .map(GraphEdge::to)
                    .filter(snapshot::isSkill)
                    .filter(to -> !to.equals(skill.name()))
                    .distinct()
                    .toList();
            adj.put(skill.name(), next);
        }

        Tarjan tarjan = new Tarjan(adj);
        adj.keySet().forEach(tarjan::visit);

        return tarjan.components.stream()
                .filter(c -> c.size() > 1)
                .map(c -> c.stream().sorted().toList())
                .sorted(Comparator.comparing((List<String> c) -> c.get(0)))
                .map(c -> Finding.warning(FindingCodes.CYCLIC_SKILL_DEPENDENCY,
                        "Skills depend on each other in a cycle: " + String.join(" -> ", c), c.get(0)))
                .toList();
    }

    private static final class Tarjan {
        private final Map<String, List<String>> adj;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final List<List<String>> components = new ArrayList<>();
        private int counter;

        Tarjan(Map<String, List<String>> adj) {
            this.adj = adj;
        }

        void visit(String node) {
            if (index.containsKey(node)) return;
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);

            for (String next : adj.getOrDefault(node, List.of())) {
                if (!index.containsKey(next)) {
                    visit(next);
                    lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(next)));
                } else if (onStack.contains(next)) {
                    lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
                }
            }

            if (lowLink.get(node).equals(index.get(node))) {
                List<String> component = new ArrayList<>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(node));
                components.add(component);
            }
        }
    }
}
