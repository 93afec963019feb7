package com.skillgraph.audit.usage;

import com.skillgraph.audit.consistency.ConsistencyModels.ResolvedEdge;
import com.skillgraph.audit.consistency.ConsistencyModels.Verdict;
import com.skillgraph.audit.registry.Snapshot;
import com.skillgraph.audit.usage.UsageModels.*;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Counts distinct referring skills per module and per skill used as a dependency.
 * Optional edges count like required ones.
 */
@Component
public class UsageAggregator {

    public UsageResult aggregate(Snapshot snapshot, List<ResolvedEdge> resolvedEdges) {
        Map<String, Set<String>> moduleRefs = new TreeMap<>();
        snapshot.modules().forEach(m -> moduleRefs.put(m.name(), new TreeSet<>()));
        Map<String, Set<String>> skillRefs = new TreeMap<>();
        snapshot.skills().forEach(s -> skillRefs.put(s.name(), new TreeSet<>()));

        for (ResolvedEdge resolved : resolvedEdges) {
            if (resolved.verdict() == Verdict.RESOLVES_TO_MODULE) {
                moduleRefs.get(resolved.edge().to()).add(resolved.edge().fromSkillId());
            } else if (resolved.verdict() == Verdict.RESOLVES_TO_SKILL) {
                skillRefs.get(resolved.edge().to()).add(resolved.edge().fromSkillId());
            }
        }

        Map<String, ModuleUsage> moduleUsage = new LinkedHashMap<>();
        moduleRefs.forEach((name, refs) -> moduleUsage.put(name, new ModuleUsage(name, Collections.unmodifiableSet(refs), refs.size())));
        Map<String, SkillUsage> skillUsage = new LinkedHashMap<>();
        skillRefs.forEach((name, refs) -> skillUsage.put(name, new SkillUsage(name, Collections.unmodifiableSet(refs), refs.size())));

        return new UsageResult(Collections.unmodifiableMap(moduleUsage), Collections.unmodifiableMap(skillUsage));
    }
}
