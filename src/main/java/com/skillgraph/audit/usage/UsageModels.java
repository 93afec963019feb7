package com.skillgraph.audit.usage;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class UsageModels {
    public record ModuleUsage(String moduleName, Set<String> referringSkillIds, int count) {}

    public record SkillUsage(String skillName, Set<String> referringSkillIds, int count) {}

    public record UsageResult(Map<String, ModuleUsage> moduleUsage, Map<String, SkillUsage> skillUsage) {

        public int skillRefCount(String moduleName) {
            ModuleUsage usage = moduleUsage.get(moduleName);
            return usage == null ? 0 : usage.count();
        }

        /** Descending count, ties by name. */
        public List<ModuleUsage> ranking() {
            return moduleUsage.values().stream()
                    .sorted(Comparator.comparingInt(ModuleUsage::count).reversed()
                            .thenComparing(ModuleUsage::moduleName))
                    .toList();
        }

        public List<SkillUsage> skillRanking() {
            return skillUsage.values().stream()
                    .filter(u -> u.count() > 0)
                    .sorted(Comparator.comparingInt(SkillUsage::count).reversed()
                            .thenComparing(SkillUsage::skillName))
                    .toList();
        }
    }
}
