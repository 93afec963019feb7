package com.skillgraph.audit.gap;

import com.skillgraph.audit.health.HealthModels.UpgradePriority;

import java.util.List;
import java.util.Map;

public class GapModels {
    public record OrphanModule(String moduleName, String category, int healthScore, UpgradePriority upgradePriority) {}

    /** A new skill that would bundle a cluster of unused modules sharing a category. */
    public record ProposedSkill(String suggestedName, String category, List<String> moduleNames) {}

    /** {@code skillName} is null when no existing skill depends on a module of the same category. */
    public record WiringSuggestion(String moduleName, String category, String skillName, int sharedCategoryModules) {

        public boolean hasCandidate() {
            return skillName != null;
        }
    }

    public record GapAnalysis(Map<String, List<OrphanModule>> orphansByCategory,
                              List<ProposedSkill> proposedSkills,
                              List<WiringSuggestion> wiringSuggestions) {

        public int orphanCount() {
            return orphansByCategory.values().stream().mapToInt(List::size).sum();
        }
    }
}
