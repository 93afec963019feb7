package com.skillgraph.audit.health;

import com.skillgraph.audit.config.AuditProperties;
import com.skillgraph.audit.health.HealthModels.*;
import com.skillgraph.audit.lesson.LessonModels.LessonMapping;
import com.skillgraph.audit.lesson.LessonModels.TargetKind;
import com.skillgraph.audit.usage.UsageModels.UsageResult;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Derives a health score and an upgrade priority per module.
 *
 * <pre>
 * healthScore     = clamp(100 - lessonCount * lessonPenalty + skillRefCount * usageBonus, 0, 100)
 * upgradePriority = tier of lessonCount against the critical/high/medium thresholds
 * </pre>
 *
 * Priority ignores usage, so an unused module still surfaces when lessons pile up against it.
 */
@Component
public class HealthScorer {
    private final AuditProperties properties;

    public HealthScorer(AuditProperties properties) {
        this.properties = properties;
    }

    /** Worst first: ascending score, then higher usage, then name. */
    public List<ModuleHealth> score(UsageResult usage, List<LessonMapping> mappings) {
        Map<String, Long> lessonCounts = mappings.stream()
                .filter(m -> m.targetKind() == TargetKind.MODULE)
                .collect(Collectors.groupingBy(LessonMapping::targetName, Collectors.counting()));

        return usage.moduleUsage().keySet().stream()
                .map(name -> {
                    int lessonCount = lessonCounts.getOrDefault(name, 0L).intValue();
                    int skillRefCount = usage.skillRefCount(name);
                    return new ModuleHealth(name, lessonCount, skillRefCount,
                            healthScore(lessonCount, skillRefCount), upgradePriority(lessonCount));
                })
                .sorted(Comparator.comparingInt(ModuleHealth::healthScore)
                        .thenComparing(Comparator.comparingInt(ModuleHealth::skillRefCount).reversed())
                        .thenComparing(ModuleHealth::moduleName))
                .toList();
    }

    public int healthScore(int lessonCount, int skillRefCount) {
        AuditProperties.Health policy = properties.getHealth();
        long raw = 100L - (long) lessonCount * policy.getLessonPenalty() + (long) skillRefCount * policy.getUsageBonus();
        return (int) Math.max(0, Math.min(100, raw));
    }

    public UpgradePriority upgradePriority(int lessonCount) {
        AuditProperties.Health policy = properties.getHealth();
        if (lessonCount > policy.getCriticalThreshold()) return UpgradePriority.CRITICAL;
        if (lessonCount > policy.getHighThreshold()) return UpgradePriority.HIGH;
        if (lessonCount > policy.getMediumThreshold()) return UpgradePriority.MEDIUM;
        return UpgradePriority.LOW;
    }
}
