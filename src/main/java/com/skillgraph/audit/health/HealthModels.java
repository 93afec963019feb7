package com.skillgraph.audit.health;

public class HealthModels {
    /** Declared in ascending order of urgency. */
    public enum UpgradePriority { LOW, MEDIUM, HIGH, CRITICAL }

    public record ModuleHealth(String moduleName, int lessonCount, int skillRefCount,
                               int healthScore, UpgradePriority upgradePriority) {}
}
