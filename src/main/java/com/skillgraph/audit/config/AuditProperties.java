package com.skillgraph.audit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunable audit policy, bound from {@code audit.*}.
 *
 * <pre>
 * audit.workers=4
 * audit.health.lesson-penalty=2
 * audit.health.usage-bonus=3
 * audit.health.critical-threshold=50
 * audit.health.high-threshold=25
 * audit.health.medium-threshold=10
 * audit.gap.min-cluster-size=4
 * audit.lessons.bugfix-categories=bugfix,bug,hotfix,regression
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "audit")
public class AuditProperties {

    /** Worker threads used for the concurrent stages of one run. */
    private int workers = 4;

    private Health health = new Health();
    private Gap gap = new Gap();
    private Lessons lessons = new Lessons();

    public int getWorkers() { return workers; }

    public void setWorkers(int workers) { this.workers = workers; }

    public Health getHealth() { return health; }

    public void setHealth(Health health) { this.health = health; }

    public Gap getGap() { return gap; }

    public void setGap(Gap gap) { this.gap = gap; }

    public Lessons getLessons() { return lessons; }

    public void setLessons(Lessons lessons) { this.lessons = lessons; }

    public static class Health {
        private int lessonPenalty = 2;
        private int usageBonus = 3;
        private int criticalThreshold = 50;
        private int highThreshold = 25;
        private int mediumThreshold = 10;

        public int getLessonPenalty() { return lessonPenalty; }

        public void setLessonPenalty(int lessonPenalty) { this.lessonPenalty = lessonPenalty; }

        public int getUsageBonus() { return usageBonus; }

        public void setUsageBonus(int usageBonus) { this.usageBonus = usageBonus; }

        public int getCriticalThreshold() { return criticalThreshold; }

        public void setCriticalThreshold(int criticalThreshold) { this.criticalThreshold = criticalThreshold; }

        public int getHighThreshold() { return highThreshold; }

        public void setHighThreshold(int highThreshold) { this.highThreshold = highThreshold; }

        public int getMediumThreshold() { return mediumThreshold; }

        public void setMediumThreshold(int mediumThreshold) { this.mediumThreshold = mediumThreshold; }
    }

    public static class Gap {
        private int minClusterSize = 4;

        public int getMinClusterSize() { return minClusterSize; }

        public void setMinClusterSize(int minClusterSize) { this.minClusterSize = minClusterSize; }
    }

    public static class Lessons {
        /** Categories treated as bug fixes; a bug fix against a module is critical. */
        private List<String> bugfixCategories = new ArrayList<>(List.of("bugfix", "bug", "hotfix", "regression"));

        /** Categories describing a pattern or feature gap. */
        private List<String> actionableCategories = new ArrayList<>(List.of("pattern", "feature", "enhancement", "performance", "security"));

        /** Phrases in a lesson title or content that mark a concrete gap, matched case-insensitively. */
        private List<String> gapMarkers = new ArrayList<>(List.of("missing", "should add", "not supported", "workaround"));

        public List<String> getBugfixCategories() { return bugfixCategories; }

        public void setBugfixCategories(List<String> bugfixCategories) { this.bugfixCategories = bugfixCategories; }

        public List<String> getActionableCategories() { return actionableCategories; }

        public void setActionableCategories(List<String> actionableCategories) { this.actionableCategories = actionableCategories; }

        public List<String> getGapMarkers() { return gapMarkers; }

        public void setGapMarkers(List<String> gapMarkers) { this.gapMarkers = gapMarkers; }
    }
}
