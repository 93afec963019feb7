package com.skillgraph.audit;

import com.skillgraph.audit.config.AuditProperties;
import com.skillgraph.audit.health.HealthModels.ModuleHealth;
import com.skillgraph.audit.health.HealthModels.UpgradePriority;
import com.skillgraph.audit.health.HealthScorer;
import com.skillgraph.audit.lesson.LessonMapper;
import com.skillgraph.audit.registry.Snapshot;
import com.skillgraph.audit.usage.UsageAggregator;
import com.skillgraph.audit.usage.UsageModels.UsageResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HealthScorerTest {
    private final AuditProperties properties = RegistryFixtures.defaultProperties();
    private final HealthScorer scorer = new HealthScorer(properties);

    @Test
    void manyLessonsOnUsedModuleGiveHighPriority() {
        assertEquals(52, scorer.healthScore(30, 4));
        assertEquals(UpgradePriority.HIGH, scorer.upgradePriority(30));
    }

    @Test
    void heavilyPatchedModuleBottomsOutAndIsCritical() {
        assertEquals(0, scorer.healthScore(98, 6));
        assertEquals(UpgradePriority.CRITICAL, scorer.upgradePriority(98));
    }

    @Test
    void untouchedOrphanIsHealthyAndLow() {
        assertEquals(100, scorer.healthScore(0, 0));
        assertEquals(UpgradePriority.LOW, scorer.upgradePriority(0));
    }

    @Test
    void lessonFreeModuleIsCappedAtHundred() {
        assertEquals(100, scorer.healthScore(0, 10));
        assertEquals(UpgradePriority.LOW, scorer.upgradePriority(0));
    }

    @Test
    void scoreIsClampedAtZero() {
        assertEquals(0, scorer.healthScore(80, 0));
        assertEquals(UpgradePriority.CRITICAL, scorer.upgradePriority(80));
    }

    @Test
    void priorityThresholdsAreExclusive() {
        assertEquals(UpgradePriority.LOW, scorer.upgradePriority(10));
        assertEquals(UpgradePriority.MEDIUM, scorer.upgradePriority(11));
        assertEquals(UpgradePriority.MEDIUM, scorer.upgradePriority(25));
        assertEquals(UpgradePriority.HIGH, scorer.upgradePriority(26));
        assertEquals(UpgradePriority.HIGH, scorer.upgradePriority(50));
        assertEquals(UpgradePriority.CRITICAL, scorer.upgradePriority(51));
    }

    @Test
    void scoreNeverRisesWithLessonsNorFallsWithUsage() {
        for (int lessons = 0; lessons < 70; lessons++) {
            for (int refs = 0; refs < 40; refs++) {
                int score = scorer.healthScore(lessons, refs);
                assertTrue(score >= 0 && score <= 100);
                assertTrue(scorer.healthScore(lessons + 1, refs) <= score);
                assertTrue(scorer.healthScore(lessons, refs + 1) >= score);
            }
            assertTrue(scorer.upgradePriority(lessons + 1).compareTo(scorer.upgradePriority(lessons)) >= 0);
        }
    }

    @Test
    void honoursConfiguredPolicy() {
        AuditProperties strict = new AuditProperties();
        strict.getHealth().setLessonPenalty(10);
        strict.getHealth().setUsageBonus(0);
        strict.getHealth().setMediumThreshold(0);

        HealthScorer strictScorer = new HealthScorer(strict);
        assertEquals(70, strictScorer.healthScore(3, 5));
        assertEquals(UpgradePriority.MEDIUM, strictScorer.upgradePriority(1));
    }

    @Test
    void ordersWorstFirstAndCountsOnlyModuleLessons() {
        RegistryFixtures fixtures = RegistryFixtures.registry()
                .skill("s1", "shop")
                .skill("s2", "blog")
                .module("m1", "cart", "commerce")
                .module("m2", "search", "content")
                .module("m3", "archive", "content")
                .usesModule("s1", "cart")
                .usesModule("s2", "search")
                .usesModule("s1", "search");
        for (int i = 0; i < 12; i++) {
            fixtures.lesson("l" + i, "bugfix", "cart");
        }
        fixtures.lesson("skill-only", "bugfix", "skill:shop");
        Snapshot snapshot = fixtures.snapshot();
        UsageResult usage = new UsageAggregator().aggregate(snapshot, fixtures.resolve().resolvedEdges());

        List<ModuleHealth> health = scorer.score(usage, new LessonMapper(properties).map(snapshot).mappings());

        assertEquals(List.of("cart", "search", "archive"), health.stream().map(ModuleHealth::moduleName).toList());
        ModuleHealth cart = health.get(0);
        assertEquals(12, cart.lessonCount());
        assertEquals(79, cart.healthScore());
        assertEquals(UpgradePriority.MEDIUM, cart.upgradePriority());
    }
}
