package com.skillgraph.audit;

import com.skillgraph.audit.config.AuditProperties;
import com.skillgraph.audit.consistency.ConsistencyChecker;
import com.skillgraph.audit.consistency.ConsistencyModels.ConsistencyResult;
import com.skillgraph.audit.graph.DependencyGraphBuilder;
import com.skillgraph.audit.registry.RegistryLoader;
import com.skillgraph.audit.registry.RegistryModels.*;
import com.skillgraph.audit.registry.RegistryModels.Module;
import com.skillgraph.audit.registry.Snapshot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Small builder for registry exports used across tests. */
final class RegistryFixtures {
    private final List<Skill> skills = new ArrayList<>();
    private final List<Module> modules = new ArrayList<>();
    private final List<CodeBlock> codeBlocks = new ArrayList<>();
    private final List<Lesson> lessons = new ArrayList<>();
    private final List<DependencyEdge> edges = new ArrayList<>();

    static RegistryFixtures registry() {
        return new RegistryFixtures();
    }

    RegistryFixtures skill(String id, String name) {
        skills.add(new Skill(id, name, "", "guide", 0));
        return this;
    }

    RegistryFixtures module(String id, String name, String category) {
        modules.add(new Module(id, name, "", category, "active", 0));
        return this;
    }

    RegistryFixtures codeBlock(String id, String name) {
        codeBlocks.add(new CodeBlock(id, name, "php", List.of(), 0));
        return this;
    }

    RegistryFixtures lesson(String id, String category, String... targets) {
        lessons.add(new Lesson(id, "Lesson " + id, "", category, "field", Arrays.asList(targets), 0));
        return this;
    }

    RegistryFixtures lessonWithText(String id, String title, String content, String category, String... targets) {
        lessons.add(new Lesson(id, title, content, category, "field", Arrays.asList(targets), 0));
        return this;
    }

    RegistryFixtures usesModule(String skillId, String target) {
        edges.add(new DependencyEdge(skillId, target, DeclaredKind.MODULE, Strength.REQUIRED, 0));
        return this;
    }

    RegistryFixtures usesModuleOptionally(String skillId, String target) {
        edges.add(new DependencyEdge(skillId, target, DeclaredKind.MODULE, Strength.OPTIONAL, 0));
        return this;
    }

    RegistryFixtures usesSkill(String skillId, String target) {
        edges.add(new DependencyEdge(skillId, target, DeclaredKind.SKILL, Strength.REQUIRED, 0));
        return this;
    }

    RegistryExport export() {
        return new RegistryExport(List.copyOf(skills), List.copyOf(modules), List.copyOf(codeBlocks),
                List.copyOf(lessons), List.copyOf(edges));
    }

    Snapshot snapshot() {
        return new RegistryLoader().load(export());
    }

    ConsistencyResult resolve() {
        Snapshot snapshot = snapshot();
        return new ConsistencyChecker().check(snapshot, new DependencyGraphBuilder().build(snapshot).graph());
    }

    static AuditProperties defaultProperties() {
        return new AuditProperties();
    }
}
