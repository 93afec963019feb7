package com.skillgraph.audit.registry;

import com.skillgraph.audit.registry.RegistryModels.*;
import com.skillgraph.audit.registry.RegistryModels.Module;

import java.util.*;

/**
 * Immutable, indexed view of one registry export. Built once per run by {@link RegistryLoader}.
 *
 * Module and skill namespaces may overlap; code blocks form a third namespace used only for hints.
 */
public final class Snapshot {
    private final List<Skill> skills;
    private final List<Module> modules;
    private final List<CodeBlock> codeBlocks;
    private final List<Lesson> lessons;
    private final List<DependencyEdge> edges;

    private final Map<String, Skill> skillsByName;
    private final Map<String, Skill> skillsById;
    private final Map<String, Module> modulesByName;
    private final Map<String, CodeBlock> codeBlocksByName;
    private final Map<String, List<DependencyEdge>> edgesBySkillId;

    Snapshot(List<Skill> skills, List<Module> modules, List<CodeBlock> codeBlocks,
             List<Lesson> lessons, List<DependencyEdge> edges) {
        this.skills = List.copyOf(skills);
        this.modules = List.copyOf(modules);
        this.codeBlocks = List.copyOf(codeBlocks);
        this.lessons = List.copyOf(lessons);
        this.edges = List.copyOf(edges);

        Map<String, Skill> byName = new LinkedHashMap<>();
        Map<String, Skill> byId = new LinkedHashMap<>();
        skills.forEach(s -> {
            byName.put(s.name(), s);
            byId.put(s.id(), s);
        });
        Map<String, Module> moduleIndex = new LinkedHashMap<>();
        modules.forEach(m -> moduleIndex.put(m.name(), m));
        Map<String, CodeBlock> blocksByName = new LinkedHashMap<>();
        codeBlocks.forEach(c -> blocksByName.putIfAbsent(c.name(), c));

        Map<String, List<DependencyEdge>> bySkill = new LinkedHashMap<>();
        skills.forEach(s -> bySkill.put(s.id(), new ArrayList<>()));
        edges.forEach(e -> bySkill.get(e.fromSkillId()).add(e));
        bySkill.replaceAll((k, v) -> List.copyOf(v));

        this.skillsByName = Collections.unmodifiableMap(byName);
        this.skillsById = Collections.unmodifiableMap(byId);
        this.modulesByName = Collections.unmodifiableMap(moduleIndex);
        this.codeBlocksByName = Collections.unmodifiableMap(blocksByName);
        this.edgesBySkillId = Collections.unmodifiableMap(bySkill);
    }

    public List<Skill> skills() { return skills; }

    public List<Module> modules() { return modules; }

    public List<CodeBlock> codeBlocks() { return codeBlocks; }

    public List<Lesson> lessons() { return lessons; }

    /** All edges in declaration order. */
    public List<DependencyEdge> edges() { return edges; }

    public List<DependencyEdge> edgesOf(String skillId) {
        return edgesBySkillId.getOrDefault(skillId, List.of());
    }

    public boolean isModule(String name) { return modulesByName.containsKey(name); }

    public boolean isSkill(String name) { return skillsByName.containsKey(name); }

    public boolean isCodeBlock(String name) { return codeBlocksByName.containsKey(name); }

    public Optional<Module> module(String name) { return Optional.ofNullable(modulesByName.get(name)); }

    public Optional<Skill> skillByName(String name) { return Optional.ofNullable(skillsByName.get(name)); }

    /** Display name of a skill id; falls back to the id itself. */
    public String skillName(String skillId) {
        Skill skill = skillsById.get(skillId);
        return skill == null ? skillId : skill.name();
    }
}
