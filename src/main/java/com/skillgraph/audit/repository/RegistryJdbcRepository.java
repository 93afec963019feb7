package com.skillgraph.audit.repository;

import com.skillgraph.audit.registry.RegistryLoadException;
import com.skillgraph.audit.registry.RegistryLoadException.Kind;
import com.skillgraph.audit.registry.RegistryLoadException.LoadIssue;
import com.skillgraph.audit.registry.RegistryModels.*;
import com.skillgraph.audit.registry.RegistryModels.Module;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Reads a registry export out of the relational catalog. Read-only: the audit never writes back.
 */
@Repository
public class RegistryJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public RegistryJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public RegistryExport loadExport() {
        return new RegistryExport(loadSkills(), loadModules(), loadCodeBlocks(), loadLessons(), loadEdges());
    }

    public List<Skill> loadSkills() {
        return jdbcTemplate.query(
                "SELECT id, name, description, kind FROM skills ORDER BY id",
                (rs, n) -> new Skill(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), 0));
    }

    public List<Module> loadModules() {
        return jdbcTemplate.query(
                "SELECT id, name, description, COALESCE(category, 'uncategorized'), COALESCE(status, 'active') FROM modules ORDER BY id",
                (rs, n) -> new Module(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5), 0));
    }

    public List<CodeBlock> loadCodeBlocks() {
        return jdbcTemplate.query(
                "SELECT id, name, language, tags FROM code_blocks ORDER BY id",
                (rs, n) -> new CodeBlock(rs.getString(1), rs.getString(2), rs.getString(3), csv(rs.getString(4)), 0));
    }

    public List<Lesson> loadLessons() {
        Map<String, List<String>> targets = jdbcTemplate.query(
                        "SELECT lesson_id, target_name FROM lesson_targets ORDER BY lesson_id, position",
                        (rs, n) -> new LessonTargetRow(rs.getString(1), rs.getString(2)))
                .stream()
                .collect(Collectors.groupingBy(LessonTargetRow::lessonId, LinkedHashMap::new,
                        Collectors.mapping(LessonTargetRow::targetName, Collectors.toList())));

        return jdbcTemplate.query(
                "SELECT id, title, content, category, source_project FROM lessons ORDER BY id",
                (rs, n) -> new Lesson(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5),
                        targets.getOrDefault(rs.getString(1), List.of()), 0));
    }

    /**
     * @throws RegistryLoadException when a row carries an unknown strength token
     */
    public List<DependencyEdge> loadEdges() {
        List<LoadIssue> issues = new ArrayList<>();
        List<DependencyEdge> edges = new ArrayList<>();
        edges.addAll(jdbcTemplate.query(
                "SELECT skill_id, module_name, strength FROM skill_module_deps ORDER BY skill_id, position",
                (rs, n) -> edge(rs.getString(1), rs.getString(2), DeclaredKind.MODULE, rs.getString(3), issues)));
        edges.addAll(jdbcTemplate.query(
                "SELECT skill_id, skill_name, strength FROM skill_skill_deps ORDER BY skill_id, position",
                (rs, n) -> edge(rs.getString(1), rs.getString(2), DeclaredKind.SKILL, rs.getString(3), issues)));
        if (!issues.isEmpty()) {
            throw new RegistryLoadException(issues);
        }
        return edges;
    }

    private DependencyEdge edge(String skillId, String target, DeclaredKind kind, String strength, List<LoadIssue> issues) {
        try {
            return new DependencyEdge(skillId, target, kind, Strength.parse(strength), 0);
        } catch (IllegalArgumentException e) {
            issues.add(new LoadIssue(Kind.MALFORMED_RECORD, "dependency", skillId, 0,
                    e.getMessage() + " (target " + target + ")"));
            return null;
        }
    }

    private List<String> csv(String value) {
        if (value == null || value.isBlank()) return List.of();
        return Arrays.stream(value.split(",")).map(String::trim).filter(v -> !v.isEmpty()).toList();
    }

    public record LessonTargetRow(String lessonId, String targetName) {}
}
