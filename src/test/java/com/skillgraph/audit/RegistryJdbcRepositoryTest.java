package com.skillgraph.audit;

import com.skillgraph.audit.registry.RegistryLoadException;
import com.skillgraph.audit.registry.RegistryModels.DeclaredKind;
import com.skillgraph.audit.registry.RegistryModels.RegistryExport;
import com.skillgraph.audit.registry.RegistryModels.Strength;
import com.skillgraph.audit.repository.RegistryJdbcRepository;
import com.skillgraph.audit.service.AuditService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Transactional
class RegistryJdbcRepositoryTest {
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private RegistryJdbcRepository repository;

    @Autowired
    private AuditService auditService;

    @Test
    void readsCatalogTablesIntoExport() {
        jdbcTemplate.update("INSERT INTO skills(id, name, description, kind) VALUES ('s1', 'wp-deploy', 'Deploy', 'guide')");
        jdbcTemplate.update("INSERT INTO skills(id, name, description, kind) VALUES ('s2', 'seo-audit', NULL, 'checklist')");
        jdbcTemplate.update("INSERT INTO modules(id, name, description, category, status) VALUES ('m1', 'ssh-runner', NULL, 'deployment', 'stable')");
        jdbcTemplate.update("INSERT INTO modules(id, name, description, category, status) VALUES ('m2', 'legacy', NULL, NULL, NULL)");
        jdbcTemplate.update("INSERT INTO code_blocks(id, name, language, tags) VALUES ('c1', 'retry-loop', 'php', 'http, retry')");
        jdbcTemplate.update("INSERT INTO lessons(id, title, content, category, source_project) VALUES ('l1', 'Keys rotate', 'text', 'bugfix', 'acme')");
        jdbcTemplate.update("INSERT INTO lesson_targets(lesson_id, target_name, position) VALUES ('l1', 'skill:wp-deploy', 2)");
        jdbcTemplate.update("INSERT INTO lesson_targets(lesson_id, target_name, position) VALUES ('l1', 'ssh-runner', 1)");
        jdbcTemplate.update("INSERT INTO skill_module_deps(skill_id, module_name, strength, position) VALUES ('s1', 'ssh-runner', 'R', 0)");
        jdbcTemplate.update("INSERT INTO skill_module_deps(skill_id, module_name, strength, position) VALUES ('s1', 'ghost', 'D', 1)");
        jdbcTemplate.update("INSERT INTO skill_skill_deps(skill_id, skill_name, strength, position) VALUES ('s1', 'seo-audit', 'O', 0)");

        RegistryExport export = repository.loadExport();

        assertEquals(2, export.skills().size());
        assertEquals("uncategorized", export.modules().get(1).category());
        assertEquals("active", export.modules().get(1).status());
        assertEquals(List.of("http", "retry"), export.codeBlocks().get(0).tags());
        assertEquals(List.of("ssh-runner", "skill:wp-deploy"), export.lessons().get(0).targets());
        assertEquals(3, export.edges().size());
        assertEquals(Strength.OPTIONAL, export.edges().get(1).strength());
        assertEquals(DeclaredKind.SKILL, export.edges().get(2).declaredKind());

        var report = auditService.run(export, auditService.defaultOptions()).report();
        assertEquals(1, report.missingReferences().size());
        assertEquals(1, report.summary().orphanModules());
    }

    @Test
    void unknownStrengthInCatalogIsReportedAsMalformedRecord() {
        jdbcTemplate.update("INSERT INTO skills(id, name, description, kind) VALUES ('s1', 'wp-deploy', NULL, 'guide')");
        jdbcTemplate.update("INSERT INTO skill_module_deps(skill_id, module_name, strength, position) VALUES ('s1', 'ssh-runner', 'X', 0)");

        RegistryLoadException e = assertThrows(RegistryLoadException.class, () -> repository.loadExport());

        assertEquals(RegistryLoadException.Kind.MALFORMED_RECORD, e.getKind());
        RegistryLoadException.LoadIssue issue = e.getIssues().get(0);
        assertEquals("dependency", issue.recordKind());
        assertEquals("s1", issue.recordId());
        assertTrue(issue.describe().contains("ssh-runner"));
    }

    @Test
    void emptyCatalogGivesEmptyExport() {
        RegistryExport export = repository.loadExport();
        assertTrue(export.skills().isEmpty());
        assertTrue(export.edges().isEmpty());
    }
}
