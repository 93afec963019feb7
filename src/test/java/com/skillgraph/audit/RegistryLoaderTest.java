package com.skillgraph.audit;

import com.skillgraph.audit.registry.RegistryExportParser;
import com.skillgraph.audit.registry.RegistryLoadException;
import com.skillgraph.audit.registry.RegistryLoader;
import com.skillgraph.audit.registry.RegistryModels.DeclaredKind;
import com.skillgraph.audit.registry.RegistryModels.Strength;
import com.skillgraph.audit.registry.Snapshot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegistryLoaderTest {
    private final RegistryExportParser parser = new RegistryExportParser();
    private final RegistryLoader loader = new RegistryLoader();

    @Test
    void parsesAllRecordKindsIntoSnapshot() {
        String export = """
                # toolkit registry
                @skill id="s1" name="wp-deploy" kind="guide"
                Deploys a WordPress site
                over SSH.
                @module id="m1" name="ssh-runner" category="deployment" status="stable"
                @module id="m2" name="cache-purge" category="deployment"
                @codeblock id="c1" name="retry-loop" language="php" tags="http, retry"
                @module_dep skill="s1" target="ssh-runner" strength="R"
                @module_dep skill="s1" target="cache-purge" strength="D"
                @skill_dep skill="s1" target="batch-processing" strength="O"
                @lesson id="l1" title="Purge fails on multisite" category="bugfix" project="acme" targets="cache-purge,skill:wp-deploy"
                Purging must loop over every blog id.
                """;

        var parsed = parser.parse(export);
        assertTrue(parsed.errors().isEmpty(), () -> parsed.errors().toString());

        Snapshot snapshot = loader.load(parsed.export());
        assertEquals("Deploys a WordPress site\nover SSH.", snapshot.skillByName("wp-deploy").orElseThrow().description());
        assertTrue(snapshot.isModule("ssh-runner"));
        assertTrue(snapshot.isCodeBlock("retry-loop"));
        assertEquals(List.of("http", "retry"), snapshot.codeBlocks().get(0).tags());
        assertEquals("deployment", snapshot.module("cache-purge").orElseThrow().category());
        assertEquals("active", snapshot.module("cache-purge").orElseThrow().status());

        var edges = snapshot.edgesOf("s1");
        assertEquals(3, edges.size());
        assertEquals(Strength.OPTIONAL, edges.get(1).strength());
        assertEquals(DeclaredKind.SKILL, edges.get(2).declaredKind());
        assertEquals(List.of("cache-purge", "skill:wp-deploy"), snapshot.lessons().get(0).targets());
        assertEquals("Purging must loop over every blog id.", snapshot.lessons().get(0).content());
    }

    @Test
    void reportsSyntaxErrorsWithLineNumbers() {
        String export = """
                @skill id="s1" name="a"
                @widget id="w1"
                @module_dep skill="s1" target="m" strength="sometimes"
                @module id="m1" name="m" bogus
                """;

        var parsed = parser.parse(export);
        assertEquals(3, parsed.errors().size());
        assertTrue(parsed.errors().stream().allMatch(e -> e.kind() == RegistryLoadException.Kind.MALFORMED_RECORD));
        assertTrue(parsed.errors().stream().anyMatch(e -> e.line() == 2 && e.message().contains("@widget")));
        assertTrue(parsed.errors().stream().anyMatch(e -> e.line() == 3 && e.message().contains("sometimes")));
        assertTrue(parsed.errors().stream().anyMatch(e -> e.line() == 4 && e.message().contains("bogus")));
    }

    @Test
    void keepsAtAndHashLinesInsideLessonAndDescriptionBodies() {
        String export = """
                # toolkit registry
                @module id="m1" name="responsive-grid" category="css"
                Breakpoints for the grid.
                @media (max-width: 600px) collapses to one column
                @lesson id="l1" title="Grid on phones" category="pattern" targets="responsive-grid"
                Wrap rules in
                @media (max-width: 600px) { ... }
                # Heading from the field notes
                @param width is ignored
                \\@module is literal text here
                @skill id="s1" name="css-audit"
                """;

        var parsed = parser.parse(export);
        assertTrue(parsed.errors().isEmpty(), () -> parsed.errors().toString());

        Snapshot snapshot = loader.load(parsed.export());
        assertEquals("Breakpoints for the grid.\n@media (max-width: 600px) collapses to one column",
                snapshot.module("responsive-grid").orElseThrow().description());
        assertEquals("Wrap rules in\n@media (max-width: 600px) { ... }\n# Heading from the field notes\n"
                        + "@param width is ignored\n@module is literal text here",
                snapshot.lessons().get(0).content());
        assertTrue(snapshot.isSkill("css-audit"));
    }

    @Test
    void unknownMarkerWithAttributesInsideBodyIsStillRejected() {
        var parsed = parser.parse("""
                @skill id="s1" name="a"
                Some description.
                @widget id="w1" size="large"
                """);

        assertEquals(1, parsed.errors().size());
        assertEquals(3, parsed.errors().get(0).line());
        assertTrue(parsed.errors().get(0).message().contains("@widget"));
    }

    @Test
    void rejectsDuplicateIdsWithinOneKind() {
        var export = RegistryFixtures.registry()
                .skill("s1", "alpha")
                .module("m1", "cache", "perf")
                .module("m1", "queue", "perf")
                .export();

        RegistryLoadException e = assertThrows(RegistryLoadException.class, () -> loader.load(export));
        assertEquals(RegistryLoadException.Kind.DUPLICATE_RECORD, e.getKind());
        assertEquals(2, e.getIssues().size());
        assertTrue(e.getMessage().contains("module m1"));
    }

    @Test
    void allowsSameIdAcrossKindsAndSameNameAsModuleAndSkill() {
        Snapshot snapshot = RegistryFixtures.registry()
                .skill("x1", "batch-processing")
                .module("x1", "batch-processing", "data")
                .snapshot();

        assertTrue(snapshot.isModule("batch-processing"));
        assertTrue(snapshot.isSkill("batch-processing"));
    }

    @Test
    void rejectsRecordsWithoutNameOrIdAndEdgesFromUnknownSkills() {
        var export = RegistryFixtures.registry()
                .skill("s1", "")
                .module(null, "cache", "perf")
                .usesModule("ghost", "cache")
                .export();

        RegistryLoadException e = assertThrows(RegistryLoadException.class, () -> loader.load(export));
        assertEquals(RegistryLoadException.Kind.MALFORMED_RECORD, e.getKind());
        assertTrue(e.getIssues().stream().anyMatch(i -> i.message().equals("skill.name required")));
        assertTrue(e.getIssues().stream().anyMatch(i -> i.message().equals("module.id required")));
        assertTrue(e.getIssues().stream().anyMatch(i -> i.message().contains("unknown skill id: ghost")));
    }
}
