package com.skillgraph.audit.registry;

import java.util.List;
import java.util.Locale;

public class RegistryModels {
    public record Skill(String id, String name, String description, String kind, int line) {}

    public record Module(String id, String name, String description, String category, String status, int line) {}

    public record CodeBlock(String id, String name, String language, List<String> tags, int line) {}

    public record Lesson(String id, String title, String content, String category, String sourceProject,
                         List<String> targets, int line) {}

    public record DependencyEdge(String fromSkillId, String targetName, DeclaredKind declaredKind,
                                 Strength strength, int line) {}

    public record RegistryExport(List<Skill> skills,
                                 List<Module> modules,
                                 List<CodeBlock> codeBlocks,
                                 List<Lesson> lessons,
                                 List<DependencyEdge> edges) {}

    public enum DeclaredKind {
        MODULE, SKILL;

        public DeclaredKind other() {
            return this == MODULE ? SKILL : MODULE;
        }
    }

    public enum Strength {
        REQUIRED, OPTIONAL;

        /**
         * Registry exports mark dependencies as R (required), O (optional) or D (deferred).
         * Optional and deferred are treated alike.
         */
        public static Strength parse(String token) {
            if (token == null || token.isBlank()) return REQUIRED;
            return switch (token.trim().toLowerCase(Locale.ROOT)) {
                case "r", "required" -> REQUIRED;
                case "o", "optional", "d", "deferred" -> OPTIONAL;
                default -> throw new IllegalArgumentException("Unknown dependency strength: " + token);
            };
        }

        public String marker() {
            return this == REQUIRED ? "R" : "O";
        }
    }
}
