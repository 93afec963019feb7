package com.skillgraph.audit.lesson;

import java.util.List;

public class LessonModels {
    public enum TargetKind { MODULE, SKILL }

    /** Declared in ascending order of urgency. */
    public enum Relevance {
        INFORMATIONAL, ACTIONABLE, CRITICAL;

        public boolean actionNeeded() {
            return this != INFORMATIONAL;
        }

        public Relevance max(Relevance other) {
            return compareTo(other) >= 0 ? this : other;
        }
    }

    public record LessonMapping(String lessonId, String targetName, TargetKind targetKind,
                                Relevance relevance, boolean actionNeeded) {}

    public record LessonMappingResult(List<LessonMapping> mappings, List<String> unmappedLessonIds) {

        public int lessonCount(String moduleName) {
            return (int) mappings.stream()
                    .filter(m -> m.targetKind() == TargetKind.MODULE && m.targetName().equals(moduleName))
                    .count();
        }
    }
}
