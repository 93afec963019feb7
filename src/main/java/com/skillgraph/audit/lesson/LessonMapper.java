package com.skillgraph.audit.lesson;

import com.skillgraph.audit.config.AuditProperties;
import com.skillgraph.audit.lesson.LessonModels.*;
import com.skillgraph.audit.registry.RegistryModels.Lesson;
import com.skillgraph.audit.registry.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Routes each lesson to the modules and skills it names and grades how urgent it is for each.
 *
 * Target names may carry a {@code module:} or {@code skill:} prefix to pick a namespace.
 * A bare name goes to the module when one exists (ambiguous names included), otherwise to the skill.
 */
@Component
public class LessonMapper {
    private static final Logger log = LoggerFactory.getLogger(LessonMapper.class);
    private static final String MODULE_PREFIX = "module:";
    private static final String SKILL_PREFIX = "skill:";

    private final AuditProperties properties;

    public LessonMapper(AuditProperties properties) {
        this.properties = properties;
    }

    public LessonMappingResult map(Snapshot snapshot) {
        Set<String> bugfix = lowerCase(properties.getLessons().getBugfixCategories());
        Set<String> actionable = lowerCase(properties.getLessons().getActionableCategories());
        List<String> markers = List.copyOf(lowerCase(properties.getLessons().getGapMarkers()));

        Map<PairKey, LessonMapping> byPair = new LinkedHashMap<>();
        List<String> unmapped = new ArrayList<>();

        for (Lesson lesson : snapshot.lessons()) {
            int before = byPair.size();
            boolean mapped = false;
            for (String raw : lesson.targets()) {
                Optional<Target> target = resolveTarget(raw, snapshot);
                if (target.isEmpty()) continue;
                mapped = true;

                Relevance relevance = classify(lesson, target.get().kind(), bugfix, actionable, markers);
                PairKey key = new PairKey(lesson.id(), target.get().name());
                LessonMapping previous = byPair.get(key);
                Relevance merged = previous == null ? relevance : previous.relevance().max(relevance);
                TargetKind kind = previous == null ? target.get().kind() : previous.targetKind();
                byPair.put(key, new LessonMapping(lesson.id(), target.get().name(), kind, merged, merged.actionNeeded()));
            }
            if (!mapped) {
                unmapped.add(lesson.id());
            }
            log.trace("Lesson {} mapped to {} targets", lesson.id(), byPair.size() - before);
        }

        return new LessonMappingResult(List.copyOf(byPair.values()), List.copyOf(unmapped));
    }

    Relevance classify(Lesson lesson, TargetKind kind, Set<String> bugfix, Set<String> actionable, List<String> markers) {
        String category = lesson.category() == null ? "" : lesson.category().trim().toLowerCase(Locale.ROOT);
        boolean isBugfix = bugfix.contains(category);
        if (isBugfix && kind == TargetKind.MODULE) {
            return Relevance.CRITICAL;
        }
        if (isBugfix || actionable.contains(category) || mentionsGap(lesson, markers)) {
            return Relevance.ACTIONABLE;
        }
        return Relevance.INFORMATIONAL;
    }

    private boolean mentionsGap(Lesson lesson, List<String> markers) {
        String text = (Objects.toString(lesson.title(), "") + "\n" + Objects.toString(lesson.content(), ""))
                .toLowerCase(Locale.ROOT);
        return markers.stream().anyMatch(text::contains);
    }

    private Optional<Target> resolveTarget(String raw, Snapshot snapshot) {
        String name = raw.trim();
        if (name.startsWith(MODULE_PREFIX)) {
            String moduleName = name.substring(MODULE_PREFIX.length()).trim();
            return snapshot.isModule(moduleName) ? Optional.of(new Target(moduleName, TargetKind.MODULE)) : Optional.empty();
        }
        if (name.startsWith(SKILL_PREFIX)) {
            String skillName = name.substring(SKILL_PREFIX.length()).trim();
            return snapshot.isSkill(skillName) ? Optional.of(new Target(skillName, TargetKind.SKILL)) : Optional.empty();
        }
        if (snapshot.isModule(name)) return Optional.of(new Target(name, TargetKind.MODULE));
        if (snapshot.isSkill(name)) return Optional.of(new Target(name, TargetKind.SKILL));
        return Optional.empty();
    }

    private Set<String> lowerCase(Collection<String> values) {
        return values.stream()
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .filter(v -> !v.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private record Target(String name, TargetKind kind) {}

    private record PairKey(String lessonId, String targetName) {}
}
