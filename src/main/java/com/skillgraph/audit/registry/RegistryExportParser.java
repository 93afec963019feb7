package com.skillgraph.audit.registry;

import com.skillgraph.audit.registry.RegistryLoadException.Kind;
import com.skillgraph.audit.registry.RegistryLoadException.LoadIssue;
import com.skillgraph.audit.registry.RegistryModels.Module;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.skillgraph.audit.registry.RegistryModels.*;

/**
 * Parses the line-oriented registry export.
 *
 * <pre>
 * # comment
 * &#64;skill id="s-1" name="wp-deploy" kind="guide"
 * Deploys a WordPress site.
 * &#64;module id="m-1" name="ssh-runner" category="deployment" status="stable"
 * &#64;module_dep skill="s-1" target="ssh-runner" strength="R"
 * &#64;skill_dep skill="s-1" target="batch-processing" strength="O"
 * &#64;codeblock id="c-1" name="retry-loop" language="php" tags="http,retry"
 * &#64;lesson id="l-1" title="..." category="bugfix" project="acme" targets="ssh-runner,skill:wp-deploy"
 * lesson body
 * </pre>
 *
 * Body lines after a marker become the record's description (skill, module) or content (lesson).
 * Inside such a body, {@code #} lines are kept as text and a leading {@code \@} escapes a line that
 * would otherwise read as a marker. Elsewhere {@code #} starts a comment.
 */
@Component
public class RegistryExportParser {
    private static final Pattern MARKER_PATTERN = Pattern.compile("^@([a-z][a-z0-9_]*)\\s*(.*)$");
    private static final Pattern ATTR_PATTERN = Pattern.compile("([a-z][a-z0-9_]*)=\"((?:\\\\.|[^\"\\\\])*)\"");

    private static final Set<String> MARKERS = Set.of("skill", "module", "codeblock", "lesson", "module_dep", "skill_dep");
    private static final Set<String> BODY_MARKERS = Set.of("skill", "module", "lesson");

    public ParseResult parse(String content) {
        List<LoadIssue> errors = new ArrayList<>();
        List<String> lines = Arrays.asList(content.split("\\R", -1));
        Records records = new Records();

        String pendingMarker = null;
        Map<String, String> pendingAttrs = Map.of();
        int pendingLine = -1;
        StringBuilder body = new StringBuilder();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int lineNo = i + 1;
            String trimmed = line.trim();
            boolean bodyOpen = pendingMarker != null && BODY_MARKERS.contains(pendingMarker);
            if (trimmed.startsWith("#") && !bodyOpen) continue;

            Matcher markerMatcher = MARKER_PATTERN.matcher(trimmed);
            if (markerMatcher.matches() && (!bodyOpen || isRecordLine(markerMatcher.group(1), markerMatcher.group(2)))) {
                flushPending(pendingMarker, pendingAttrs, pendingLine, body.toString().trim(), records, errors);

                pendingMarker = markerMatcher.group(1);
                pendingAttrs = parseAttrs(markerMatcher.group(2), lineNo, pendingMarker, errors);
                pendingLine = lineNo;
                body.setLength(0);
            } else if (pendingMarker != null && !trimmed.isEmpty()) {
                if (body.length() > 0) body.append("\n");
                body.append(trimmed.startsWith("\\@") ? trimmed.substring(1) : trimmed);
            } else if (!trimmed.isEmpty()) {
                errors.add(new LoadIssue(Kind.MALFORMED_RECORD, "line", null, lineNo, "Text outside of any record"));
            }
        }

        flushPending(pendingMarker, pendingAttrs, pendingLine, body.toString().trim(), records, errors);

        RegistryExport export = new RegistryExport(records.skills, records.modules, records.codeBlocks,
                records.lessons, records.edges);
        return new ParseResult(export, errors);
    }

    /**
     * Inside a body, an {@code @word} line starts a new record only for a known marker, or when
     * everything after the word is {@code key="value"} attributes. Anything else stays body text.
     */
    private boolean isRecordLine(String marker, String rest) {
        if (MARKERS.contains(marker)) return true;
        return !rest.isBlank() && ATTR_PATTERN.matcher(rest).replaceAll("").isBlank();
    }

    private Map<String, String> parseAttrs(String attrsStr, int line, String marker, List<LoadIssue> errors) {
        Map<String, String> attrs = new HashMap<>();
        Matcher matcher = ATTR_PATTERN.matcher(attrsStr);
        while (matcher.find()) {
            attrs.put(matcher.group(1), unescape(matcher.group(2), line, marker, errors));
        }

        String rest = ATTR_PATTERN.matcher(attrsStr).replaceAll("").trim();
        if (!rest.isEmpty()) {
            errors.add(new LoadIssue(Kind.MALFORMED_RECORD, marker, attrs.get("id"), line, "Cannot parse attributes: " + rest));
        }
        return attrs;
    }

    private String unescape(String raw, int line, String marker, List<LoadIssue> errors) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\\') {
                if (i + 1 >= raw.length()) {
                    errors.add(new LoadIssue(Kind.MALFORMED_RECORD, marker, null, line, "Dangling escape"));
                    break;
                }
                char n = raw.charAt(++i);
                switch (n) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> {
                        errors.add(new LoadIssue(Kind.MALFORMED_RECORD, marker, null, line, "Unknown escape: \\" + n));
                        sb.append(n);
                    }
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private void flushPending(String marker, Map<String, String> attrs, int line, String body,
                              Records records, List<LoadIssue> errors) {
        if (marker == null) return;

        switch (marker) {
            case "skill" -> records.skills.add(new Skill(attrs.get("id"), attrs.get("name"), body, attrs.get("kind"), line));
            case "module" -> records.modules.add(new Module(attrs.get("id"), attrs.get("name"), body,
                    attrs.getOrDefault("category", "uncategorized"), attrs.getOrDefault("status", "active"), line));
            case "codeblock" -> records.codeBlocks.add(new CodeBlock(attrs.get("id"), attrs.get("name"),
                    attrs.get("language"), csv(attrs.get("tags")), line));
            case "lesson" -> records.lessons.add(new Lesson(attrs.get("id"), attrs.get("title"), body,
                    attrs.get("category"), attrs.get("project"), csv(attrs.get("targets")), line));
            case "module_dep" -> addEdge(DeclaredKind.MODULE, marker, attrs, line, records, errors);
            case "skill_dep" -> addEdge(DeclaredKind.SKILL, marker, attrs, line, records, errors);
            default -> errors.add(new LoadIssue(Kind.MALFORMED_RECORD, marker, attrs.get("id"), line, "Unsupported marker @" + marker));
        }
    }

    private void addEdge(DeclaredKind kind, String marker, Map<String, String> attrs, int line,
                         Records records, List<LoadIssue> errors) {
        Strength strength;
        try {
            strength = Strength.parse(attrs.get("strength"));
        } catch (IllegalArgumentException e) {
            errors.add(new LoadIssue(Kind.MALFORMED_RECORD, marker, attrs.get("skill"), line, e.getMessage()));
            return;
        }
        records.edges.add(new DependencyEdge(attrs.get("skill"), attrs.get("target"), kind, strength, line));
    }

    private List<String> csv(String value) {
        if (value == null || value.isBlank()) return List.of();
        return Arrays.stream(value.split(",")).map(String::trim).filter(v -> !v.isEmpty()).toList();
    }

    private static final class Records {
        private final List<Skill> skills = new ArrayList<>();
        private final List<Module> modules = new ArrayList<>();
        private final List<CodeBlock> codeBlocks = new ArrayList<>();
        private final List<Lesson> lessons = new ArrayList<>();
        private final List<DependencyEdge> edges = new ArrayList<>();
    }

    public record ParseResult(RegistryExport export, List<LoadIssue> errors) {}
}
