package com.williamcallahan.skillcatalog.service.ingestion;

import com.williamcallahan.skillcatalog.domain.ingestion.SkillFrontmatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Reads the YAML-like front-matter block at the top of a marker file.
 *
 * <p>Marker files in the wild are frequently not valid YAML, so this is a tolerant line parser
 * rather than a YAML library. It understands plain and quoted scalars, inline {@code [a, b]}
 * lists, dash lists, {@code |} and {@code >} block scalars, and one level of nested mapping
 * (used for {@code metadata:}). Unknown keys are ignored.</p>
 */
@Component
public class FrontmatterParser {
    private static final Pattern FRONTMATTER = Pattern.compile(
            "\\A\\uFEFF?---[ \\t]*\\r?\\n(.*?)\\r?\\n---[ \\t]*(?:\\r?\\n|\\z)", Pattern.DOTALL);
    private static final Pattern KEY_LINE = Pattern.compile("^([A-Za-z_][\\w.-]*)\\s*:(?:\\s+(.*)|\\s*)$");
    private static final Pattern HEADING = Pattern.compile("^#\\s+(.+?)\\s*#*\\s*$");
    private static final int SUMMARY_MAX_CHARS = 500;

    /**
     * Title and first paragraph of the markdown body, used when front-matter lacks name or description.
     *
     * @param title first level-one heading
     * @param paragraph first paragraph after the heading, may be empty
     */
    public record HeadingSummary(String title, String paragraph) {
    }

    /**
     * Parses front-matter fields; returns {@link SkillFrontmatter#empty()} when there is no block.
     *
     * @param content full marker file content
     * @return parsed fields
     */
    public SkillFrontmatter parse(String content) {
        if (content == null) {
            return SkillFrontmatter.empty();
        }
        Matcher matcher = FRONTMATTER.matcher(content);
        if (!matcher.find()) {
            return SkillFrontmatter.empty();
        }
        Map<String, Object> values = parseMapping(Arrays.asList(matcher.group(1).split("\\r?\\n", -1)));
        Map<String, Object> metadata = values.get("metadata") instanceof Map<?, ?> nested
                ? castMapping(nested)
                : Map.of();

        List<String> keywords = new ArrayList<>(asList(values.get("keywords")));
        keywords.addAll(asList(values.get("tags")));
        return new SkillFrontmatter(
                asScalar(values.get("name")),
                asScalar(values.get("description")),
                asScalar(values.get("category")),
                asList(values.get("categories")),
                keywords,
                asList(metadata.get("tags")),
                asScalar(metadata.get("category")),
                asList(metadata.get("categories")));
    }

    /**
     * Returns the markdown body following the front-matter block.
     */
    public String body(String content) {
        if (content == null) {
            return "";
        }
        Matcher matcher = FRONTMATTER.matcher(content);
        return matcher.find() ? content.substring(matcher.end()) : content;
    }

    /**
     * Extracts the first {@code # Heading} of the body and the paragraph following it.
     */
    public Optional<HeadingSummary> headingSummary(String content) {
        List<String> lines = body(content).lines().collect(Collectors.toList());
        for (int index = 0; index < lines.size(); index++) {
            Matcher heading = HEADING.matcher(lines.get(index).trim());
            if (!heading.matches()) {
                continue;
            }
            StringBuilder paragraph = new StringBuilder();
            for (int next = index + 1; next < lines.size(); next++) {
                String line = lines.get(next).trim();
                if (line.isEmpty()) {
                    if (paragraph.length() > 0) {
                        break;
                    }
                    continue;
                }
                if (line.startsWith("#")) {
                    break;
                }
                if (paragraph.length() > 0) {
                    paragraph.append(' ');
                }
                paragraph.append(line);
            }
            String summary = paragraph.length() > SUMMARY_MAX_CHARS
                    ? paragraph.substring(0, SUMMARY_MAX_CHARS)
                    : paragraph.toString();
            return Optional.of(new HeadingSummary(heading.group(1), summary));
        }
        return Optional.empty();
    }

    private Map<String, Object> parseMapping(List<String> lines) {
        Map<String, Object> values = new LinkedHashMap<>();
        int index = 0;
        while (index < lines.size()) {
            String line = lines.get(index);
            Matcher keyLine = KEY_LINE.matcher(line);
            if (isComment(line) || !keyLine.matches()) {
                index++;
                continue;
            }
            String key = keyLine.group(1).toLowerCase(Locale.ROOT);
            String rawValue = keyLine.group(2) == null ? "" : keyLine.group(2).trim();
            int next = index + 1;
            List<String> continuation = new ArrayList<>();
            while (next < lines.size() && isContinuation(lines.get(next))) {
                continuation.add(lines.get(next));
                next++;
            }
            values.put(key, interpret(rawValue, continuation));
            index = next;
        }
        return values;
    }

    private Object interpret(String rawValue, List<String> continuation) {
        if (rawValue.startsWith("|") || rawValue.startsWith(">")) {
            List<String> block = dedent(continuation);
            return rawValue.startsWith("|") ? literalBlock(block) : foldedBlock(block);
        }
        List<String> meaningful = continuation.stream()
                .filter(line -> !line.isBlank() && !isComment(line))
                .collect(Collectors.toList());
        if (rawValue.isEmpty()) {
            if (meaningful.isEmpty()) {
                return "";
            }
            if (meaningful.stream().allMatch(line -> line.trim().startsWith("-"))) {
                return meaningful.stream()
                        .map(line -> unquote(line.trim().substring(1).trim()))
                        .filter(item -> !item.isEmpty())
                        .collect(Collectors.toList());
            }
            return parseMapping(dedent(continuation));
        }
        if (rawValue.startsWith("[") && rawValue.endsWith("]")) {
            return Arrays.stream(rawValue.substring(1, rawValue.length() - 1).split(","))
                    .map(item -> unquote(item.trim()))
                    .filter(item -> !item.isEmpty())
                    .collect(Collectors.toList());
        }
        String scalar = unquote(rawValue);
        if (!meaningful.isEmpty()) {
            String folded = meaningful.stream().map(String::trim).collect(Collectors.joining(" "));
            scalar = scalar + " " + folded;
        }
        return scalar;
    }

    private static boolean isContinuation(String line) {
        return line.isBlank() || Character.isWhitespace(line.charAt(0)) || line.startsWith("- ") || line.equals("-");
    }

    private static boolean isComment(String line) {
        return line.trim().startsWith("#");
    }

    private static List<String> dedent(List<String> lines) {
        int indent = lines.stream()
                .filter(line -> !line.isBlank())
                .mapToInt(FrontmatterParser::leadingWhitespace)
                .min()
                .orElse(0);
        return lines.stream()
                .map(line -> line.isBlank() ? "" : line.substring(Math.min(indent, line.length())))
                .collect(Collectors.toList());
    }

    private static int leadingWhitespace(String line) {
        int count = 0;
        while (count < line.length() && (line.charAt(count) == ' ' || line.charAt(count) == '\t')) {
            count++;
        }
        return count;
    }

    private static String literalBlock(List<String> lines) {
        return String.join("\n", lines).strip();
    }

    private static String foldedBlock(List<String> lines) {
        StringBuilder folded = new StringBuilder();
        boolean paragraphBreak = false;
        for (String line : lines) {
            if (line.isBlank()) {
                paragraphBreak = folded.length() > 0;
                continue;
            }
            if (folded.length() > 0) {
                folded.append(paragraphBreak ? "\n" : " ");
            }
            folded.append(line.trim());
            paragraphBreak = false;
        }
        return folded.toString();
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if (first == '"' && last == '"') {
                return value.substring(1, value.length() - 1).replace("\\\"", "\"");
            }
            if (first == '\'' && last == '\'') {
                return value.substring(1, value.length() - 1).replace("''", "'");
            }
        }
        return value;
    }

    private static String asScalar(Object value) {
        if (value instanceof String text) {
            return text.isBlank() ? null : text;
        }
        if (value instanceof List<?> list && !list.isEmpty()) {
            return String.valueOf(list.get(0));
        }
        return null;
    }

    private static List<String> asList(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).collect(Collectors.toList());
        }
        if (value instanceof String text && !text.isBlank()) {
            return List.of(text);
        }
        return List.of();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMapping(Map<?, ?> nested) {
        return (Map<String, Object>) nested;
    }
}
