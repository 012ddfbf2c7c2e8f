package com.williamcallahan.skillcatalog.service.ingestion;

import com.williamcallahan.skillcatalog.domain.ContentFingerprint;
import com.williamcallahan.skillcatalog.domain.HashType;
import com.williamcallahan.skillcatalog.domain.ingestion.SkillFile;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class ContentHasher {
    private static final Pattern WINDOWS_NEWLINE = Pattern.compile("\\r\\n?");
    private static final Pattern BLANK_LINE_RUNS = Pattern.compile("\\n{3,}");
    private static final Pattern TRAILING_SPACE = Pattern.compile("[ \\t]+$", Pattern.MULTILINE);
    private static final Pattern LEADING_SPACE = Pattern.compile("^[ \\t]+", Pattern.MULTILINE);

    /**
     * Generates SHA-256 hash for any text content.
     *
     * @param text The text to hash
     * @return Hexadecimal string representation of the hash
     */
    public String sha256(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Normalizes whitespace so trivially reformatted copies hash identically: unifies line
     * endings, collapses runs of blank lines, strips per-line indentation and trailing blanks.
     */
    public String normalize(String content) {
        String normalized = WINDOWS_NEWLINE.matcher(content).replaceAll("\n");
        normalized = BLANK_LINE_RUNS.matcher(normalized).replaceAll("\n\n");
        normalized = TRAILING_SPACE.matcher(normalized).replaceAll("");
        normalized = LEADING_SPACE.matcher(normalized).replaceAll("");
        return normalized.trim();
    }

    /**
     * Builds the raw and normalized fingerprints of a marker file.
     */
    public List<ContentFingerprint> fingerprints(String skillId, String markerContent) {
        return List.of(
                new ContentFingerprint(skillId, HashType.FULL, sha256(markerContent)),
                new ContentFingerprint(skillId, HashType.NORMALIZED, sha256(normalize(markerContent))));
    }

    /**
     * Hashes all cached text files in path order, so the value changes when any file changes.
     */
    public String contentHash(List<SkillFile> files) {
        StringBuilder combined = new StringBuilder();
        files.stream()
                .filter(SkillFile::isText)
                .sorted(Comparator.comparing(SkillFile::relativePath))
                .forEach(file -> combined.append(file.relativePath()).append('\n').append(file.text()).append('\n'));
        return sha256(combined.toString());
    }
}
