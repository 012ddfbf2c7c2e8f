package com.williamcallahan.skillcatalog.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Natural identity of a catalog record: repository owner, repository name and optional subpath.
 *
 * <p>Owner and name are normalized to lowercase so discovery events and user submissions that
 * differ only in case converge on the same record. The subpath keeps its case because it names
 * a directory inside the repository, and is stored without leading or trailing slashes; the
 * empty string denotes a skill at the repository root.</p>
 *
 * @param owner repository owner or organization
 * @param name repository name
 * @param skillPath directory of the skill inside the repository, or empty for the root
 */
public record RepositoryIdentity(String owner, String name, String skillPath) {
    private static final String TOKEN_PATTERN = "[a-z0-9._-]+";

    public RepositoryIdentity {
        owner = normalizeToken(owner, "owner");
        name = normalizeToken(name, "name");
        skillPath = normalizePath(skillPath);
    }

    /**
     * Creates an identity for a skill at the repository root.
     */
    public static RepositoryIdentity of(String owner, String name) {
        return new RepositoryIdentity(owner, name, "");
    }

    /**
     * Creates an identity for a skill in a repository subdirectory.
     */
    public static RepositoryIdentity of(String owner, String name, String skillPath) {
        return new RepositoryIdentity(owner, name, skillPath);
    }

    /**
     * Returns {@code owner/name}.
     */
    public String repoKey() {
        return owner + "/" + name;
    }

    /**
     * Returns the repository's HTTPS URL.
     */
    public String repoUrl() {
        return "https://github.com/" + repoKey();
    }

    public boolean hasSkillPath() {
        return !skillPath.isEmpty();
    }

    /**
     * Returns the path prefix that marker files are resolved against: empty for the root,
     * otherwise the subpath followed by a slash.
     */
    public String markerBasePath() {
        return hasSkillPath() ? skillPath + "/" : "";
    }

    /**
     * Returns the blob-store prefix under which this skill's files are cached.
     */
    public String blobPrefix() {
        String prefix = "skills/" + owner + "/" + name;
        return hasSkillPath() ? prefix + "/" + skillPath : prefix;
    }

    /**
     * Returns a human readable key including the subpath when present.
     */
    public String displayKey() {
        return hasSkillPath() ? repoKey() + "/" + skillPath : repoKey();
    }

    private static String normalizeToken(String rawToken, String tokenName) {
        Objects.requireNonNull(rawToken, tokenName);
        String normalizedToken = rawToken.trim().toLowerCase(Locale.ROOT);
        if (normalizedToken.isBlank()) {
            throw new IllegalArgumentException(tokenName + " must not be blank");
        }
        if (!normalizedToken.matches(TOKEN_PATTERN)) {
            throw new IllegalArgumentException(tokenName + " contains unsupported characters: " + rawToken);
        }
        return normalizedToken;
    }

    private static String normalizePath(String rawPath) {
        if (rawPath == null) {
            return "";
        }
        List<String> segments = Arrays.stream(rawPath.trim().replace('\\', '/').split("/"))
                .filter(segment -> !segment.isBlank() && !segment.equals("."))
                .collect(Collectors.toList());
        if (segments.contains("..")) {
            throw new IllegalArgumentException("skillPath must not traverse upwards: " + rawPath);
        }
        return String.join("/", segments);
    }
}
