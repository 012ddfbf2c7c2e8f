package com.williamcallahan.skillcatalog.service.ingestion;

import java.util.Locale;
import java.util.Set;

/**
 * Decides from a file name whether its content is cached as text.
 */
public final class TextFileDetector {
    private static final Set<String> TEXT_EXTENSIONS = Set.of(
            "md", "mdx", "markdown", "txt", "rst", "adoc",
            "json", "jsonc", "yaml", "yml", "toml", "xml", "csv", "ini", "cfg", "conf", "env",
            "js", "mjs", "cjs", "ts", "tsx", "jsx", "py", "rb", "go", "rs", "java", "kt", "kts", "scala",
            "c", "h", "cpp", "hpp", "cs", "swift", "php", "lua", "r", "pl", "sql", "graphql",
            "sh", "bash", "zsh", "fish", "ps1", "bat",
            "html", "htm", "css", "scss", "sass", "less", "svelte", "vue", "svg");
    private static final Set<String> TEXT_FILE_NAMES = Set.of(
            "dockerfile", "makefile", "readme", "license", "licence", "changelog", "contributing",
            "gemfile", "procfile", "rakefile", ".gitignore", ".editorconfig", ".env.example");

    private TextFileDetector() {}

    /**
     * Returns true for well-known text extensions and file names.
     *
     * @param path file path; only the last segment is inspected
     */
    public static boolean isTextFile(String path) {
        String fileName = path.substring(path.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
        if (TEXT_FILE_NAMES.contains(fileName)) {
            return true;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return TEXT_FILE_NAMES.contains(fileName);
        }
        return TEXT_EXTENSIONS.contains(fileName.substring(dot + 1));
    }

    /**
     * Returns true when any directory segment of the path starts with a dot.
     */
    public static boolean isUnderHiddenDirectory(String path) {
        if (path == null || path.isEmpty()) {
            return false;
        }
        String[] segments = path.split("/");
        for (int index = 0; index < segments.length - 1; index++) {
            if (segments[index].startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
