package com.docweaver.core.util;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered set of glob patterns used to select files below a base directory.
 *
 * <p>Patterns are matched against paths relative to the base directory using
 * {@code /} separators. A pattern prefixed with {@code !} excludes files matched by
 * it. A leading {@code **}{@code /} or an inner {@code /}{@code **}{@code /} also
 * matches zero directories, so {@code **}{@code /*.js} selects {@code main.js} as
 * well as {@code lib/main.js}.
 *
 * <p>Matching files are returned grouped by the first include pattern that selects
 * them, then sorted by relative path. This lets a theme author control the read order
 * of bundled files by the order of their patterns.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * FileGlobFilter scripts = new FileGlobFilter(List.of("scripts/utils", "scripts/", "!scripts/debug.js"));
 * List<Path> files = scripts.findMatchingFiles(themeDirectory, "js");
 * // scripts/utils.js first, then the remaining scripts/*.js except debug.js
 * }</pre>
 */
public final class FileGlobFilter {

    private final List<String> patterns;

    /**
     * Creates a filter from glob patterns.
     *
     * @param patterns glob patterns; blank entries are ignored
     */
    public FileGlobFilter(List<String> patterns) {
        Objects.requireNonNull(patterns, "patterns must not be null");
        this.patterns = List.copyOf(patterns);
    }

    /**
     * Returns the patterns of this filter.
     *
     * @return immutable pattern list
     */
    public List<String> patterns() {
        return patterns;
    }

    /**
     * Returns whether the filter has no patterns.
     *
     * @return true if no patterns are defined
     */
    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    /**
     * Finds the files below {@code directory} selected by this filter.
     *
     * @param directory base directory the patterns are relative to
     * @param defaultExtension extension appended to patterns without one, or null
     * @return absolute, normalized paths of matching files without duplicates
     * @throws NoSuchFileException if the directory does not exist
     * @throws IOException if the directory cannot be traversed
     */
    public List<Path> findMatchingFiles(Path directory, String defaultExtension) throws IOException {
        Objects.requireNonNull(directory, "directory must not be null");
        if (!Files.isDirectory(directory)) {
            throw new NoSuchFileException(directory.toString(), null, "Directory does not exist");
        }

        List<List<PathMatcher>> includes = new ArrayList<>();
        List<PathMatcher> excludes = new ArrayList<>();
        FileSystem fileSystem = FileSystems.getDefault();
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                continue;
            }
            if (pattern.startsWith("!")) {
                excludes.addAll(compile(fileSystem, addExtensionIfMissing(pattern.substring(1), defaultExtension)));
            } else {
                includes.add(compile(fileSystem, addExtensionIfMissing(pattern, defaultExtension)));
            }
        }

        if (includes.isEmpty()) {
            return List.of();
        }

        Path root = directory.toAbsolutePath().normalize();
        List<Path> candidates = FileUtils.listFiles(root);
        Set<Path> matched = new LinkedHashSet<>();
        for (List<PathMatcher> include : includes) {
            for (Path candidate : candidates) {
                Path relative = Path.of(FileUtils.toUnixPath(root.relativize(candidate)));
                if (matchesAny(include, relative) && !matchesAny(excludes, relative)) {
                    matched.add(candidate);
                }
            }
        }
        return List.copyOf(matched);
    }

    /**
     * Appends {@code extension} to a pattern whose last segment has no extension.
     *
     * <p>A pattern ending with {@code /} becomes {@code /*.ext}; a pattern ending with
     * {@code **} becomes {@code **}{@code /*.ext}.
     *
     * @param pattern glob pattern
     * @param extension extension with or without leading dot, or null
     * @return pattern with the extension applied
     */
    public static String addExtensionIfMissing(String pattern, String extension) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        if (extension == null || extension.isEmpty()) {
            return pattern;
        }

        String dotted = extension.startsWith(".") ? extension : "." + extension;
        if (pattern.endsWith("/")) {
            return pattern + "*" + dotted;
        }
        if (pattern.endsWith("**")) {
            return pattern + "/*" + dotted;
        }
        if (pattern.indexOf('.', pattern.lastIndexOf('/') + 1) == -1) {
            return pattern + dotted;
        }
        return pattern;
    }

    private static List<PathMatcher> compile(FileSystem fileSystem, String pattern) {
        String normalized = pattern.replace('\\', '/');
        if (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }

        Set<String> variants = new LinkedHashSet<>();
        variants.add(normalized);
        if (normalized.startsWith("**/")) {
            variants.add(normalized.substring(3));
        }
        if (normalized.contains("/**/")) {
            variants.add(normalized.replace("/**/", "/"));
        }

        List<PathMatcher> matchers = new ArrayList<>();
        for (String variant : variants) {
            matchers.add(fileSystem.getPathMatcher("glob:" + variant));
        }
        return matchers;
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path relative) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(relative)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return patterns.toString();
    }
}
