package com.docweaver.core.theme;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Accumulates script or style bundles across the themes of an inheritance chain.
 *
 * <p>Unlike templates and assets, bundles are never replaced: when a theme declares a
 * target path that already has files, its own files are appended after the existing
 * ones, skipping any source path already present. Target paths compare
 * case-insensitively; a new target path starts an independent bundle. Since themes are
 * merged most-derived first, the most-derived theme's files come first in each bundle.
 */
public class BundleResolver {

    private final TreeMap<String, List<Path>> bundles = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    /**
     * Merges the files one theme declares for a target path.
     *
     * <p>Nothing is recorded for a target path that ends up without files.
     *
     * @param targetPath bundle output path
     * @param sourceFiles absolute source paths in read order
     */
    public void merge(String targetPath, List<Path> sourceFiles) {
        Objects.requireNonNull(targetPath, "targetPath must not be null");
        Objects.requireNonNull(sourceFiles, "sourceFiles must not be null");

        Set<Path> files = new LinkedHashSet<>(bundles.getOrDefault(targetPath, List.of()));
        files.addAll(sourceFiles);
        if (!files.isEmpty()) {
            bundles.put(targetPath, List.copyOf(files));
        }
    }

    /**
     * Returns a snapshot of the accumulated bundles.
     *
     * @return immutable map from target path to its ordered source files
     */
    public SortedMap<String, List<Path>> toMap() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(bundles));
    }

    /**
     * Returns the number of distinct bundles.
     *
     * @return bundle count
     */
    public int size() {
        return bundles.size();
    }

    @Override
    public String toString() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        bundles.forEach((target, files) -> counts.put(target, files.size()));
        return "BundleResolver" + counts;
    }
}
