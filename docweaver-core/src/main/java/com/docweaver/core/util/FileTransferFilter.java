package com.docweaver.core.util;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Glob patterns selecting source files together with the path they are transferred to.
 *
 * <p>Used both for theme script/style bundles, where {@code targetPath} names the bundle
 * file, and for project assets, where it names the destination directory.
 *
 * @param source glob patterns, {@code !} prefix excludes
 * @param targetPath output path, relative to the output directory
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileTransferFilter(
    @JsonProperty("source") List<String> source,
    @JsonProperty("targetPath") String targetPath
) {
    /**
     * Compact constructor with defaults.
     */
    public FileTransferFilter {
        source = source == null ? List.of() : List.copyOf(source);
        if (targetPath == null) {
            targetPath = "";
        }
    }

    /**
     * Returns the source patterns as a glob filter.
     *
     * @return filter over {@link #source()}
     */
    public FileGlobFilter sourceFilter() {
        return new FileGlobFilter(source);
    }
}
