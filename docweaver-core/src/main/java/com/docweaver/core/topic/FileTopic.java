package com.docweaver.core.topic;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A topic discovered on disk, before it is placed in the topic hierarchy.
 *
 * @param id relative path of the source file without extension, using {@code /}
 * @param title display title
 * @param url address of the topic page
 * @param sourcePath absolute path of the source file
 */
public record FileTopic(
    String id,
    String title,
    String url,
    Path sourcePath
) {
    /**
     * Compact constructor with validation.
     */
    public FileTopic {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(url, "url must not be null");
    }

    /**
     * Returns the directory part of the id.
     *
     * @return parent directory of the topic, empty for the base directory
     */
    public String directory() {
        int slash = id.lastIndexOf('/');
        return slash >= 0 ? id.substring(0, slash) : "";
    }

    /**
     * Returns the file name part of the id.
     *
     * @return file name without extension
     */
    public String fileName() {
        return id.substring(id.lastIndexOf('/') + 1);
    }
}
