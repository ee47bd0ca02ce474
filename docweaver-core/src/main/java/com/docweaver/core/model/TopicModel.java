package com.docweaver.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A conceptual documentation topic.
 *
 * @param id identifier, unique among topics (relative source path without extension)
 * @param name display title
 * @param url address of the topic page
 * @param sourcePath source file, or null for topics not backed by a file
 * @param subtopics child topics in display order
 */
public record TopicModel(
    String id,
    String name,
    String url,
    Path sourcePath,
    List<TopicModel> subtopics
) {
    /**
     * Compact constructor with validation.
     */
    public TopicModel {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(url, "url must not be null");
        subtopics = subtopics == null ? List.of() : List.copyOf(subtopics);
    }

    /**
     * Creates a topic without subtopics.
     *
     * @param id identifier
     * @param name display title
     * @param url page address
     * @return leaf topic
     */
    public static TopicModel leaf(String id, String name, String url) {
        return new TopicModel(id, name, url, null, List.of());
    }
}
