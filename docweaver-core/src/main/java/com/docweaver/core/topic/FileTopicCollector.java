package com.docweaver.core.topic;

import com.docweaver.core.config.DocConvention;
import com.docweaver.core.model.TopicModel;
import com.docweaver.core.sitemap.SiteUrls;
import com.docweaver.core.util.FileGlobFilter;
import com.docweaver.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Discovers Markdown topic files and arranges them into the topic tree.
 *
 * <p>Topic files are selected by glob patterns relative to the base directory (patterns
 * without extension get {@code .md}). Each topic is titled by the first level-one
 * heading of the file, or by its file name when there is none, and is published at
 * {@code topics/<relative path without extension>.<page extension>}, percent-encoded.
 */
public class FileTopicCollector {

    private static final Logger log = LoggerFactory.getLogger(FileTopicCollector.class);

    private static final String TOPIC_EXTENSION = "md";
    private static final String URL_PREFIX = "topics/";
    private static final Pattern HEADING = Pattern.compile("^#[ \\t]+(.+?)[ \\t]*#*[ \\t]*$", Pattern.MULTILINE);

    private final Path baseDirectory;
    private final DocConvention convention;

    /**
     * Creates a collector.
     *
     * @param baseDirectory directory topic patterns are relative to
     * @param convention convention providing the page extension
     */
    public FileTopicCollector(Path baseDirectory, DocConvention convention) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory must not be null")
            .toAbsolutePath().normalize();
        this.convention = Objects.requireNonNull(convention, "convention must not be null");
    }

    /**
     * Collects the topics.
     *
     * @param filter topic file patterns
     * @param order relative paths of topics to list first
     * @param hierarchy strategy building subtopics
     * @return top-level topics with their subtopics, in display order
     * @throws IllegalStateException if a topic file cannot be read
     */
    public List<TopicModel> collect(FileGlobFilter filter, List<String> order, TopicHierarchy hierarchy) {
        List<Path> files;
        try {
            files = filter.findMatchingFiles(baseDirectory, TOPIC_EXTENSION);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to find topic files in " + baseDirectory, e);
        }

        List<FileTopic> topics = new ArrayList<>();
        for (Path file : files) {
            topics.add(toTopic(file));
        }
        log.debug("Found {} topic files in {}", topics.size(), baseDirectory);

        List<TopicModel> result = new ArrayList<>();
        for (TopicHierarchy.TopicNode node : hierarchy.arrange(TopicSorter.sort(topics, order))) {
            result.add(toModel(node));
        }
        return result;
    }

    private FileTopic toTopic(Path file) {
        String id = FileUtils.removeExtension(FileUtils.toUnixPath(baseDirectory.relativize(file)));
        String content;
        try {
            content = FileUtils.readString(file);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read topic file: " + file, e);
        }
        String url = SiteUrls.encodePath(URL_PREFIX + id + "." + convention.pageExtension());
        return new FileTopic(id, titleOf(content, FileUtils.getBaseName(file)), url, file);
    }

    /**
     * Extracts the title of a Markdown document.
     *
     * @param markdown document text
     * @param fallback title used when the document has no level-one heading
     * @return title
     */
    static String titleOf(String markdown, String fallback) {
        Matcher matcher = HEADING.matcher(markdown);
        if (matcher.find() && !matcher.group(1).isBlank()) {
            return matcher.group(1).strip();
        }
        return fallback;
    }

    private static TopicModel toModel(TopicHierarchy.TopicNode node) {
        List<TopicModel> subtopics = new ArrayList<>();
        for (TopicHierarchy.TopicNode child : node.subtopics()) {
            subtopics.add(toModel(child));
        }
        FileTopic topic = node.topic();
        return new TopicModel(topic.id(), topic.title(), topic.url(), topic.sourcePath(), subtopics);
    }
}
