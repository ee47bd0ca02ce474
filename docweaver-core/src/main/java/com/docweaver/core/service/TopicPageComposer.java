package com.docweaver.core.service;

import com.docweaver.core.context.DocContext;
import com.docweaver.core.markdown.TextTransformer;
import com.docweaver.core.model.TopicModel;
import com.docweaver.core.renderer.GeneratedFile;
import com.docweaver.core.sitemap.SiteUrls;
import com.docweaver.core.sitemap.SitemapNode;
import com.docweaver.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Composes the pages of file-backed topics.
 *
 * <p>For HTML conventions the Markdown source is converted to HTML; for Markdown
 * conventions the source file is copied unchanged. API reference pages are not produced
 * here. Page files are written to the decoded page path, so {@code topics/a%20b.html}
 * is served from {@code topics/a b.html}.
 *
 * <p>Not thread-safe: the topic index of the last context is cached between calls.
 */
public class TopicPageComposer implements PageComposer {

    private static final Logger log = LoggerFactory.getLogger(TopicPageComposer.class);

    private static final String MARKDOWN_EXTENSION = "md";

    private final TextTransformer markdown;

    private DocContext indexedContext;
    private Map<String, TopicModel> topicIndex = Map.of();

    /**
     * Creates a composer.
     *
     * @param markdown transformer converting Markdown to HTML
     */
    public TopicPageComposer(TextTransformer markdown) {
        this.markdown = Objects.requireNonNull(markdown, "markdown must not be null");
    }

    @Override
    public Optional<GeneratedFile> compose(SitemapNode page, DocContext context) {
        TopicModel topic = topicsOf(context).get(page.getUrl());
        if (topic == null || topic.sourcePath() == null) {
            log.debug("No topic source for page '{}' ({})", page.getTitle(), page.getUrl());
            return Optional.empty();
        }

        if (MARKDOWN_EXTENSION.equals(context.getConvention().pageExtension())) {
            return Optional.of(GeneratedFile.copy(SiteUrls.toFilePath(page.getUrl()), topic.sourcePath()));
        }

        String source;
        try {
            source = FileUtils.readString(topic.sourcePath());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read topic file: " + topic.sourcePath(), e);
        }
        return Optional.of(GeneratedFile.text(
            SiteUrls.toFilePath(page.getUrl()), markdown.transform(source), "text/html"));
    }

    // Pages of one build share the index; a new context rebuilds it.
    private Map<String, TopicModel> topicsOf(DocContext context) {
        if (context != indexedContext) {
            Map<String, TopicModel> index = new HashMap<>();
            addTopics(context, context.getTopics(), index);
            topicIndex = index;
            indexedContext = context;
        }
        return topicIndex;
    }

    private static void addTopics(DocContext context, List<TopicModel> topics, Map<String, TopicModel> index) {
        for (TopicModel topic : topics) {
            index.putIfAbsent(SiteUrls.toSiteRelative(context.getBaseUrl(), topic.url()), topic);
            addTopics(context, topic.subtopics(), index);
        }
    }
}
