package com.docweaver.core.sitemap;

import com.fasterxml.jackson.annotation.JsonValue;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Navigation tree of a documentation site.
 *
 * <p>The top level holds an {@value #API_TITLE} node when assemblies are documented and a
 * {@value #TOPICS_TITLE} node when topics are present. Serialized as the JSON array of
 * its top-level nodes.
 */
public final class Sitemap {

    /** Title of the API reference node. */
    public static final String API_TITLE = "API";

    /** Title of the conceptual topics node. */
    public static final String TOPICS_TITLE = "Topics";

    private final URI baseUrl;
    private final List<SitemapNode> nodes;
    private final int pageCount;

    /**
     * Creates a sitemap.
     *
     * @param baseUrl root URL of the site; relative when the site is location-independent
     * @param nodes top-level nodes
     */
    public Sitemap(URI baseUrl, List<SitemapNode> nodes) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.nodes = List.copyOf(nodes);
        this.pageCount = this.nodes.stream().mapToInt(SitemapNode::getPageCount).sum();
    }

    /**
     * Returns the root URL all node URLs are relative to.
     *
     * @return base URL
     */
    public URI getBaseUrl() {
        return baseUrl;
    }

    /**
     * Returns the top-level nodes.
     *
     * @return immutable node list
     */
    @JsonValue
    public List<SitemapNode> getNodes() {
        return nodes;
    }

    /**
     * Finds a top-level node by title.
     *
     * @param title node title, e.g. {@link #API_TITLE}
     * @return node if present
     */
    public Optional<SitemapNode> findNode(String title) {
        return nodes.stream().filter(node -> node.getTitle().equals(title)).findFirst();
    }

    /**
     * Returns the number of pages the site consists of.
     *
     * @return count of nodes carrying a URL, at any depth
     */
    public int getPageCount() {
        return pageCount;
    }
}
