package com.docweaver.core.sitemap;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * An entry of the site navigation tree.
 *
 * <p>A node is a page link ({@code url} only), a group ({@code items} only) or a page with
 * children (both). Serialized as {@code {"title", "url"?, "items"?}}; absent properties
 * are omitted, which client-side navigation scripts rely on.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"title", "url", "items"})
public final class SitemapNode {

    private final String title;
    private final String url;
    private final List<SitemapNode> items;
    private final int pageCount;

    private SitemapNode(String title, String url, List<SitemapNode> items) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        if (url == null && items == null) {
            throw new IllegalArgumentException("Node '" + title + "' needs a url, children, or both");
        }
        this.title = title;
        this.url = url;
        this.items = items != null ? List.copyOf(items) : null;

        int count = url != null ? 1 : 0;
        if (this.items != null) {
            for (SitemapNode item : this.items) {
                count += item.pageCount;
            }
        }
        this.pageCount = count;
    }

    /**
     * Creates a link to a page.
     *
     * @param title page title
     * @param url page address
     * @return leaf node
     */
    public static SitemapNode page(String title, String url) {
        Objects.requireNonNull(url, "url must not be null");
        return new SitemapNode(title, url, null);
    }

    /**
     * Creates a group without a page of its own.
     *
     * @param title group title
     * @param children child nodes
     * @return group node
     */
    public static SitemapNode group(String title, List<SitemapNode> children) {
        Objects.requireNonNull(children, "children must not be null");
        return new SitemapNode(title, null, children);
    }

    /**
     * Creates a page that may have children.
     *
     * <p>A page without children becomes a leaf node.
     *
     * @param title page title
     * @param url page address
     * @param children child nodes, possibly empty
     * @return page node
     */
    public static SitemapNode page(String title, String url, List<SitemapNode> children) {
        Objects.requireNonNull(url, "url must not be null");
        Objects.requireNonNull(children, "children must not be null");
        return new SitemapNode(title, url, children.isEmpty() ? null : children);
    }

    /**
     * Returns the display text.
     *
     * @return title
     */
    @JsonProperty("title")
    public String getTitle() {
        return title;
    }

    /**
     * Returns the page address relative to the documentation root.
     *
     * @return url, or null for a pure group
     */
    @JsonProperty("url")
    public String getUrl() {
        return url;
    }

    /**
     * Returns the child nodes.
     *
     * @return children, or null for a leaf page
     */
    @JsonProperty("items")
    public List<SitemapNode> getItems() {
        return items;
    }

    /**
     * Returns the number of pages in this subtree, including this node's own page.
     *
     * @return page count
     */
    @JsonIgnore
    public int getPageCount() {
        return pageCount;
    }

    @Override
    public String toString() {
        return title;
    }
}
