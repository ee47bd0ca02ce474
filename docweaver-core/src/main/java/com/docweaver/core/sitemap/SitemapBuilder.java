package com.docweaver.core.sitemap;

import com.docweaver.core.model.ApiModel;
import com.docweaver.core.model.MemberModel;
import com.docweaver.core.model.NamespaceModel;
import com.docweaver.core.model.TopicModel;
import com.docweaver.core.model.TypeModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the navigation tree of a documentation site.
 *
 * <p>The API part adapts to the page granularity:
 * <ul>
 *   <li>with namespace pages, API → namespaces → types; otherwise API → types</li>
 *   <li>types appear under namespaces only when type pages are enabled</li>
 *   <li>with member pages, each non-enum type lists its member groups</li>
 * </ul>
 * The topics part mirrors the supplied topic tree one to one. Namespaces, types and topics
 * keep the order they are supplied in.
 *
 * <p>All URLs are made relative to the site root and stripped of fragments.
 */
public class SitemapBuilder {

    private static final Logger log = LoggerFactory.getLogger(SitemapBuilder.class);

    private final URI baseUrl;
    private final Set<PageGranularity> granularity;
    private final MemberGrouper memberGrouper;

    /**
     * Creates a builder.
     *
     * @param baseUrl root URL of the site
     * @param granularity enabled page kinds
     * @param memberGrouper grouper for type members
     */
    public SitemapBuilder(URI baseUrl, Set<PageGranularity> granularity, MemberGrouper memberGrouper) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.granularity = granularity.isEmpty() ? EnumSet.noneOf(PageGranularity.class) : EnumSet.copyOf(granularity);
        this.memberGrouper = Objects.requireNonNull(memberGrouper, "memberGrouper must not be null");
    }

    /**
     * Builds the sitemap.
     *
     * @param apiModel documented assemblies
     * @param topics top-level topics with their subtopics
     * @return navigation tree
     */
    public Sitemap build(ApiModel apiModel, List<TopicModel> topics) {
        List<SitemapNode> nodes = new ArrayList<>();
        if (!apiModel.isEmpty()) {
            nodes.add(createApiNode(apiModel));
        }
        if (!topics.isEmpty()) {
            nodes.add(SitemapNode.group(Sitemap.TOPICS_TITLE, createTopicNodes(topics)));
        }

        Sitemap sitemap = new Sitemap(baseUrl, nodes);
        log.debug("Built sitemap with {} top-level nodes and {} pages", nodes.size(), sitemap.getPageCount());
        return sitemap;
    }

    private SitemapNode createApiNode(ApiModel apiModel) {
        List<SitemapNode> children = new ArrayList<>();
        if (granularity.contains(PageGranularity.NAMESPACE)) {
            for (NamespaceModel namespace : apiModel.namespaces()) {
                children.add(createNamespaceNode(namespace));
            }
        } else {
            for (TypeModel type : apiModel.types()) {
                children.add(createTypeNode(type));
            }
        }
        return SitemapNode.group(Sitemap.API_TITLE, children);
    }

    private SitemapNode createNamespaceNode(NamespaceModel namespace) {
        List<SitemapNode> types = new ArrayList<>();
        if (granularity.contains(PageGranularity.TYPE)) {
            for (TypeModel type : namespace.types()) {
                types.add(createTypeNode(type));
            }
        }
        return SitemapNode.page(namespace.name(), relative(namespace.url()), types);
    }

    private SitemapNode createTypeNode(TypeModel type) {
        List<SitemapNode> groups = new ArrayList<>();
        if (granularity.contains(PageGranularity.MEMBER) && !type.isEnum()) {
            for (MemberGroup group : memberGrouper.group(type.members())) {
                groups.add(createMemberGroupNode(group));
            }
        }
        return SitemapNode.page(type.name(), relative(type.url()), groups);
    }

    private SitemapNode createMemberGroupNode(MemberGroup group) {
        if (group.category().sharesSinglePage()) {
            return SitemapNode.page(group.name(), relative(group.entries().get(0).url()));
        }

        List<SitemapNode> members = new ArrayList<>();
        for (MemberModel member : group.entries()) {
            members.add(SitemapNode.page(member.name(), relative(member.url())));
        }
        return SitemapNode.group(group.name(), members);
    }

    private List<SitemapNode> createTopicNodes(List<TopicModel> topics) {
        List<SitemapNode> nodes = new ArrayList<>();
        for (TopicModel topic : topics) {
            nodes.add(SitemapNode.page(topic.name(), relative(topic.url()), createTopicNodes(topic.subtopics())));
        }
        return nodes;
    }

    private String relative(String url) {
        return SiteUrls.toSiteRelative(baseUrl, url);
    }
}
