package com.docweaver.core.context;

import com.docweaver.core.config.DocConvention;
import com.docweaver.core.model.ApiModel;
import com.docweaver.core.model.TopicModel;
import com.docweaver.core.sitemap.MemberGrouper;
import com.docweaver.core.sitemap.Sitemap;
import com.docweaver.core.sitemap.SitemapBuilder;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * Everything known about the documentation being generated.
 *
 * <p>The sitemap is built on first access and the same instance is returned afterwards.
 */
public final class DocContext {

    private static final URI ROOT = URI.create("/");

    private final DocConvention convention;
    private final URI baseUrl;
    private final ApiModel apiModel;
    private final List<TopicModel> topics;
    private final List<AssetReference> assets;

    private volatile Sitemap sitemap;

    /**
     * Creates a context.
     *
     * @param convention documentation convention
     * @param baseUrl root URL of the site, or null for a relocatable site
     * @param apiModel documented API, possibly empty
     * @param topics top-level topics
     * @param assets files copied into the site
     */
    public DocContext(DocConvention convention, URI baseUrl, ApiModel apiModel,
                      List<TopicModel> topics, List<AssetReference> assets) {
        this.convention = Objects.requireNonNull(convention, "convention must not be null");
        this.baseUrl = normalize(baseUrl);
        this.apiModel = apiModel == null ? ApiModel.empty() : apiModel;
        this.topics = topics == null ? List.of() : List.copyOf(topics);
        this.assets = assets == null ? List.of() : List.copyOf(assets);
    }

    public DocConvention getConvention() {
        return convention;
    }

    /**
     * Returns the root URL of the site. Always ends with {@code /}.
     *
     * @return base URL
     */
    public URI getBaseUrl() {
        return baseUrl;
    }

    public ApiModel getApiModel() {
        return apiModel;
    }

    public List<TopicModel> getTopics() {
        return topics;
    }

    public List<AssetReference> getAssets() {
        return assets;
    }

    /**
     * Returns the navigation tree of the site, building it on first access.
     *
     * @return sitemap
     */
    public Sitemap getSitemap() {
        Sitemap result = sitemap;
        if (result == null) {
            synchronized (this) {
                result = sitemap;
                if (result == null) {
                    result = new SitemapBuilder(baseUrl, convention.granularity(), new MemberGrouper())
                        .build(apiModel, topics);
                    sitemap = result;
                }
            }
        }
        return result;
    }

    private static URI normalize(URI baseUrl) {
        if (baseUrl == null) {
            return ROOT;
        }
        String text = baseUrl.toString();
        return text.endsWith("/") ? baseUrl : URI.create(text + "/");
    }
}
