package com.docweaver.core.config;

import com.docweaver.core.sitemap.PageGranularity;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Site conventions: output format, page extension and page granularity.
 */
public enum DocConvention {

    /** HTML with separate pages for namespaces, types and members, like the .NET API browser. */
    DOTNET("html", "html", EnumSet.allOf(PageGranularity.class)),

    /** HTML with types and their members sharing a page, like DocFX. */
    DOCFX("html", "html", EnumSet.of(PageGranularity.NAMESPACE, PageGranularity.TYPE)),

    /** Markdown with types and their members sharing a page, like an Azure DevOps wiki. */
    DEVOPS("md", "md", EnumSet.of(PageGranularity.NAMESPACE, PageGranularity.TYPE));

    private final String themeFormat;
    private final String pageExtension;
    private final Set<PageGranularity> granularity;

    DocConvention(String themeFormat, String pageExtension, Set<PageGranularity> granularity) {
        this.themeFormat = themeFormat;
        this.pageExtension = pageExtension;
        this.granularity = Collections.unmodifiableSet(granularity);
    }

    /**
     * Returns the name of the themes subdirectory for this convention.
     *
     * @return theme format, {@code html} or {@code md}
     */
    public String themeFormat() {
        return themeFormat;
    }

    /**
     * Returns the file extension of generated pages.
     *
     * @return extension without dot
     */
    public String pageExtension() {
        return pageExtension;
    }

    /**
     * Returns the kinds of API elements that get dedicated pages.
     *
     * @return enabled page granularity
     */
    public Set<PageGranularity> granularity() {
        return granularity;
    }
}
