package com.docweaver.core.service;

import com.docweaver.core.context.DocContext;
import com.docweaver.core.renderer.GeneratedFile;
import com.docweaver.core.sitemap.SitemapNode;

import java.util.Optional;

/**
 * Produces the file for one page of the site.
 *
 * <p>Implementations decide which pages they can produce; pages they cannot produce are
 * left to other tools and reported as empty.
 */
@FunctionalInterface
public interface PageComposer {

    /**
     * Composes a page.
     *
     * @param page sitemap node of the page, always carrying a URL
     * @param context documentation context
     * @return the page file, or empty if this composer does not produce the page
     */
    Optional<GeneratedFile> compose(SitemapNode page, DocContext context);
}
