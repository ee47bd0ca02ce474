package com.docweaver.core.sitemap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * URL helpers for navigation entries.
 */
public final class SiteUrls {

    private static final Logger log = LoggerFactory.getLogger(SiteUrls.class);

    private SiteUrls() {
        // Utility class
    }

    /**
     * Converts a document URL into a navigation URL.
     *
     * <p>Any fragment is removed, since navigation always targets whole pages. When the
     * base URL is absolute, absolute URLs below it are made relative to it.
     *
     * @param baseUrl root URL of the site
     * @param url document URL
     * @return page URL relative to the site root; URLs that are not valid URIs are returned
     *         without their fragment
     */
    public static String toSiteRelative(URI baseUrl, String url) {
        int hash = url.indexOf('#');
        String page = hash >= 0 ? url.substring(0, hash) : url;

        if (baseUrl.isAbsolute()) {
            try {
                URI target = new URI(page);
                if (target.isAbsolute()) {
                    return baseUrl.relativize(target).toString();
                }
            } catch (URISyntaxException e) {
                log.debug("Keeping unparseable URL as is: {}", page);
            }
        }
        return page;
    }

    /**
     * Encodes a site-relative path for use in a URL.
     *
     * @param path unencoded path with {@code /} separators
     * @return path with characters not allowed in a URI path percent-encoded
     * @throws IllegalArgumentException if the path cannot be represented as a URI path
     */
    public static String encodePath(String path) {
        try {
            return new URI(null, null, path, null).getRawPath();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid page path: " + path, e);
        }
    }

    /**
     * Converts a site-relative page URL to the output file path it is served from.
     *
     * @param url page URL, possibly percent-encoded
     * @return decoded path, or {@code url} itself when it is not a valid URI
     */
    public static String toFilePath(String url) {
        try {
            String path = new URI(url).getPath();
            return path == null ? url : path;
        } catch (URISyntaxException e) {
            return url;
        }
    }
}
