package com.docweaver.core.sitemap;

/**
 * Kinds of API elements that may receive dedicated documentation pages.
 *
 * <p>A documentation convention enables a set of these. Elements whose kind is not
 * enabled are documented on the page of their parent.
 */
public enum PageGranularity {
    /** Each namespace has its own page listing its types. */
    NAMESPACE,
    /** Each type has its own page. */
    TYPE,
    /** Each member (or overload set) has its own page. */
    MEMBER
}
