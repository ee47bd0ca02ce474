package com.docweaver.core.sitemap;

/**
 * Navigation categories for type members, in display order.
 */
public enum MemberCategory {
    PROPERTIES("Properties"),
    METHODS("Methods"),
    EVENTS("Events"),
    OPERATORS("Operators"),
    FIELDS("Fields"),
    CONSTRUCTORS("Constructors"),
    EXPLICIT_INTERFACE_IMPLEMENTATIONS("Explicit Interface Implementations");

    private final String title;

    MemberCategory(String title) {
        this.title = title;
    }

    /**
     * Returns the title shown in navigation.
     *
     * @return category title
     */
    public String title() {
        return title;
    }

    /**
     * Returns whether all members of the category share one page.
     *
     * @return true for constructors
     */
    public boolean sharesSinglePage() {
        return this == CONSTRUCTORS;
    }
}
