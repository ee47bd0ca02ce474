package com.docweaver.core.sitemap;

import com.docweaver.core.model.MemberModel;

import java.util.List;
import java.util.Objects;

/**
 * Members of one navigation category.
 *
 * @param category navigation category
 * @param entries representative members, one per page, in declaration order
 */
public record MemberGroup(
    MemberCategory category,
    List<MemberModel> entries
) {
    /**
     * Compact constructor with validation.
     */
    public MemberGroup {
        Objects.requireNonNull(category, "category must not be null");
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    /**
     * Returns the group title.
     *
     * @return title of the category
     */
    public String name() {
        return category.title();
    }
}
