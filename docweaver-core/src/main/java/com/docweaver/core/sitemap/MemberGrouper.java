package com.docweaver.core.sitemap;

import com.docweaver.core.model.MemberModel;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies the members of a type into navigation categories.
 *
 * <p>Properties, methods and events that explicitly implement an interface member are
 * moved to {@link MemberCategory#EXPLICIT_INTERFACE_IMPLEMENTATIONS}. Members sharing a
 * display name are overloads documented on one page, so only the first of them is kept.
 * Constructors always share a single page and collapse to the first constructor.
 *
 * <p>Groups are returned in {@link MemberCategory} order; empty groups are omitted.
 */
public class MemberGrouper {

    /**
     * Groups members by navigation category.
     *
     * @param members members in declaration order
     * @return non-empty groups in category order
     */
    public List<MemberGroup> group(List<MemberModel> members) {
        Map<MemberCategory, Map<String, MemberModel>> grouped = new EnumMap<>(MemberCategory.class);
        for (MemberModel member : members) {
            MemberCategory category = categorize(member);
            String key = category.sharesSinglePage() ? "" : member.name();
            grouped.computeIfAbsent(category, c -> new LinkedHashMap<>()).putIfAbsent(key, member);
        }

        List<MemberGroup> groups = new ArrayList<>();
        grouped.forEach((category, entries) -> groups.add(new MemberGroup(category, new ArrayList<>(entries.values()))));
        return groups;
    }

    /**
     * Determines the navigation category of a member.
     *
     * @param member type member
     * @return category the member is listed under
     */
    public static MemberCategory categorize(MemberModel member) {
        return switch (member.kind()) {
            case PROPERTY -> member.explicitInterfaceImplementation()
                ? MemberCategory.EXPLICIT_INTERFACE_IMPLEMENTATIONS : MemberCategory.PROPERTIES;
            case METHOD -> member.explicitInterfaceImplementation()
                ? MemberCategory.EXPLICIT_INTERFACE_IMPLEMENTATIONS : MemberCategory.METHODS;
            case EVENT -> member.explicitInterfaceImplementation()
                ? MemberCategory.EXPLICIT_INTERFACE_IMPLEMENTATIONS : MemberCategory.EVENTS;
            case OPERATOR -> MemberCategory.OPERATORS;
            case FIELD -> MemberCategory.FIELDS;
            case CONSTRUCTOR -> MemberCategory.CONSTRUCTORS;
        };
    }
}
