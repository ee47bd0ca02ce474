package com.docweaver.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A documented type.
 *
 * @param name display name
 * @param url address of the type's documentation
 * @param kind type kind
 * @param members members in declaration order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TypeModel(
    @JsonProperty("name") String name,
    @JsonProperty("url") String url,
    @JsonProperty("kind") TypeKind kind,
    @JsonProperty("members") List<MemberModel> members
) {
    /**
     * Compact constructor with validation.
     */
    public TypeModel {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(url, "url must not be null");
        if (kind == null) {
            kind = TypeKind.CLASS;
        }
        members = members == null ? List.of() : List.copyOf(members);
    }

    /**
     * Returns whether the type is an enumeration.
     *
     * @return true for enums
     */
    public boolean isEnum() {
        return kind == TypeKind.ENUM;
    }
}
