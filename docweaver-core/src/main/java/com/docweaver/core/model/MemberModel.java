package com.docweaver.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A member of a documented type.
 *
 * <p>Overloads share a {@code name}; their URLs usually differ only by fragment when they
 * share a page.
 *
 * @param name display name, without parameter list
 * @param url address of the member's documentation
 * @param kind member kind
 * @param explicitInterfaceImplementation whether the member explicitly implements an interface member
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemberModel(
    @JsonProperty("name") String name,
    @JsonProperty("url") String url,
    @JsonProperty("kind") MemberKind kind,
    @JsonProperty("explicitInterfaceImplementation") boolean explicitInterfaceImplementation
) {
    /**
     * Compact constructor with validation.
     */
    public MemberModel {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(url, "url must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Creates a member that is not an explicit interface implementation.
     *
     * @param name display name
     * @param url documentation address
     * @param kind member kind
     * @return member model
     */
    public static MemberModel of(String name, String url, MemberKind kind) {
        return new MemberModel(name, url, kind, false);
    }
}
