package com.docweaver.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A namespace and the types it contains.
 *
 * @param name namespace name
 * @param url address of the namespace's documentation
 * @param types types in the order supplied by the metadata provider
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NamespaceModel(
    @JsonProperty("name") String name,
    @JsonProperty("url") String url,
    @JsonProperty("types") List<TypeModel> types
) {
    /**
     * Compact constructor with validation.
     */
    public NamespaceModel {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(url, "url must not be null");
        types = types == null ? List.of() : List.copyOf(types);
    }
}
