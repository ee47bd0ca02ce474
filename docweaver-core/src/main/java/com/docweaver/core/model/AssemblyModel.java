package com.docweaver.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A compiled library being documented.
 *
 * @param name assembly name
 * @param namespaces namespaces declared by the assembly
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AssemblyModel(
    @JsonProperty("name") String name,
    @JsonProperty("namespaces") List<NamespaceModel> namespaces
) {
    /**
     * Compact constructor with validation.
     */
    public AssemblyModel {
        Objects.requireNonNull(name, "name must not be null");
        namespaces = namespaces == null ? List.of() : List.copyOf(namespaces);
    }
}
