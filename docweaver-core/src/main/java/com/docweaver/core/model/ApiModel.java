package com.docweaver.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadata of all assemblies being documented, in the order supplied by the extractor.
 *
 * @param assemblies documented assemblies
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiModel(
    @JsonProperty("assemblies") List<AssemblyModel> assemblies
) {
    /**
     * Compact constructor with defaults.
     */
    public ApiModel {
        assemblies = assemblies == null ? List.of() : List.copyOf(assemblies);
    }

    /**
     * Returns a model without assemblies.
     *
     * @return empty model
     */
    public static ApiModel empty() {
        return new ApiModel(List.of());
    }

    /**
     * Returns whether the model has no assemblies.
     *
     * @return true if there is nothing to document
     */
    @JsonIgnore
    public boolean isEmpty() {
        return assemblies.isEmpty();
    }

    /**
     * Returns the namespaces of all assemblies.
     *
     * <p>A namespace declared by several assemblies appears once, at the position of its
     * first declaration, with the types of every declaring assembly in assembly order.
     *
     * @return merged namespaces
     */
    public List<NamespaceModel> namespaces() {
        Map<String, NamespaceModel> merged = new LinkedHashMap<>();
        for (AssemblyModel assembly : assemblies) {
            for (NamespaceModel namespace : assembly.namespaces()) {
                merged.merge(namespace.name(), namespace, (first, next) -> {
                    List<TypeModel> types = new ArrayList<>(first.types());
                    types.addAll(next.types());
                    return new NamespaceModel(first.name(), first.url(), types);
                });
            }
        }
        return List.copyOf(merged.values());
    }

    /**
     * Returns all types, namespace by namespace.
     *
     * @return types in namespace order
     */
    public List<TypeModel> types() {
        return namespaces().stream()
            .flatMap(namespace -> namespace.types().stream())
            .toList();
    }
}
