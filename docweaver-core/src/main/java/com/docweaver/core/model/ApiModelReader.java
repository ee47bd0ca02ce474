package com.docweaver.core.model;

import com.docweaver.core.validation.ValidationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads an API metadata model previously extracted from compiled assemblies.
 *
 * <p><b>Format:</b>
 * <pre>{@code
 * {
 *   "assemblies": [{
 *     "name": "Acme.Core",
 *     "namespaces": [{
 *       "name": "Acme", "url": "api/Acme.html",
 *       "types": [{
 *         "name": "Widget", "url": "api/Acme.Widget.html", "kind": "class",
 *         "members": [{ "name": "Render", "url": "api/Acme.Widget.Render.html", "kind": "method" }]
 *       }]
 *     }]
 *   }]
 * }
 * }</pre>
 */
public final class ApiModelReader {

    private static final Logger log = LoggerFactory.getLogger(ApiModelReader.class);

    private static final ObjectMapper JSON_MAPPER = JsonMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private ApiModelReader() {
        // Utility class
    }

    /**
     * Reads a model from a JSON file.
     *
     * @param file model file
     * @return API model
     * @throws ValidationException if the file is missing or cannot be mapped
     */
    public static ApiModel read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ValidationException("API model file could not be found: " + file);
        }

        try {
            ApiModel model = JSON_MAPPER.readValue(file.toFile(), ApiModel.class);
            log.info("Loaded API model with {} assemblies from: {}", model.assemblies().size(), file);
            return model;
        } catch (IOException | IllegalArgumentException e) {
            throw new ValidationException("API model file contains errors: " + file, List.of(e.getMessage()));
        }
    }
}
