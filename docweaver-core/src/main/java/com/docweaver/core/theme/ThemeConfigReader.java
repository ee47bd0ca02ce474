package com.docweaver.core.theme;

import com.docweaver.core.util.FileTransferFilter;
import com.docweaver.core.validation.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and validates {@code theme.json} declarations.
 *
 * <p>The declaration is parsed into a Jackson tree and checked property by property, so a
 * malformed file is reported with every violation at once. Property names are matched
 * case-insensitively; comments and trailing commas are accepted.
 *
 * <p>Parameter defaults are validated here, at theme-definition time. A default of the
 * wrong shape is a violation of the declaration and makes the whole read fail.
 */
public class ThemeConfigReader {

    private static final Logger log = LoggerFactory.getLogger(ThemeConfigReader.class);

    private static final ObjectMapper JSON_MAPPER = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
        .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
        .build();

    private final ParameterValidator parameterValidator;

    /**
     * Creates a reader.
     *
     * @param parameterValidator validator for parameter defaults
     */
    public ThemeConfigReader(ParameterValidator parameterValidator) {
        this.parameterValidator = Objects.requireNonNull(parameterValidator, "parameterValidator must not be null");
    }

    /**
     * Reads a theme declaration file.
     *
     * @param file path to {@code theme.json}
     * @return validated declaration
     * @throws ThemeNotFoundException if the file does not exist
     * @throws ValidationException if the file cannot be parsed or is invalid
     */
    public ThemeConfig read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ThemeNotFoundException("Theme declaration file could not be found: " + file, file);
        }

        log.debug("Reading theme declaration: {}", file);
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new ValidationException("Theme declaration file could not be read: " + file, List.of(e.getMessage()));
        }
        return parse(json, file.toString());
    }

    /**
     * Parses a theme declaration.
     *
     * @param json declaration text
     * @param source name of the declaration used in error messages
     * @return validated declaration
     * @throws ValidationException if the text cannot be parsed or is invalid
     */
    public ThemeConfig parse(String json, String source) {
        JsonNode root;
        try {
            root = JSON_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Theme declaration file could not be parsed: " + source,
                List.of(e.getOriginalMessage()));
        }

        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new ValidationException("Theme declaration file is empty: " + source);
        }
        if (!root.isObject()) {
            throw new ValidationException("Theme declaration file contains errors: " + source,
                List.of("The declaration must be a JSON object."));
        }

        List<String> errors = new ArrayList<>();
        Map<String, JsonNode> properties = properties(root);

        String base = readString(properties.get("base"), "base", errors);
        ThemeMetadata metadata = readMetadata(properties.get("metadata"), errors);
        Map<String, ThemeParameter> parameters = readParameters(properties.get("parameters"), errors);
        List<String> templates = readPatterns(properties.get("templates"), "templates", errors);
        FileTransferFilter scripts = readTransfer(properties.get("scripts"), "scripts", ThemeConfig.DEFAULT_SCRIPT_TARGET, errors);
        FileTransferFilter styles = readTransfer(properties.get("styles"), "styles", ThemeConfig.DEFAULT_STYLE_TARGET, errors);
        List<String> assets = readPatterns(properties.get("assets"), "assets", errors);

        if (!errors.isEmpty()) {
            throw new ValidationException("Theme declaration file contains errors: " + source, errors);
        }
        return new ThemeConfig(base, metadata, parameters, templates, scripts, styles, assets);
    }

    private ThemeMetadata readMetadata(JsonNode node, List<String> errors) {
        if (isAbsent(node)) {
            return ThemeMetadata.empty();
        }
        if (!node.isObject()) {
            errors.add("metadata: An object was expected.");
            return ThemeMetadata.empty();
        }

        Map<String, JsonNode> properties = properties(node);
        String homepageText = readString(properties.get("homepage"), "metadata.homepage", errors);
        URI homepage = null;
        if (homepageText != null) {
            try {
                homepage = new URI(homepageText);
            } catch (URISyntaxException e) {
                errors.add("metadata.homepage: A valid URI was expected: " + homepageText);
            }
        }

        return new ThemeMetadata(
            readString(properties.get("format"), "metadata.format", errors),
            readString(properties.get("name"), "metadata.name", errors),
            readString(properties.get("version"), "metadata.version", errors),
            readString(properties.get("description"), "metadata.description", errors),
            readString(properties.get("author"), "metadata.author", errors),
            readString(properties.get("license"), "metadata.license", errors),
            homepage
        );
    }

    private Map<String, ThemeParameter> readParameters(JsonNode node, List<String> errors) {
        Map<String, ThemeParameter> parameters = new LinkedHashMap<>();
        if (isAbsent(node)) {
            return parameters;
        }
        if (!node.isObject()) {
            errors.add("parameters: An object was expected.");
            return parameters;
        }

        Map<String, String> seen = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            String key = "parameters." + name;

            String previous = seen.putIfAbsent(name.toLowerCase(Locale.ROOT), name);
            if (previous != null) {
                errors.add(key + ": Duplicates parameter '" + previous + "'; parameter names are case-insensitive.");
                continue;
            }
            if (name.isBlank()) {
                errors.add("parameters: Parameter names must not be blank.");
                continue;
            }

            ThemeParameter parameter = readParameter(field.getValue(), key, errors);
            if (parameter != null) {
                parameters.put(name, parameter);
            }
        }
        return parameters;
    }

    private ThemeParameter readParameter(JsonNode node, String key, List<String> errors) {
        if (!node.isObject()) {
            errors.add(key + ": An object was expected.");
            return null;
        }

        Map<String, JsonNode> properties = properties(node);
        String description = readString(properties.get("description"), key + ".description", errors);
        String typeName = readString(properties.get("type"), key + ".type", errors);
        if (typeName == null) {
            if (isAbsent(properties.get("type"))) {
                errors.add(key + ".type: The parameter type is required.");
            }
            return null;
        }

        ThemeParameterType type;
        try {
            type = ThemeParameterType.fromName(typeName);
        } catch (IllegalArgumentException e) {
            errors.add(key + ".type: " + e.getMessage());
            return null;
        }

        try {
            return ThemeParameter.define(type, description, properties.get("defaultvalue"), parameterValidator);
        } catch (ThemeParameterFormatException e) {
            errors.add(key + ".defaultValue: " + e.getMessage());
            return null;
        }
    }

    private FileTransferFilter readTransfer(JsonNode node, String key, String defaultTarget, List<String> errors) {
        if (isAbsent(node)) {
            return new FileTransferFilter(List.of(), defaultTarget);
        }
        if (!node.isObject()) {
            errors.add(key + ": An object was expected.");
            return new FileTransferFilter(List.of(), defaultTarget);
        }

        Map<String, JsonNode> properties = properties(node);
        List<String> source = readPatterns(properties.get("source"), key + ".source", errors);
        String targetPath = readString(properties.get("targetpath"), key + ".targetPath", errors);
        if (targetPath == null) {
            targetPath = defaultTarget;
        } else if (targetPath.isBlank()) {
            errors.add(key + ".targetPath: The target path must not be blank.");
        }
        return new FileTransferFilter(source, targetPath);
    }

    private List<String> readPatterns(JsonNode node, String key, List<String> errors) {
        if (isAbsent(node)) {
            return List.of();
        }
        if (!node.isArray()) {
            errors.add(key + ": An array of glob patterns was expected.");
            return List.of();
        }

        List<String> patterns = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode item = node.get(i);
            if (item.isTextual()) {
                patterns.add(item.asText());
            } else {
                errors.add(key + "[" + i + "]: A string was expected.");
            }
        }
        return patterns;
    }

    private static String readString(JsonNode node, String key, List<String> errors) {
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isTextual()) {
            errors.add(key + ": A string was expected.");
            return null;
        }
        return node.asText();
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static Map<String, JsonNode> properties(JsonNode node) {
        Map<String, JsonNode> properties = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            properties.putIfAbsent(field.getKey().toLowerCase(Locale.ROOT), field.getValue());
        }
        return properties;
    }
}
