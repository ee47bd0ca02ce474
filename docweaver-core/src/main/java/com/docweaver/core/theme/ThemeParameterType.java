package com.docweaver.core.theme;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Data type of a theme parameter.
 *
 * <p>Each constant owns the shape check for its values. {@link #validate(Object)} either
 * returns the value in its canonical Java form or throws a
 * {@link ThemeParameterFormatException}:
 *
 * <table>
 *   <caption>Accepted input and canonical form</caption>
 *   <tr><th>Type</th><th>Accepts</th><th>Returns</th></tr>
 *   <tr><td>STRING, MARKDOWN</td><td>{@link CharSequence}</td><td>{@link String}</td></tr>
 *   <tr><td>NUMBER</td><td>{@link Number}</td><td>{@link Double}</td></tr>
 *   <tr><td>BOOLEAN</td><td>{@link Boolean}</td><td>{@link Boolean}</td></tr>
 *   <tr><td>URI</td><td>absolute or relative URI string</td><td>{@link java.net.URI}</td></tr>
 *   <tr><td>ARRAY</td><td>collection or array</td><td>unmodifiable {@link List}</td></tr>
 *   <tr><td>OBJECT</td><td>map with string keys</td><td>unmodifiable {@link Map}</td></tr>
 * </table>
 *
 * <p>Jackson trees are converted to plain Java values first. {@code null} is valid for
 * every type.
 */
public enum ThemeParameterType {

    /** A string value. */
    STRING("String"),

    /** A numeric value. */
    NUMBER("Number"),

    /** A boolean value. */
    BOOLEAN("Boolean"),

    /** Markdown text, which may contain template expressions. */
    MARKDOWN("Markdown"),

    /** A URI or resource path. */
    URI("Uri"),

    /** A sequence of values. */
    ARRAY("Array"),

    /** A structured object with its own properties. */
    OBJECT("Object");

    private static final ObjectMapper TREE_MAPPER = new ObjectMapper();

    private final String displayName;

    ThemeParameterType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the name used in theme declarations and error messages.
     *
     * @return display name, e.g. {@code "Markdown"}
     */
    @JsonValue
    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a type from its declared name, ignoring case.
     *
     * @param name declared type name
     * @return matching type
     * @throws IllegalArgumentException if no type has that name
     */
    @JsonCreator
    public static ThemeParameterType fromName(String name) {
        if (name != null) {
            for (ThemeParameterType type : values()) {
                if (type.displayName.equalsIgnoreCase(name.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown parameter type '" + name + "'. Expected one of: "
            + Arrays.stream(values()).map(ThemeParameterType::displayName).toList());
    }

    /**
     * Checks a raw value against this type.
     *
     * @param value raw value, possibly a Jackson tree
     * @return value in canonical form, or null if {@code value} is null
     * @throws ThemeParameterFormatException if the value has the wrong shape
     */
    public Object validate(Object value) {
        Object plain = value instanceof JsonNode node ? TREE_MAPPER.convertValue(node, Object.class) : value;
        if (plain == null) {
            return null;
        }

        return switch (this) {
            case STRING, MARKDOWN -> {
                if (plain instanceof CharSequence text) {
                    yield text.toString();
                }
                throw mismatch(plain);
            }
            case NUMBER -> {
                if (plain instanceof Number number) {
                    yield number.doubleValue();
                }
                throw mismatch(plain);
            }
            case BOOLEAN -> {
                if (plain instanceof Boolean flag) {
                    yield flag;
                }
                throw mismatch(plain);
            }
            case URI -> {
                if (plain instanceof java.net.URI uri) {
                    yield uri;
                }
                if (plain instanceof CharSequence text) {
                    yield parseUri(text.toString());
                }
                throw mismatch(plain);
            }
            case ARRAY -> {
                if (plain instanceof Collection<?> items) {
                    yield Collections.unmodifiableList(new ArrayList<>(items));
                }
                if (plain instanceof Object[] items) {
                    yield Collections.unmodifiableList(new ArrayList<>(Arrays.asList(items)));
                }
                throw mismatch(plain);
            }
            case OBJECT -> {
                if (plain instanceof Map<?, ?> map && map.keySet().stream().allMatch(String.class::isInstance)) {
                    Map<String, Object> copy = new LinkedHashMap<>();
                    map.forEach((key, item) -> copy.put((String) key, item));
                    yield Collections.unmodifiableMap(copy);
                }
                throw mismatch(plain);
            }
        };
    }

    private static java.net.URI parseUri(String text) {
        try {
            return new java.net.URI(text);
        } catch (URISyntaxException e) {
            throw new ThemeParameterFormatException("A valid URI was expected: " + text);
        }
    }

    private ThemeParameterFormatException mismatch(Object value) {
        return new ThemeParameterFormatException(
            displayName + " was expected but " + describe(value) + " was provided: " + value);
    }

    private static String describe(Object value) {
        if (value instanceof CharSequence) {
            return "string";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Collection<?> || value.getClass().isArray()) {
            return "array";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        return value.getClass().getSimpleName().toLowerCase(Locale.ROOT);
    }
}
