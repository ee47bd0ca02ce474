package com.docweaver.core.theme;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ThemeParameterType}.
 */
class ThemeParameterTypeTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @ParameterizedTest
    @EnumSource(ThemeParameterType.class)
    void validate_null_returnsNullForEveryType(ThemeParameterType type) {
        assertThat(type.validate(null)).isNull();
    }

    @Test
    void validate_number_coercesToDouble() {
        assertThat(ThemeParameterType.NUMBER.validate(42)).isEqualTo(42.0);
        assertThat(ThemeParameterType.NUMBER.validate(2.5f)).isEqualTo(2.5);
        assertThat(ThemeParameterType.NUMBER.validate(7L)).isEqualTo(7.0);
    }

    @Test
    void validate_stringForNumber_reportsKindAndValue() {
        assertThatThrownBy(() -> ThemeParameterType.NUMBER.validate("12"))
            .isInstanceOf(ThemeParameterFormatException.class)
            .hasMessage("Number was expected but string was provided: 12");
    }

    @Test
    void validate_booleanForString_fails() {
        assertThatThrownBy(() -> ThemeParameterType.STRING.validate(true))
            .isInstanceOf(ThemeParameterFormatException.class)
            .hasMessage("String was expected but boolean was provided: true");
    }

    @Test
    void validate_stringForBoolean_fails() {
        assertThatThrownBy(() -> ThemeParameterType.BOOLEAN.validate("true"))
            .isInstanceOf(ThemeParameterFormatException.class)
            .hasMessageStartingWith("Boolean was expected but string");
    }

    @Test
    void validate_uri_acceptsAbsoluteAndRelative() {
        assertThat(ThemeParameterType.URI.validate("https://example.com/docs"))
            .isEqualTo(URI.create("https://example.com/docs"));
        assertThat(ThemeParameterType.URI.validate("images/logo.png"))
            .isEqualTo(URI.create("images/logo.png"));
    }

    @Test
    void validate_malformedUri_fails() {
        assertThatThrownBy(() -> ThemeParameterType.URI.validate("http://exa mple.com"))
            .isInstanceOf(ThemeParameterFormatException.class)
            .hasMessage("A valid URI was expected: http://exa mple.com");
    }

    @Test
    void validate_array_acceptsListsAndJavaArrays() {
        List<String> list = new ArrayList<>(List.of("a", "b"));

        Object fromList = ThemeParameterType.ARRAY.validate(list);
        Object fromArray = ThemeParameterType.ARRAY.validate(new String[] {"a", "b"});

        assertThat(fromList).isEqualTo(List.of("a", "b"));
        assertThat(fromArray).isEqualTo(List.of("a", "b"));
        list.add("c");
        assertThat(fromList).isEqualTo(List.of("a", "b"));
    }

    @Test
    void validate_mapForArray_reportsObject() {
        assertThatThrownBy(() -> ThemeParameterType.ARRAY.validate(Map.of("a", 1)))
            .isInstanceOf(ThemeParameterFormatException.class)
            .hasMessageStartingWith("Array was expected but object was provided");
    }

    @Test
    void validate_object_requiresStringKeys() {
        assertThat(ThemeParameterType.OBJECT.validate(Map.of("name", "value")))
            .isEqualTo(Map.of("name", "value"));

        assertThatThrownBy(() -> ThemeParameterType.OBJECT.validate(Map.of(1, "value")))
            .isInstanceOf(ThemeParameterFormatException.class);
    }

    @Test
    void validate_jsonTrees_areConvertedToPlainValues() throws Exception {
        JsonNode array = MAPPER.readTree("[1, \"two\"]");
        JsonNode object = MAPPER.readTree("{\"links\": {\"home\": \"/\"}}");
        JsonNode number = MAPPER.readTree("3");

        assertThat(ThemeParameterType.ARRAY.validate(array)).isEqualTo(List.of(1, "two"));
        assertThat(ThemeParameterType.OBJECT.validate(object)).isEqualTo(Map.of("links", Map.of("home", "/")));
        assertThat(ThemeParameterType.NUMBER.validate(number)).isEqualTo(3.0);
        assertThat(ThemeParameterType.STRING.validate(MAPPER.readTree("null"))).isNull();
    }

    @Test
    void fromName_ignoresCase() {
        assertThat(ThemeParameterType.fromName("markdown")).isEqualTo(ThemeParameterType.MARKDOWN);
        assertThat(ThemeParameterType.fromName("URI")).isEqualTo(ThemeParameterType.URI);
        assertThat(ThemeParameterType.URI.displayName()).isEqualTo("Uri");
    }

    @Test
    void fromName_unknownType_throws() {
        assertThatThrownBy(() -> ThemeParameterType.fromName("Color"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown parameter type 'Color'");
    }
}
