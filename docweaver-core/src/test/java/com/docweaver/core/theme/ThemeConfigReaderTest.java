package com.docweaver.core.theme;

import com.docweaver.core.validation.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ThemeConfigReader}.
 */
class ThemeConfigReaderTest {

    private final ThemeConfigReader reader = new ThemeConfigReader(new ParameterValidator(text -> "<p>" + text + "</p>"));

    @TempDir
    Path tempDir;

    @Test
    void parse_fullDeclaration_returnsConfig() {
        ThemeConfig config = reader.parse("""
            {
              // inherits the defaults
              "base": "classic",
              "metadata": {
                "name": "Modern",
                "version": "2.0.0",
                "homepage": "https://example.com/themes/modern"
              },
              "parameters": {
                "title": { "type": "string", "description": "Site title", "defaultValue": "API" },
                "intro": { "type": "Markdown", "defaultValue": "Welcome" },
                "links": { "type": "Array" },
              },
              "templates": ["templates/"],
              "scripts": { "source": ["scripts/*"], "targetPath": "js/app.js" },
              "assets": ["fonts/**"]
            }
            """, "modern/theme.json");

        assertThat(config.base()).isEqualTo("classic");
        assertThat(config.metadata().name()).isEqualTo("Modern");
        assertThat(config.metadata().homepage()).isEqualTo(URI.create("https://example.com/themes/modern"));
        assertThat(config.parameters()).containsOnlyKeys("title", "intro", "links");
        assertThat(config.parameters().get("TITLE").description()).isEqualTo("Site title");
        assertThat(config.parameters().get("intro").defaultValue()).isEqualTo("<p>Welcome</p>");
        assertThat(config.parameters().get("links").hasDefault()).isFalse();
        assertThat(config.templates()).containsExactly("templates/");
        assertThat(config.scripts().targetPath()).isEqualTo("js/app.js");
        assertThat(config.styles().targetPath()).isEqualTo(ThemeConfig.DEFAULT_STYLE_TARGET);
        assertThat(config.styles().source()).isEmpty();
        assertThat(config.assets()).containsExactly("fonts/**");
    }

    @Test
    void parse_propertyNames_areCaseInsensitive() {
        ThemeConfig config = reader.parse("""
            { "Base": "parent", "Scripts": { "Source": ["a"], "TargetPath": "x.js" } }
            """, "theme.json");

        assertThat(config.base()).isEqualTo("parent");
        assertThat(config.scripts().source()).containsExactly("a");
        assertThat(config.scripts().targetPath()).isEqualTo("x.js");
    }

    @Test
    void parse_blankBase_meansNoBase() {
        assertThat(reader.parse("{ \"base\": \"  \" }", "theme.json").base()).isNull();
    }

    @Test
    void parse_invalidDeclaration_reportsEveryViolation() {
        assertThatThrownBy(() -> reader.parse("""
            {
              "base": 5,
              "parameters": {
                "size": { "type": "Number", "defaultValue": "big" },
                "color": { "description": "no type" },
                "Size": { "type": "String" },
                "kind": { "type": "Colour" }
              },
              "templates": ["ok", 3],
              "styles": { "targetPath": " " }
            }
            """, "broken/theme.json"))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Theme declaration file contains errors: broken/theme.json")
            .satisfies(e -> assertThat(((ValidationException) e).getErrors()).containsExactlyInAnyOrder(
                "base: A string was expected.",
                "parameters.size.defaultValue: Number was expected but string was provided: big",
                "parameters.color.type: The parameter type is required.",
                "parameters.Size: Duplicates parameter 'size'; parameter names are case-insensitive.",
                "parameters.kind.type: Unknown parameter type 'Colour'. Expected one of: "
                    + "[String, Number, Boolean, Markdown, Uri, Array, Object]",
                "templates[1]: A string was expected.",
                "styles.targetPath: The target path must not be blank."
            ));
    }

    @Test
    void parse_malformedJson_throwsValidation() {
        assertThatThrownBy(() -> reader.parse("{ \"base\": ", "bad.json"))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Theme declaration file could not be parsed: bad.json");
    }

    @Test
    void parse_emptyDocument_throwsValidation() {
        assertThatThrownBy(() -> reader.parse("", "empty.json"))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Theme declaration file is empty: empty.json");
    }

    @Test
    void read_missingFile_throwsThemeNotFound() {
        Path missing = tempDir.resolve("theme.json");

        assertThatThrownBy(() -> reader.read(missing))
            .isInstanceOf(ThemeNotFoundException.class)
            .satisfies(e -> assertThat(((ThemeNotFoundException) e).getPath()).isEqualTo(missing));
    }
}
