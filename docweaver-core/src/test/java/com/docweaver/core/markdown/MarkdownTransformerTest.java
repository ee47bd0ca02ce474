package com.docweaver.core.markdown;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link MarkdownTransformer}.
 */
class MarkdownTransformerTest {

    private final MarkdownTransformer transformer = new MarkdownTransformer();

    @Test
    void transform_heading_rendersHtml() {
        assertThat(transformer.transform("# Welcome")).isEqualTo("<h1>Welcome</h1>\n");
    }

    @Test
    void transform_blankInput_returnsEmptyString() {
        assertThat(transformer.transform(null)).isEmpty();
        assertThat(transformer.transform("  \n")).isEmpty();
    }

    @Test
    void transform_templateExpression_keptVerbatim() {
        String html = transformer.transform("Signed in as {{*user*}} with {{{token}}}");

        assertThat(html).isEqualTo("<p>Signed in as {{*user*}} with {{{token}}}</p>\n");
    }

    @Test
    void transform_tablesAndStrikethrough_areEnabled() {
        String html = transformer.transform("| a | b |\n|---|---|\n| 1 | ~~2~~ |\n");

        assertThat(html).contains("<table>");
        assertThat(html).contains("<del>2</del>");
    }

    @Test
    void identity_returnsInput() {
        assertThat(TextTransformer.IDENTITY.transform("**bold**")).isEqualTo("**bold**");
    }
}
