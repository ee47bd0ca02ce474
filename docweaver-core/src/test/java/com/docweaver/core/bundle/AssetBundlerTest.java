package com.docweaver.core.bundle;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AssetBundler}.
 */
class AssetBundlerTest {

    @TempDir
    Path tempDir;

    @Test
    void bundle_concatenatesSourcesInOrder() throws IOException {
        // Given
        Path first = Files.writeString(tempDir.resolve("a.js"), "var a = 1;");
        Path second = Files.writeString(tempDir.resolve("b.js"), "var b = 2;\n");

        // When
        BundleResult result = new AssetBundler().bundle("app.js", List.of(first, second), null);

        // Then
        assertThat(result.file().relativePath()).isEqualTo("app.js");
        assertThat(result.file().content()).isEqualTo("var a = 1;\nvar b = 2;\n");
        assertThat(result.file().contentType()).isEqualTo("text/javascript");
        assertThat(result.failedSources()).isEmpty();
    }

    @Test
    void bundle_withPrelude_placesItFirst() throws IOException {
        Path source = Files.writeString(tempDir.resolve("a.js"), "init();");

        BundleResult result = new AssetBundler().bundle("app.js", List.of(source), "window.x = {};");

        assertThat(result.file().content()).isEqualTo("window.x = {};\ninit();\n");
    }

    @Test
    void bundle_unreadableSource_isSkippedAndReported() throws IOException {
        Path present = Files.writeString(tempDir.resolve("site.css"), "body {}");
        Path missing = tempDir.resolve("missing.css");

        BundleResult result = new AssetBundler().bundle("Styles.CSS", List.of(missing, present), null);

        assertThat(result.file().content()).isEqualTo("body {}\n");
        assertThat(result.file().contentType()).isEqualTo("text/css");
        assertThat(result.failedSources()).containsExactly(missing);
    }

    @Test
    void bundle_appliesMinifier() throws IOException {
        Path source = Files.writeString(tempDir.resolve("a.css"), "a {  }\n");

        BundleResult result = new AssetBundler((content, target) -> content.replaceAll("\\s+", ""))
            .bundle("data.txt", List.of(source), null);

        assertThat(result.file().content()).isEqualTo("a{}");
        assertThat(result.file().contentType()).isEqualTo("text/plain");
    }
}
