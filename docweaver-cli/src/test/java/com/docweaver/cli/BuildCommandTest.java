package com.docweaver.cli;

import com.docweaver.DocWeaverCLI;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link BuildCommand}.
 */
class BuildCommandTest {

    private static final String CONFIG = """
        convention: docfx
        theme: classic
        themeSettings:
          title: "Acme Docs"
          showSearch: "maybe"
        apiModel: api.json
        topics: ["**"]
        topicHierarchy: directory
        outputDirectory: site
        """;

    @TempDir
    Path tempDir;

    @Test
    void build_validProject_writesSite() throws IOException {
        // Given
        Path config = CliTestProject.create(tempDir, CONFIG);

        // When
        int exitCode = DocWeaverCLI.createCommandLine().execute("build", "-c", config.toString());

        // Then
        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        Path site = tempDir.resolve("site");
        assertThat(Files.readString(site.resolve("topics/intro.html")))
            .contains("<h1>Introduction</h1>")
            .contains("<strong>Acme</strong>");
        assertThat(site.resolve("topics/guides/install.html")).exists();
        assertThat(Files.readString(site.resolve("main.js")))
            .startsWith("window.docweaver = {\"sitemap\":[")
            .contains("\"config\":{\"showSearch\":true,\"title\":\"Acme Docs\"}")
            .endsWith("renderNav(window.docweaver.sitemap);\n");
        assertThat(Files.readString(site.resolve("site.css"))).isEqualTo("body { margin: 0; }\n");
        assertThat(site.resolve("images/logo.svg")).exists();
    }

    @Test
    void build_outputOverride_writesToGivenDirectory() throws IOException {
        Path config = CliTestProject.create(tempDir, CONFIG);
        Path output = tempDir.resolve("custom");

        int exitCode = DocWeaverCLI.createCommandLine()
            .execute("build", "-c", config.toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(output.resolve("topics/intro.html")).exists();
        assertThat(tempDir.resolve("site")).doesNotExist();
    }

    @Test
    void build_dryRun_writesNothing() throws IOException {
        Path config = CliTestProject.create(tempDir, CONFIG);

        int exitCode = DocWeaverCLI.createCommandLine()
            .execute("build", "-c", config.toString(), "--dry-run", "--no-color");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(tempDir.resolve("site")).doesNotExist();
    }

    @Test
    void build_unknownTheme_failsBeforeWriting() throws IOException {
        Path config = CliTestProject.create(tempDir, CONFIG);

        int exitCode = DocWeaverCLI.createCommandLine()
            .execute("build", "-c", config.toString(), "--theme", "missing");

        assertThat(exitCode).isEqualTo(ExitCodes.VALIDATION);
        assertThat(tempDir.resolve("site")).doesNotExist();
    }

    @Test
    void build_invalidConfiguration_returnsValidationError() throws IOException {
        Path config = CliTestProject.create(tempDir, """
            baseUrl: "not absolute"
            outputDirectory: site
            """);

        int exitCode = DocWeaverCLI.createCommandLine().execute("build", "-c", config.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.VALIDATION);
    }

    @Test
    void build_missingConfiguration_returnsValidationError() {
        int exitCode = DocWeaverCLI.createCommandLine()
            .execute("build", "-c", tempDir.resolve("docweaver.yaml").toString());

        assertThat(exitCode).isEqualTo(ExitCodes.VALIDATION);
    }
}
