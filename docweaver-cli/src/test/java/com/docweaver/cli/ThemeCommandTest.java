package com.docweaver.cli;

import com.docweaver.DocWeaverCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ThemeCommand}.
 */
class ThemeCommandTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    @Test
    void theme_printsResolvedTheme() throws IOException {
        // Given
        CliTestProject.create(tempDir, "outputDirectory: site\n");

        // When
        int exitCode = DocWeaverCLI.createCommandLine()
            .execute("theme", "classic", "--themes", tempDir.resolve("themes").toString(), "--convention", "DocFX");

        // Then
        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        String output = captured.toString(StandardCharsets.UTF_8);
        assertThat(output)
            .contains("Chain: classic -> base")
            .contains("Name: Classic")
            .contains("Parameters (2):")
            .contains("main.js <- 1 file(s)")
            .contains("site.css <- 1 file(s)")
            .contains("Assets: 1");
    }

    @Test
    void theme_unknownTheme_returnsValidationError() throws IOException {
        CliTestProject.create(tempDir, "outputDirectory: site\n");

        int exitCode = DocWeaverCLI.createCommandLine()
            .execute("theme", "missing", "--themes", tempDir.resolve("themes").toString());

        assertThat(exitCode).isEqualTo(ExitCodes.VALIDATION);
    }
}
