package com.docweaver;

import com.docweaver.cli.ExitCodes;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DocWeaverCLI}.
 */
class DocWeaverCLITest {

    @Test
    void execute_withoutCommand_succeeds() {
        assertThat(DocWeaverCLI.createCommandLine().execute()).isEqualTo(ExitCodes.OK);
    }

    @Test
    void execute_unknownOption_returnsUsageError() {
        assertThat(DocWeaverCLI.createCommandLine().execute("--no-such-option")).isEqualTo(ExitCodes.USAGE);
    }

    @Test
    void execute_unknownCommand_returnsUsageError() {
        assertThat(DocWeaverCLI.createCommandLine().execute("publish")).isEqualTo(ExitCodes.USAGE);
    }

    @Test
    void createCommandLine_registersSubcommands() {
        CommandLine commandLine = DocWeaverCLI.createCommandLine();

        assertThat(commandLine.getSubcommands()).containsOnlyKeys("build", "theme", "validate");
    }

    @Test
    void globalOptions_areParsed() {
        CommandLine commandLine = DocWeaverCLI.createCommandLine();

        commandLine.parseArgs("-v", "validate");

        DocWeaverCLI cli = commandLine.getCommand();
        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }
}
