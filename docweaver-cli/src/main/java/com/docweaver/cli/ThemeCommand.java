package com.docweaver.cli;

import com.docweaver.core.config.DocConvention;
import com.docweaver.core.config.ProjectConfig;
import com.docweaver.core.markdown.MarkdownTransformer;
import com.docweaver.core.theme.ParameterValidator;
import com.docweaver.core.theme.Theme;
import com.docweaver.core.theme.ThemeLoader;
import com.docweaver.core.theme.ThemeMetadata;
import com.docweaver.core.theme.ThemeParameter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to show a resolved theme: its chain, metadata, parameters and files.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * docweaver theme classic
 * docweaver theme modern --themes ./themes --convention devops
 * }</pre>
 */
@Command(
    name = "theme",
    description = "Show a resolved theme",
    mixinStandardHelpOptions = true
)
public class ThemeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ThemeCommand.class);

    @Parameters(index = "0", description = "Theme to show", defaultValue = ProjectConfig.DEFAULT_THEME)
    private String themeName;

    @Option(
        names = {"--themes"},
        description = "Themes directory (default: themes)"
    )
    private Path themesDirectory = Paths.get(ProjectConfig.DEFAULT_THEMES_DIRECTORY);

    @Option(
        names = {"--convention"},
        description = "Documentation convention: ${COMPLETION-CANDIDATES} (default: dotnet)"
    )
    private DocConvention convention = DocConvention.DOTNET;

    @Override
    public Integer call() {
        try {
            ThemeLoader loader = ThemeLoader.forConvention(themesDirectory, convention,
                new ParameterValidator(new MarkdownTransformer()));
            Theme theme = loader.load(themeName);
            log.debug("Showing theme {}", theme);

            ThemeMetadata metadata = theme.getMetadata();
            System.out.println("Theme: " + theme.getId());
            System.out.println("Chain: " + String.join(" -> ", theme.getChain()));
            printIfPresent("Name", metadata.name());
            printIfPresent("Version", metadata.version());
            printIfPresent("Description", metadata.description());
            printIfPresent("Author", metadata.author());
            printIfPresent("License", metadata.license());
            if (metadata.homepage() != null) {
                printIfPresent("Homepage", metadata.homepage().toString());
            }

            System.out.println();
            System.out.println("Parameters (" + theme.getParameters().size() + "):");
            for (Map.Entry<String, ThemeParameter> entry : theme.getParameters().entrySet()) {
                ThemeParameter parameter = entry.getValue();
                String line = "  " + entry.getKey() + " : " + parameter.type().displayName();
                if (parameter.hasDefault()) {
                    line += " = " + parameter.defaultValue();
                }
                System.out.println(line);
                if (parameter.description() != null && !parameter.description().isBlank()) {
                    System.out.println("      " + parameter.description());
                }
            }

            System.out.println();
            System.out.println("Templates: " + String.join(", ", theme.getTemplates().keySet()));
            printBundles("Scripts", theme.getScripts());
            printBundles("Styles", theme.getStyles());
            System.out.println("Assets: " + theme.getAssets().size());
            return ExitCodes.OK;
        } catch (RuntimeException e) {
            return ExitCodes.report("Theme resolution", e, log);
        }
    }

    private static void printIfPresent(String label, String value) {
        if (value != null && !value.isBlank()) {
            System.out.println(label + ": " + value);
        }
    }

    private static void printBundles(String label, Map<String, List<Path>> bundles) {
        System.out.println(label + ":");
        bundles.forEach((target, files) -> System.out.println("  " + target + " <- " + files.size() + " file(s)"));
    }
}
