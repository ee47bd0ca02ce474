package com.docweaver.cli;

import com.docweaver.core.bundle.AssetBundler;
import com.docweaver.core.config.ProjectConfig;
import com.docweaver.core.context.DocContext;
import com.docweaver.core.context.DocContextBuilder;
import com.docweaver.core.markdown.MarkdownTransformer;
import com.docweaver.core.renderer.OutputRenderer;
import com.docweaver.core.renderer.RenderContext;
import com.docweaver.core.renderer.impl.ConsoleRenderer;
import com.docweaver.core.renderer.impl.FileSystemRenderer;
import com.docweaver.core.service.DocumentationService;
import com.docweaver.core.service.GenerationReport;
import com.docweaver.core.service.TopicPageComposer;
import com.docweaver.core.theme.ParameterValidator;
import com.docweaver.core.theme.Theme;
import com.docweaver.core.theme.ThemeLoader;
import com.docweaver.core.theme.ThemeSettings;
import com.docweaver.core.theme.ThemeSettingsResolver;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to generate the documentation site.
 *
 * <p>Orchestrates the full documentation pipeline:
 * <ol>
 *   <li>Load and validate {@code docweaver.yaml}</li>
 *   <li>Resolve the theme through its inheritance chain</li>
 *   <li>Resolve the theme settings</li>
 *   <li>Read the API model and collect topics</li>
 *   <li>Compose pages, bundle scripts and styles, copy assets</li>
 * </ol>
 *
 * <p>The theme is resolved before anything is written, so an invalid theme leaves the
 * output directory untouched.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Build using ./docweaver.yaml
 * docweaver build
 *
 * # Build another project into a custom directory
 * docweaver build -c ../lib/docweaver.yaml -o /tmp/site
 *
 * # List the files that would be written
 * docweaver build --dry-run
 * }</pre>
 */
@Command(
    name = "build",
    description = "Generate the documentation site",
    mixinStandardHelpOptions = true
)
public class BuildCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @Mixin
    private ProjectOptions project;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"--dry-run"},
        description = "List the files that would be written without writing them"
    )
    private boolean dryRun;

    @Option(
        names = {"--no-color"},
        description = "Disable ANSI colors in dry-run output"
    )
    private boolean noColor;

    @Override
    public Integer call() {
        try {
            ProjectConfig config = project.loadConfiguration();
            if (outputDir != null) {
                config = config.withPaths(config.baseDirectory(), config.themesDirectory(), config.apiModel(),
                    outputDir.toAbsolutePath().normalize().toString());
            }
            System.out.println("Building documentation: " + config.baseDirectory());

            MarkdownTransformer markdown = new MarkdownTransformer();
            ParameterValidator validator = new ParameterValidator(markdown);

            ThemeLoader loader = ThemeLoader.forConvention(Path.of(config.themesDirectory()), config.convention(), validator);
            Theme theme = loader.load(config.theme());
            System.out.println("✓ Loaded theme " + String.join(" -> ", theme.getChain()));

            ThemeSettings settings = new ThemeSettingsResolver(validator).resolve(theme, config.themeSettings());
            settings.warnings().forEach(warning -> System.err.println("⚠ " + warning));

            DocContext context = new DocContextBuilder().build(config, theme);
            System.out.println("✓ Collected " + context.getTopics().size() + " top-level topics and "
                + context.getApiModel().namespaces().size() + " namespaces");

            OutputRenderer renderer = dryRun ? new ConsoleRenderer() : new FileSystemRenderer();
            RenderContext renderContext = new RenderContext(config.outputDirectory(),
                Map.of("console.colors", String.valueOf(!noColor)));

            DocumentationService service = new DocumentationService(new TopicPageComposer(markdown), new AssetBundler());
            GenerationReport report = service.generate(theme, settings, context, renderer, renderContext);

            System.out.println("✓ Generated " + report.pages() + " pages, " + report.bundles() + " bundles, "
                + report.assets() + " assets");
            if (report.hasErrors()) {
                System.err.println("✗ " + report.errors().size() + " file(s) failed:");
                report.errors().forEach(error -> System.err.println("    - " + error));
                return ExitCodes.GENERATION_ERRORS;
            }

            System.out.println("✓ Build complete: " + config.outputDirectory());
            return ExitCodes.OK;
        } catch (RuntimeException e) {
            return ExitCodes.report("Build", e, log);
        }
    }
}
