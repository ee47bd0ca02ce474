package com.docweaver.cli;

import com.docweaver.core.config.ProjectConfig;
import com.docweaver.core.markdown.MarkdownTransformer;
import com.docweaver.core.model.ApiModelReader;
import com.docweaver.core.theme.ParameterValidator;
import com.docweaver.core.theme.Theme;
import com.docweaver.core.theme.ThemeLoader;
import com.docweaver.core.theme.ThemeSettings;
import com.docweaver.core.theme.ThemeSettingsResolver;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to validate configuration, theme and API model without generating output.
 *
 * <p>Theme settings that would be rejected during a build are listed as warnings; they do
 * not make validation fail.
 */
@Command(
    name = "validate",
    description = "Validate configuration, theme and API model",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Mixin
    private ProjectOptions project;

    @Override
    public Integer call() {
        try {
            log.info("Validating configuration: {}", project.configPath);
            ProjectConfig config = project.loadConfiguration();
            System.out.println("✓ Configuration is valid: " + project.configPath);

            ParameterValidator validator = new ParameterValidator(new MarkdownTransformer());
            Theme theme = ThemeLoader.forConvention(Path.of(config.themesDirectory()), config.convention(), validator)
                .load(config.theme());
            System.out.println("✓ Theme is valid: " + String.join(" -> ", theme.getChain()));

            ThemeSettings settings = new ThemeSettingsResolver(validator).resolve(theme, config.themeSettings());
            settings.warnings().forEach(warning -> System.err.println("⚠ " + warning));

            if (config.apiModel() != null) {
                int namespaces = ApiModelReader.read(Path.of(config.apiModel())).namespaces().size();
                System.out.println("✓ API model is valid: " + namespaces + " namespaces");
            }
            return ExitCodes.OK;
        } catch (RuntimeException e) {
            return ExitCodes.report("Validation", e, log);
        }
    }
}
