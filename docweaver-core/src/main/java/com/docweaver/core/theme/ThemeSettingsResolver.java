package com.docweaver.core.theme;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Combines a theme's parameter defaults with the settings supplied for a build.
 *
 * <p>This is the lenient counterpart of definition-time validation: a setting whose value
 * does not match its parameter's type is logged as a warning and dropped, and generation
 * continues with the theme default. Settings that name no declared parameter are passed
 * through unvalidated; null settings are ignored.
 */
public class ThemeSettingsResolver {

    private static final Logger log = LoggerFactory.getLogger(ThemeSettingsResolver.class);

    private final ParameterValidator validator;

    /**
     * Creates a resolver.
     *
     * @param validator validator applied to settings of declared parameters
     */
    public ThemeSettingsResolver(ParameterValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    /**
     * Resolves the effective parameter values.
     *
     * @param theme resolved theme
     * @param settings user-supplied settings, possibly empty
     * @return effective values and any warnings raised
     */
    public ThemeSettings resolve(Theme theme, Map<String, Object> settings) {
        Objects.requireNonNull(theme, "theme must not be null");

        Map<String, Object> values = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        theme.getParameters().forEach((name, parameter) -> {
            if (parameter.hasDefault()) {
                values.put(name, parameter.defaultValue());
            }
        });

        List<String> warnings = new ArrayList<>();
        if (settings != null) {
            settings.forEach((name, value) -> {
                if (value == null) {
                    return;
                }

                ThemeParameter parameter = theme.getParameters().get(name);
                if (parameter == null) {
                    log.debug("Setting '{}' is not a parameter of theme '{}'; passing it through", name, theme.getId());
                    values.put(name, value);
                    return;
                }

                try {
                    values.put(name, validator.validate(value, parameter.type()));
                } catch (ThemeParameterFormatException e) {
                    log.warn("Invalid value for theme parameter '{}'. {}", name, e.getMessage());
                    warnings.add("Invalid value for theme parameter '" + name + "'. " + e.getMessage());
                }
            });
        }

        return new ThemeSettings(values, warnings);
    }
}
