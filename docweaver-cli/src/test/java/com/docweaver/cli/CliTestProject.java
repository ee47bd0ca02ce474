package com.docweaver.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a small documentation project with an HTML theme for command tests.
 */
final class CliTestProject {

    private CliTestProject() {
    }

    /**
     * Creates the project.
     *
     * @param root directory to create the project in
     * @param configYaml content of {@code docweaver.yaml}
     * @return path of the configuration file
     */
    static Path create(Path root, String configYaml) throws IOException {
        write(root.resolve("intro.md"), "# Introduction\n\nWelcome to **Acme**.");
        write(root.resolve("guides/install.md"), "# Installation");
        write(root.resolve("api.json"), """
            {"assemblies":[{"name":"Acme","namespaces":[{"name":"Acme","url":"api/Acme.html",
              "types":[{"name":"Widget","url":"api/Acme.Widget.html","kind":"class"}]}]}]}
            """);

        Path themes = root.resolve("themes/html");
        write(themes.resolve("base/theme.json"), """
            {
              "metadata": { "name": "Base" },
              "parameters": { "title": { "type": "String", "defaultValue": "Docs" } },
              "scripts": { "source": ["scripts/"], "targetPath": "main.js" },
              "styles": { "source": ["styles/"], "targetPath": "site.css" }
            }
            """);
        write(themes.resolve("base/scripts/nav.js"), "renderNav(window.docweaver.sitemap);");
        write(themes.resolve("base/styles/site.css"), "body { margin: 0; }");
        write(themes.resolve("classic/theme.json"), """
            {
              "base": "base",
              "metadata": { "name": "Classic", "version": "1.0.0" },
              "parameters": { "showSearch": { "type": "Boolean", "defaultValue": true } },
              "assets": ["images/*"]
            }
            """);
        write(themes.resolve("classic/images/logo.svg"), "<svg/>");

        return write(root.resolve("docweaver.yaml"), configYaml);
    }

    private static Path write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }
}
