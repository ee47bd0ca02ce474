package com.docweaver.core.service;

import com.docweaver.core.bundle.AssetBundler;
import com.docweaver.core.config.DocConvention;
import com.docweaver.core.context.AssetReference;
import com.docweaver.core.context.DocContext;
import com.docweaver.core.markdown.MarkdownTransformer;
import com.docweaver.core.markdown.TextTransformer;
import com.docweaver.core.model.ApiModel;
import com.docweaver.core.model.AssemblyModel;
import com.docweaver.core.model.NamespaceModel;
import com.docweaver.core.model.TopicModel;
import com.docweaver.core.renderer.RenderContext;
import com.docweaver.core.renderer.impl.FileSystemRenderer;
import com.docweaver.core.theme.ParameterValidator;
import com.docweaver.core.theme.Theme;
import com.docweaver.core.theme.ThemeConfigReader;
import com.docweaver.core.theme.ThemeLoader;
import com.docweaver.core.theme.ThemeSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DocumentationService}.
 */
class DocumentationServiceTest {

    @TempDir
    Path tempDir;

    private Theme theme;
    private DocContext context;
    private ThemeSettings settings;
    private Path output;

    @BeforeEach
    void setUp() throws IOException {
        Path themes = tempDir.resolve("themes");
        write(themes.resolve("parent/theme.json"), """
            { "scripts": { "source": ["base"], "targetPath": "base.js" } }
            """);
        write(themes.resolve("parent/base.js"), "// base");
        write(themes.resolve("child/theme.json"), """
            {
              "base": "parent",
              "scripts": { "source": ["extra"], "targetPath": "extra.js" },
              "styles": { "source": ["site"] },
              "assets": ["images/*.png"]
            }
            """);
        write(themes.resolve("child/extra.js"), "// extra");
        write(themes.resolve("child/site.css"), "body {}");
        write(themes.resolve("child/images/logo.png"), "png");
        theme = new ThemeLoader(themes, new ThemeConfigReader(new ParameterValidator(TextTransformer.IDENTITY)))
            .load("child");

        Path intro = write(tempDir.resolve("project/intro.md"), "# Intro\n\nHello.");
        ApiModel api = new ApiModel(List.of(new AssemblyModel("Acme",
            List.of(new NamespaceModel("Acme", "api/Acme.html", List.of())))));
        List<TopicModel> topics = List.of(
            new TopicModel("intro", "Intro", "topics/intro.html", intro, List.of()),
            TopicModel.leaf("external", "External", "https://other.example.com/x.html"));
        List<AssetReference> assets = List.of(
            new AssetReference(theme.getAssets().get("images/logo.png"), "images/logo.png"));
        context = new DocContext(DocConvention.DOCFX, null, api, topics, assets);

        settings = new ThemeSettings(Map.of("title", "Docs"), List.of("showSearch: expected a boolean"));
        output = tempDir.resolve("site");
    }

    private static Path write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    private GenerationReport generate(PageComposer composer) {
        DocumentationService service = new DocumentationService(composer, new AssetBundler());
        return service.generate(theme, settings, context, new FileSystemRenderer(),
            new RenderContext(output.toString(), Map.of()));
    }

    @Test
    void generate_writesPagesBundlesAndAssets() throws IOException {
        // When
        GenerationReport report = generate(new TopicPageComposer(new MarkdownTransformer()));

        // Then
        assertThat(report.pages()).isEqualTo(1);
        assertThat(report.bundles()).isEqualTo(3);
        assertThat(report.assets()).isEqualTo(1);
        assertThat(report.warnings()).containsExactly("showSearch: expected a boolean");
        assertThat(report.hasErrors()).isFalse();

        assertThat(Files.readString(output.resolve("topics/intro.html"))).contains("<h1>Intro</h1>");
        assertThat(Files.readString(output.resolve("styles.css"))).isEqualTo("body {}\n");
        assertThat(output.resolve("images/logo.png")).hasContent("png");
        assertThat(output.resolve("api/Acme.html")).doesNotExist();
    }

    @Test
    void generate_prelude_onlyInFirstScriptBundle() throws IOException {
        generate((page, ctx) -> Optional.empty());

        String first = Files.readString(output.resolve("base.js"));
        String second = Files.readString(output.resolve("extra.js"));
        assertThat(first).startsWith("window.docweaver = {\"sitemap\":[").endsWith("\n// base\n");
        assertThat(second).isEqualTo("// extra\n");
    }

    @Test
    void generate_failingPage_isReportedAndOthersContinue() throws IOException {
        // Given
        PageComposer composer = (page, ctx) -> {
            if (page.getUrl().startsWith("api/")) {
                throw new IllegalStateException("template error");
            }
            return new TopicPageComposer(TextTransformer.IDENTITY).compose(page, ctx);
        };

        // When
        GenerationReport report = generate(composer);

        // Then
        assertThat(report.pages()).isEqualTo(1);
        assertThat(report.errors()).containsExactly("Failed to compose page api/Acme.html: template error");
        assertThat(Files.readString(output.resolve("topics/intro.html"))).isEqualTo("# Intro\n\nHello.");
    }

    @Test
    void generate_missingBundleSource_isReported() throws IOException {
        Files.delete(theme.getStyles().get("styles.css").get(0));

        GenerationReport report = generate((page, ctx) -> Optional.empty());

        assertThat(report.errors()).singleElement().asString()
            .startsWith("Failed to read ")
            .endsWith("site.css for bundle styles.css");
        assertThat(output.resolve("styles.css")).hasContent("");
    }

    @Test
    void createPrelude_serializesSitemapAndSettings() {
        DocContext simple = new DocContext(DocConvention.DOCFX, null, ApiModel.empty(),
            List.of(TopicModel.leaf("intro", "Intro", "topics/intro.html")), List.of());

        String prelude = DocumentationService.createPrelude(simple, new ThemeSettings(Map.of("title", "Docs"), null));

        assertThat(prelude).isEqualTo("window.docweaver = {\"sitemap\":[{\"title\":\"Topics\",\"items\":"
            + "[{\"title\":\"Intro\",\"url\":\"topics/intro.html\"}]}],\"config\":{\"title\":\"Docs\"}};");
    }
}
