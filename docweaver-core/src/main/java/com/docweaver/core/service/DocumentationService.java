package com.docweaver.core.service;

import com.docweaver.core.bundle.AssetBundler;
import com.docweaver.core.bundle.BundleResult;
import com.docweaver.core.context.AssetReference;
import com.docweaver.core.context.DocContext;
import com.docweaver.core.renderer.GeneratedFile;
import com.docweaver.core.renderer.GeneratedOutput;
import com.docweaver.core.renderer.OutputRenderer;
import com.docweaver.core.renderer.RenderContext;
import com.docweaver.core.renderer.RenderResult;
import com.docweaver.core.sitemap.SitemapNode;
import com.docweaver.core.theme.Theme;
import com.docweaver.core.theme.ThemeSettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Generates a documentation site.
 *
 * <p>The run has four phases: pages, script bundles, style bundles and assets. Pages are
 * produced for every sitemap node with a site-relative URL. The first script bundle, in
 * target path order, starts with a prelude publishing the sitemap and the theme settings
 * to client scripts:
 * <pre>{@code
 * window.docweaver = {"sitemap":[...],"config":{...}};
 * }</pre>
 *
 * <p>A file that fails is logged as an error and recorded in the report; the run goes on
 * with the remaining files.
 */
public class DocumentationService {

    /** Name of the global script variable holding the site data. */
    public static final String GLOBAL_VARIABLE = "docweaver";

    private static final Logger log = LoggerFactory.getLogger(DocumentationService.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private final PageComposer pageComposer;
    private final AssetBundler assetBundler;

    /**
     * Creates a service.
     *
     * @param pageComposer producer of page files
     * @param assetBundler bundler for scripts and styles
     */
    public DocumentationService(PageComposer pageComposer, AssetBundler assetBundler) {
        this.pageComposer = Objects.requireNonNull(pageComposer, "pageComposer must not be null");
        this.assetBundler = Objects.requireNonNull(assetBundler, "assetBundler must not be null");
    }

    /**
     * Generates the site.
     *
     * @param theme resolved theme
     * @param settings effective theme settings
     * @param context documentation context
     * @param renderer destination of the generated files
     * @param renderContext output directory and renderer settings
     * @return summary of the run
     */
    public GenerationReport generate(Theme theme, ThemeSettings settings, DocContext context,
                                     OutputRenderer renderer, RenderContext renderContext) {
        Objects.requireNonNull(theme, "theme must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(context, "context must not be null");

        int totalSteps = context.getSitemap().getPageCount()
            + context.getAssets().size()
            + theme.getScripts().size()
            + theme.getStyles().size();
        ProgressTracker progress = new ProgressTracker(totalSteps);
        log.info("Generating documentation with theme '{}' into {} ({} steps)",
            theme.getId(), renderContext.outputDirectory(), totalSteps);

        List<GeneratedFile> files = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        int pages = composePages(context, files, errors, progress);
        int bundles = bundleScripts(theme, settings, context, files, errors, progress);
        bundles += bundleStyles(theme, files, errors, progress);
        int assets = collectAssets(context, files, progress);

        RenderResult result = renderer.render(new GeneratedOutput(files), renderContext);
        for (String failure : result.failures()) {
            errors.add("Failed to write " + failure);
        }

        GenerationReport report = new GenerationReport(pages, bundles, assets, settings.warnings(), errors);
        log.info("Generated {} pages, {} bundles and {} assets ({} warnings, {} errors)",
            pages, bundles, assets, report.warnings().size(), report.errors().size());
        return report;
    }

    /**
     * Builds the script publishing the site data to client scripts.
     *
     * @param context documentation context
     * @param settings effective theme settings
     * @return the prelude statement
     */
    public static String createPrelude(DocContext context, ThemeSettings settings) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sitemap", context.getSitemap());
        data.put("config", settings.values());
        try {
            return "window." + GLOBAL_VARIABLE + " = " + JSON_MAPPER.writeValueAsString(data) + ";";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize site data for client scripts", e);
        }
    }

    private int composePages(DocContext context, List<GeneratedFile> files, List<String> errors,
                             ProgressTracker progress) {
        progress.begin("Composing pages");
        int count = 0;
        for (SitemapNode page : pagesOf(context.getSitemap().getNodes())) {
            progress.step(page.getUrl());
            if (!isSiteRelative(page.getUrl())) {
                log.debug("Skipping external page '{}': {}", page.getTitle(), page.getUrl());
                continue;
            }
            try {
                Optional<GeneratedFile> file = pageComposer.compose(page, context);
                if (file.isPresent()) {
                    files.add(file.get());
                    count++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to compose page '{}' ({})", page.getTitle(), page.getUrl(), e);
                errors.add("Failed to compose page " + page.getUrl() + ": " + e.getMessage());
            }
        }
        return count;
    }

    private int bundleScripts(Theme theme, ThemeSettings settings, DocContext context,
                              List<GeneratedFile> files, List<String> errors, ProgressTracker progress) {
        if (theme.getScripts().isEmpty()) {
            return 0;
        }

        progress.begin("Bundling scripts");
        String prelude = createPrelude(context, settings);
        for (Map.Entry<String, List<Path>> bundle : theme.getScripts().entrySet()) {
            progress.step(bundle.getKey());
            addBundle(assetBundler.bundle(bundle.getKey(), bundle.getValue(), prelude), files, errors);
            prelude = null;
        }
        return theme.getScripts().size();
    }

    private int bundleStyles(Theme theme, List<GeneratedFile> files, List<String> errors, ProgressTracker progress) {
        if (theme.getStyles().isEmpty()) {
            return 0;
        }

        progress.begin("Bundling styles");
        for (Map.Entry<String, List<Path>> bundle : theme.getStyles().entrySet()) {
            progress.step(bundle.getKey());
            addBundle(assetBundler.bundle(bundle.getKey(), bundle.getValue(), null), files, errors);
        }
        return theme.getStyles().size();
    }

    private static void addBundle(BundleResult result, List<GeneratedFile> files, List<String> errors) {
        files.add(result.file());
        for (Path failed : result.failedSources()) {
            errors.add("Failed to read " + failed + " for bundle " + result.file().relativePath());
        }
    }

    private static int collectAssets(DocContext context, List<GeneratedFile> files, ProgressTracker progress) {
        if (context.getAssets().isEmpty()) {
            return 0;
        }

        progress.begin("Copying assets");
        for (AssetReference asset : context.getAssets()) {
            progress.step(asset.targetPath());
            files.add(GeneratedFile.copy(asset.targetPath(), asset.source()));
        }
        return context.getAssets().size();
    }

    private static List<SitemapNode> pagesOf(List<SitemapNode> nodes) {
        List<SitemapNode> pages = new ArrayList<>();
        for (SitemapNode node : nodes) {
            if (node.getUrl() != null) {
                pages.add(node);
            }
            if (node.getItems() != null) {
                pages.addAll(pagesOf(node.getItems()));
            }
        }
        return pages;
    }

    private static boolean isSiteRelative(String url) {
        try {
            URI uri = URI.create(url);
            return !uri.isAbsolute() && uri.getRawAuthority() == null && !url.startsWith("/");
        } catch (IllegalArgumentException e) {
            log.debug("Page URL is not a valid URI: {}", url);
            return false;
        }
    }
}
