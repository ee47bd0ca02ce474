package com.docweaver.core.bundle;

import com.docweaver.core.renderer.GeneratedFile;
import com.docweaver.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Concatenates theme script and style files into bundles.
 *
 * <p>Sources are joined in order, each starting on a new line. An optional prelude is placed
 * before the first source. A source that cannot be read is logged as an error and left out;
 * the bundle is still produced from the remaining sources.
 */
public class AssetBundler {

    private static final Logger log = LoggerFactory.getLogger(AssetBundler.class);

    private final ContentMinifier minifier;

    /**
     * Creates a bundler that does not minify.
     */
    public AssetBundler() {
        this(ContentMinifier.NONE);
    }

    /**
     * Creates a bundler.
     *
     * @param minifier minifier applied to each finished bundle
     */
    public AssetBundler(ContentMinifier minifier) {
        this.minifier = Objects.requireNonNull(minifier, "minifier must not be null");
    }

    /**
     * Bundles source files.
     *
     * @param targetPath output path of the bundle, relative to the output directory
     * @param sources files to concatenate, in order
     * @param prelude text placed before the sources, or null
     * @return the bundle and any sources that failed
     */
    public BundleResult bundle(String targetPath, List<Path> sources, String prelude) {
        StringBuilder content = new StringBuilder();
        if (prelude != null && !prelude.isEmpty()) {
            content.append(prelude).append('\n');
        }

        List<Path> failed = new ArrayList<>();
        for (Path source : sources) {
            try {
                String text = FileUtils.readString(source);
                content.append(text);
                if (!text.endsWith("\n")) {
                    content.append('\n');
                }
                log.debug("Added {} to bundle {}", source, targetPath);
            } catch (IOException e) {
                log.error("Failed to read bundle source '{}' for '{}'", source, targetPath, e);
                failed.add(source);
            }
        }

        String minified = minifier.minify(content.toString(), targetPath);
        return new BundleResult(GeneratedFile.text(targetPath, minified, contentTypeOf(targetPath)), failed);
    }

    private static String contentTypeOf(String targetPath) {
        String lower = targetPath.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".js")) {
            return "text/javascript";
        }
        if (lower.endsWith(".css")) {
            return "text/css";
        }
        return "text/plain";
    }
}
