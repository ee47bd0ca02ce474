package com.docweaver.core.renderer.impl;

import com.docweaver.core.renderer.GeneratedFile;
import com.docweaver.core.renderer.GeneratedOutput;
import com.docweaver.core.renderer.OutputRenderer;
import com.docweaver.core.renderer.RenderContext;
import com.docweaver.core.renderer.RenderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Renderer that writes generated files to the filesystem.
 *
 * <p>Creates directory structure automatically and preserves relative paths.
 * Handles existing files by overwriting them. A file that cannot be written is logged as an
 * error and skipped.
 *
 * <p><b>Configuration:</b>
 * <ul>
 *   <li>{@code outputDirectory} - Target directory (from RenderContext)</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext("./site", Map.of());
 *
 * GeneratedOutput output = new GeneratedOutput(List.of(
 *     GeneratedFile.text("topics/intro.html", "<h1>Intro</h1>", "text/html"),
 *     GeneratedFile.copy("images/logo.png", Path.of("images/logo.png"))
 * ));
 *
 * RenderResult result = new FileSystemRenderer().render(output, context);
 * // Creates: ./site/topics/intro.html and ./site/images/logo.png
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public RenderResult render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory()).toAbsolutePath().normalize();
        logger.info("Rendering {} files to filesystem at: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
            logger.debug("Output directory created/verified: {}", outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        int written = 0;
        List<String> failures = new ArrayList<>();
        for (GeneratedFile file : output.files()) {
            try {
                writeFile(outputDir, file);
                written++;
            } catch (IOException | IllegalStateException e) {
                logger.error("Failed to write file: {}", file.relativePath(), e);
                failures.add(file.relativePath());
            }
        }

        logger.info("Rendered {} files to filesystem ({} failed)", written, failures.size());
        return new RenderResult(written, failures);
    }

    /**
     * Writes a single file to the filesystem.
     *
     * @param outputDir base output directory
     * @param file file to write
     * @throws IOException if the file cannot be written
     * @throws IllegalStateException if the file would be placed outside the output directory
     */
    private void writeFile(Path outputDir, GeneratedFile file) throws IOException {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir)) {
            throw new IllegalStateException("File is outside the output directory: " + file.relativePath());
        }
        logger.debug("Writing file: {}", targetPath);

        Path parentDir = targetPath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }

        if (file.isCopy()) {
            Files.copy(file.source(), targetPath, StandardCopyOption.REPLACE_EXISTING);
            logger.debug("Copied file: {} from {}", file.relativePath(), file.source());
        } else {
            Files.writeString(targetPath, file.content());
            logger.debug("Wrote file: {} ({} chars)", file.relativePath(), file.content().length());
        }
    }
}
