package com.docweaver.core.renderer.impl;

import com.docweaver.core.renderer.GeneratedFile;
import com.docweaver.core.renderer.GeneratedOutput;
import com.docweaver.core.renderer.OutputRenderer;
import com.docweaver.core.renderer.RenderContext;
import com.docweaver.core.renderer.RenderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Renderer that lists generated files on the console instead of writing them.
 *
 * <p>Used for dry runs. Supports colored output for better readability in terminals. Color
 * support can be disabled via settings for compatibility with CI/CD environments or when
 * redirecting output.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 *   <li>{@code console.showContent} - Print the content of text files ("true"/"false", default: "false")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private final PrintStream out;

    /**
     * Creates a renderer printing to standard output.
     */
    public ConsoleRenderer() {
        this(System.out);
    }

    /**
     * Creates a renderer printing to the given stream.
     *
     * @param out target stream
     */
    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public RenderResult render(GeneratedOutput output, RenderContext context) {
        boolean useColors = context.isEnabled("console.colors", true);
        boolean showContent = context.isEnabled("console.showContent", false);

        logger.info("Rendering {} files to console (colors: {}, content: {})",
            output.files().size(), useColors, showContent);

        String summaryColor = useColors ? ANSI_BOLD + ANSI_GREEN : "";
        String pathColor = useColors ? ANSI_CYAN : "";
        String metaColor = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";

        out.println(summaryColor + "Would write " + output.files().size() + " file(s) to "
            + context.outputDirectory() + " (" + output.copyCount() + " copied)" + reset);
        for (GeneratedFile file : output.files()) {
            if (file.isCopy()) {
                out.println(pathColor + file.relativePath() + reset + metaColor + "  <- " + file.source() + reset);
                continue;
            }

            String type = file.contentType() == null ? "" : "  " + file.contentType();
            out.println(pathColor + file.relativePath() + reset + metaColor + type
                + " (" + file.content().length() + " chars)" + reset);
            if (showContent) {
                out.println(file.content());
                out.println();
            }
        }

        return new RenderResult(output.files().size(), List.of());
    }
}
