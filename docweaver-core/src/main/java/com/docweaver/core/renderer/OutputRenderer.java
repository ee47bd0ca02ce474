package com.docweaver.core.renderer;

/**
 * Interface for output renderers that deliver the generated site.
 *
 * <p>Renderers write generated files to a destination: the filesystem for a build, the
 * console for a dry run. A file that cannot be delivered is logged and reported in the
 * {@link RenderResult}; the remaining files are still delivered.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class ListingRenderer implements OutputRenderer {
 *     @Override
 *     public String getId() {
 *         return "listing";
 *     }
 *
 *     @Override
 *     public RenderResult render(GeneratedOutput output, RenderContext context) {
 *         output.files().forEach(file -> System.out.println(file.relativePath()));
 *         return new RenderResult(output.files().size(), List.of());
 *     }
 * }
 * }</pre>
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Should be lowercase (e.g., "filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the generated output to the target destination.
     *
     * @param output the generated files to render
     * @param context rendering context with output directory and settings
     * @return number of files delivered and the files that failed
     * @throws IllegalStateException if the destination itself is unusable
     */
    RenderResult render(GeneratedOutput output, RenderContext context);
}
