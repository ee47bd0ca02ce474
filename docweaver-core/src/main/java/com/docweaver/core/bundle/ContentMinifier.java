package com.docweaver.core.bundle;

/**
 * Shrinks the text of a script or style bundle.
 *
 * <p>Minification itself is left to external tools; {@link #NONE} keeps content unchanged.
 */
@FunctionalInterface
public interface ContentMinifier {

    /** Minifier returning its input unchanged. */
    ContentMinifier NONE = (content, targetPath) -> content;

    /**
     * Minifies bundle content.
     *
     * @param content concatenated bundle text
     * @param targetPath output path of the bundle, identifying its language by extension
     * @return minified text
     */
    String minify(String content, String targetPath);
}
