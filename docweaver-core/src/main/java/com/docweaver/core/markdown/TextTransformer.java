package com.docweaver.core.markdown;

/**
 * Converts text from one markup format to another.
 *
 * <p>Theme parameters of type Markdown are passed through a transformer once, when they
 * are validated, so templates receive ready-to-render output.
 */
@FunctionalInterface
public interface TextTransformer {

    /**
     * Transformer that returns its input unchanged.
     */
    TextTransformer IDENTITY = text -> text;

    /**
     * Transforms the given text.
     *
     * @param text source text
     * @return transformed text, never null
     */
    String transform(String text);
}
