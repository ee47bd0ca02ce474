package com.docweaver.core.markdown;

import com.vladsch.flexmark.ext.gfm.strikethrough.StrikethroughExtension;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts Markdown to HTML using flexmark.
 *
 * <p>Template expressions such as {@code {{name}}} or {@code {{{body}}}} are shielded from
 * Markdown processing and restored verbatim in the output, so Markdown parameters can
 * still reference template data.
 */
public class MarkdownTransformer implements TextTransformer {

    private static final Pattern TEMPLATE_EXPRESSION = Pattern.compile("\\{{2,}[^}]+}{2,}");

    private final Parser parser;
    private final HtmlRenderer renderer;

    /**
     * Creates a transformer with table and strikethrough support.
     */
    public MarkdownTransformer() {
        MutableDataSet options = new MutableDataSet();
        options.set(Parser.EXTENSIONS, List.of(TablesExtension.create(), StrikethroughExtension.create()));
        this.parser = Parser.builder(options).build();
        this.renderer = HtmlRenderer.builder(options).build();
    }

    @Override
    public String transform(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return "";
        }

        int id = ThreadLocalRandom.current().nextInt(100000, 1000000);
        Map<String, String> placeholders = new LinkedHashMap<>();
        Matcher matcher = TEMPLATE_EXPRESSION.matcher(markdown);
        StringBuilder shielded = new StringBuilder();
        while (matcher.find()) {
            String placeholder = "%%" + id + "!TPL" + placeholders.size() + "%%";
            placeholders.put(placeholder, matcher.group());
            matcher.appendReplacement(shielded, Matcher.quoteReplacement(placeholder));
        }
        matcher.appendTail(shielded);

        Node document = parser.parse(shielded.toString());
        String html = renderer.render(document);

        for (Map.Entry<String, String> entry : placeholders.entrySet()) {
            html = html.replace(entry.getKey(), entry.getValue());
        }
        return html;
    }
}
