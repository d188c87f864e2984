package com.example.aijobscheduler.service.render;

import com.vladsch.flexmark.ext.gfm.strikethrough.StrikethroughExtension;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.data.MutableDataSet;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts run output markdown into a standalone HTML document suitable for email clients.
 * <p>
 * Mail clients drop {@code <style>} blocks, so every element gets its styling inline.
 * Soft line breaks are kept as {@code <br />}.
 */
@Component
public class MarkdownRenderer {

    private static final Map<String, String> INLINE_STYLES = new LinkedHashMap<>();

    static {
        INLINE_STYLES.put("h1", "font-size: 2em; font-weight: 600; margin-top: 24px; margin-bottom: 16px; color: #333;");
        INLINE_STYLES.put("h2", "font-size: 1.5em; font-weight: 600; margin-top: 24px; margin-bottom: 16px; color: #333;");
        INLINE_STYLES.put("h3", "font-size: 1.25em; font-weight: 600; margin-top: 24px; margin-bottom: 16px; color: #333;");
        INLINE_STYLES.put("h4", "font-size: 1.1em; font-weight: 600; margin-top: 20px; margin-bottom: 12px; color: #333;");
        INLINE_STYLES.put("h5", "font-size: 1em; font-weight: 600; margin-top: 16px; margin-bottom: 12px; color: #333;");
        INLINE_STYLES.put("h6", "font-size: 0.9em; font-weight: 600; margin-top: 16px; margin-bottom: 12px; color: #333;");
        INLINE_STYLES.put("p", "margin-bottom: 16px; line-height: 1.6; color: #333;");
        INLINE_STYLES.put("ul", "margin-bottom: 16px; padding-left: 30px; line-height: 1.6;");
        INLINE_STYLES.put("ol", "margin-bottom: 16px; padding-left: 30px; line-height: 1.6;");
        INLINE_STYLES.put("li", "margin-bottom: 8px; color: #333;");
        INLINE_STYLES.put("code", "background-color: #f4f4f4; padding: 2px 6px; border-radius: 3px; font-family: 'Courier New', monospace; font-size: 0.9em;");
        INLINE_STYLES.put("pre", "background-color: #f4f4f4; padding: 16px; border-radius: 5px; overflow-x: auto; margin-bottom: 16px; line-height: 1.4;");
        INLINE_STYLES.put("blockquote", "border-left: 4px solid #ddd; margin: 16px 0; padding-left: 16px; color: #666; font-style: italic;");
        INLINE_STYLES.put("table", "border-collapse: collapse; width: 100%; margin-bottom: 16px;");
        INLINE_STYLES.put("th", "border: 1px solid #ddd; padding: 8px 12px; text-align: left; background-color: #f4f4f4; font-weight: 600;");
        INLINE_STYLES.put("td", "border: 1px solid #ddd; padding: 8px 12px; text-align: left;");
    }

    private static final String LINK_STYLE = "color: #0066cc; text-decoration: underline;";
    private static final Pattern LINK_TAG = Pattern.compile("<a href=\"([^\"]+)\">");

    private static final String DOCUMENT_TEMPLATE = """
            <!DOCTYPE html>
            <html>
            <head>
                <meta charset="UTF-8">
                <meta name="viewport" content="width=device-width, initial-scale=1.0">
            </head>
            <body style="font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, 'Helvetica Neue', Arial, sans-serif; line-height: 1.6; color: #333; max-width: 800px; margin: 0 auto; padding: 20px; background-color: #ffffff;">
            %s
            </body>
            </html>""";

    private final Parser parser;
    private final HtmlRenderer renderer;

    public MarkdownRenderer() {
        var options = new MutableDataSet();
        options.set(Parser.EXTENSIONS, List.of(TablesExtension.create(), StrikethroughExtension.create()));
        options.set(HtmlRenderer.SOFT_BREAK, "<br />\n");
        this.parser = Parser.builder(options).build();
        this.renderer = HtmlRenderer.builder(options).build();
    }

    /**
     * Render markdown into a complete HTML5 document with inline styles
     */
    public String toHtmlDocument(String markdown) {
        var body = renderer.render(parser.parse(markdown == null ? "" : markdown));
        return String.format(DOCUMENT_TEMPLATE, addInlineStyles(body));
    }

    static String addInlineStyles(String html) {
        var styled = html;
        for (var entry : INLINE_STYLES.entrySet()) {
            styled = styled.replace("<" + entry.getKey() + ">",
                    "<" + entry.getKey() + " style=\"" + entry.getValue() + "\">");
        }
        return LINK_TAG.matcher(styled)
                .replaceAll(match -> Matcher.quoteReplacement(
                        "<a href=\"" + match.group(1) + "\" style=\"" + LINK_STYLE + "\">"));
    }
}
