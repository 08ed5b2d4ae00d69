package com.kbhealth.backend.scraping;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Converts article HTML into the markdown-flavoured text the audit rules read: ATX headings,
 * inline links and images, list items and blank-line separated paragraphs.
 */
public final class HtmlToMarkdown {

    private HtmlToMarkdown() {
    }

    public static String convert(Element root) {
        if (root == null) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        appendBlock(root, out, 0);
        return out.toString()
                .replaceAll("[ \\t]+\\n", "\n")
                .replaceAll("\\n{3,}", "\n\n")
                .trim();
    }

    private static void appendBlock(Element element, StringBuilder out, int listDepth) {
        for (Node child : element.childNodes()) {
            if (child instanceof TextNode) {
                String text = ((TextNode) child).text();
                if (!text.isBlank()) {
                    out.append(text.trim()).append(' ');
                }
            } else if (child instanceof Element) {
                appendElement((Element) child, out, listDepth);
            }
        }
    }

    private static void appendElement(Element el, StringBuilder out, int listDepth) {
        String tag = el.normalName();
        switch (tag) {
            case "script":
            case "style":
            case "noscript":
            case "nav":
            case "footer":
            case "form":
                return;
            case "h1":
            case "h2":
            case "h3":
            case "h4":
            case "h5":
            case "h6":
                int level = tag.charAt(1) - '0';
                newParagraph(out);
                out.append("#".repeat(level)).append(' ').append(inline(el).trim()).append("\n\n");
                return;
            case "p":
                String paragraph = inline(el).trim();
                if (!paragraph.isEmpty()) {
                    newParagraph(out);
                    out.append(paragraph).append("\n\n");
                }
                return;
            case "ul":
            case "ol":
                newLine(out);
                int index = 1;
                for (Element item : el.children()) {
                    if (!item.normalName().equals("li")) {
                        continue;
                    }
                    out.append("  ".repeat(listDepth))
                            .append(tag.equals("ol") ? (index++) + ". " : "- ")
                            .append(inline(item, true).trim())
                            .append('\n');
                    for (Element nested : item.children()) {
                        if (nested.normalName().equals("ul") || nested.normalName().equals("ol")) {
                            appendElement(nested, out, listDepth + 1);
                        }
                    }
                }
                if (listDepth == 0) {
                    out.append('\n');
                }
                return;
            case "pre":
                newParagraph(out);
                out.append("```\n").append(el.wholeText().trim()).append("\n```\n\n");
                return;
            case "blockquote":
                newParagraph(out);
                for (String line : inline(el).trim().split("\n")) {
                    out.append("> ").append(line.trim()).append('\n');
                }
                out.append('\n');
                return;
            case "br":
                out.append('\n');
                return;
            case "hr":
                newParagraph(out);
                out.append("---\n\n");
                return;
            case "img":
            case "a":
            case "strong":
            case "b":
            case "em":
            case "i":
            case "code":
            case "span":
                out.append(inline(el)).append(' ');
                return;
            default:
                appendBlock(el, out, listDepth);
                if (el.isBlock()) {
                    newLine(out);
                }
        }
    }

    private static String inline(Element el) {
        return inline(el, false);
    }

    private static String inline(Element el, boolean skipNestedLists) {
        String tag = el.normalName();
        if (tag.equals("img")) {
            String src = el.hasAttr("src") ? el.absUrl("src") : el.absUrl("data-src");
            if (src.isEmpty()) {
                src = el.attr("src");
            }
            return "![" + el.attr("alt").trim() + "](" + src + ")";
        }
        if (tag.equals("br")) {
            return "\n";
        }

        StringBuilder text = new StringBuilder();
        for (Node child : el.childNodes()) {
            if (child instanceof TextNode) {
                text.append(((TextNode) child).text());
            } else if (child instanceof Element) {
                Element childEl = (Element) child;
                String childTag = childEl.normalName();
                if (skipNestedLists && (childTag.equals("ul") || childTag.equals("ol"))) {
                    continue;
                }
                text.append(inline(childEl, skipNestedLists));
            }
        }
        String content = text.toString().replaceAll("[ \\t\\x0B\\f\\r]+", " ");

        switch (tag) {
            case "a":
                String href = el.absUrl("href");
                if (href.isEmpty()) {
                    href = el.attr("href");
                }
                if (href.isEmpty()) {
                    return content;
                }
                return "[" + content.trim() + "](" + href + ")";
            case "strong":
            case "b":
                return content.isBlank() ? content : "**" + content.trim() + "**";
            case "em":
            case "i":
                return content.isBlank() ? content : "*" + content.trim() + "*";
            case "code":
                return "`" + content.trim() + "`";
            default:
                return content;
        }
    }

    private static void newParagraph(StringBuilder out) {
        if (out.length() == 0) {
            return;
        }
        newLine(out);
        if (out.length() >= 2 && out.charAt(out.length() - 2) != '\n') {
            out.append('\n');
        }
    }

    private static void newLine(StringBuilder out) {
        if (out.length() > 0 && out.charAt(out.length() - 1) != '\n') {
            out.append('\n');
        }
    }
}
