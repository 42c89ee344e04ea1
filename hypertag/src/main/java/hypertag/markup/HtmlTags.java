// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.markup;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import hypertag.dom.Tag;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The registries of element tags, built once per dialect and shared.
 * <p>
 * The HTML registry knows every element under its lower- and upper-case name; the XHTML one only under the
 * lower-case name.
 */
public final class HtmlTags {
    private HtmlTags() {
    }

    /**
     * Returns the unmodifiable registry for the given dialect, keyed by element name.
     */
    public static Map<String, Tag> forMode(final MarkupMode mode) {
        return switch (mode) {
            case HTML -> htmlTags;
            case XHTML -> xhtmlTags;
        };
    }

    /**
     * Looks up an element tag by name, or returns {@code null} if the dialect doesn't know it.
     */
    public static @Nullable Tag byName(final MarkupMode mode, final String name) {
        return forMode(mode).get(name);
    }

    /**
     * Checks whether the element with the given lower-case name takes no content.
     */
    public static boolean isVoidElement(final String name) {
        return voidElements.contains(name);
    }

    private static Map<String, Tag> build(final MarkupMode mode) {
        final var result = new LinkedHashMap<String, Tag>();
        for (final var name : allElements) {
            result.put(name, new MarkupTag(name, isVoidElement(name), mode));
        }
        if (mode == MarkupMode.HTML) {
            for (final var name : allElements) {
                final var upperName = name.toUpperCase(Locale.ROOT);
                result.put(upperName, new MarkupTag(upperName, isVoidElement(name), mode));
            }
        }
        return Map.copyOf(result);
    }

    private static final Set<String> voidElements = Set.of(
        "area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "param", "source", "track", "wbr"
    );

    private static final List<String> allElements = List.of(
        "a", "abbr", "acronym", "address", "applet", "area", "article", "aside", "audio",
        "b", "base", "basefont", "bdi", "bdo", "big", "blockquote", "body", "br", "button",
        "canvas", "caption", "center", "cite", "code", "col", "colgroup",
        "data", "datalist", "dd", "del", "details", "dfn", "dialog", "dir", "div", "dl", "dt",
        "em", "embed", "fieldset", "figcaption", "figure", "font", "footer", "form", "frame", "frameset",
        "h1", "h2", "h3", "h4", "h5", "h6", "head", "header", "hr", "html",
        "i", "iframe", "img", "input", "ins", "kbd", "label", "legend", "li", "link",
        "main", "map", "mark", "meta", "meter", "nav", "noframes", "noscript",
        "object", "ol", "optgroup", "option", "output", "p", "param", "picture", "pre", "progress",
        "q", "rp", "rt", "ruby", "s", "samp", "script", "section", "select", "small", "source", "span", "strike",
        "strong", "style", "sub", "summary", "sup", "svg",
        "table", "tbody", "td", "template", "textarea", "tfoot", "th", "thead", "time", "title", "tr", "track", "tt",
        "u", "ul", "var", "video", "wbr"
    );

    private static final Map<String, Tag> htmlTags = build(MarkupMode.HTML);
    private static final Map<String, Tag> xhtmlTags = build(MarkupMode.XHTML);
}
