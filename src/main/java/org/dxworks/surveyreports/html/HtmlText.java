package org.dxworks.surveyreports.html;

import org.apache.commons.text.translate.CharSequenceTranslator;
import org.apache.commons.text.translate.LookupTranslator;
import org.jsoup.Jsoup;

import java.util.Map;

/**
 * Plain-text helpers for the HTML snippets Qualtrics embeds in descriptions and choice labels.
 */
public final class HtmlText {

    // Markup-significant characters only; other text, accented letters included, is written as is.
    private static final CharSequenceTranslator ESCAPE_MARKUP = new LookupTranslator(Map.of(
            "&", "&amp;",
            "<", "&lt;",
            ">", "&gt;",
            "\"", "&quot;"));

    private HtmlText() {}

    /**
     * Text content of an HTML fragment: tags dropped, entities decoded, whitespace normalized.
     */
    public static String clean(String html) {
        if (html == null) return "";
        return Jsoup.parse(html).text().replace('\u00A0', ' ').trim();
    }

    public static String escape(String text) {
        return text == null ? "" : ESCAPE_MARKUP.translate(text);
    }
}
