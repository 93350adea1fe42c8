package dev.pekelund.receipts.extraction.sanitize;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;

/**
 * {@link MarkupStripper} backed by the jsoup cleaner with an empty safelist.
 */
public class JsoupMarkupStripper implements MarkupStripper {

    @Override
    public String strip(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        Document.OutputSettings outputSettings = new Document.OutputSettings().prettyPrint(false);
        String cleaned = Jsoup.clean(text, "", Safelist.none(), outputSettings);
        return Parser.unescapeEntities(cleaned, false);
    }
}
