package com.williamcallahan.citations.support;

import com.williamcallahan.citations.domain.citation.CitationLinkContract;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.safety.Safelist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * jsoup-backed sanitizer with a fixed allow-list covering document formatting and the
 * citation markup emitted by the annotation engine.
 */
@Component
public class JsoupMarkupSanitizer implements MarkupSanitizer {

    private static final Logger logger = LoggerFactory.getLogger(JsoupMarkupSanitizer.class);

    private static final String[] DOCUMENT_TAGS = {
        "h1", "h2", "h3", "h4", "h5", "h6",
        "p", "br", "hr",
        "strong", "b", "em", "i", "u", "s", "del", "ins", "sup", "sub", "span", "mark",
        "ul", "ol", "li",
        "table", "thead", "tbody", "tfoot", "tr", "th", "td", "caption",
        "blockquote", "pre", "code",
        "a", "img",
        "figure", "figcaption"
    };

    private final Safelist safelist;
    private final Document.OutputSettings outputSettings;

    public JsoupMarkupSanitizer() {
        this.safelist = new Safelist()
            .addTags(DOCUMENT_TAGS)
            .addAttributes(":all", "class", "id", "title", "style")
            .addAttributes("a", "href")
            .addAttributes("img", "src", "alt", "width", "height")
            .addAttributes("td", "colspan", "rowspan")
            .addAttributes("th", "colspan", "rowspan", "scope")
            .addAttributes("span", CitationLinkContract.REFERENCE_ATTRIBUTE)
            .addAttributes("mark", CitationLinkContract.STATE_ATTRIBUTE)
            .addProtocols("a", "href", "http", "https", "mailto", "#")
            .addProtocols("img", "src", "http", "https");
        this.outputSettings = new Document.OutputSettings().prettyPrint(false);
    }

    @Override
    public String sanitize(String markup) {
        if (markup == null || markup.isEmpty()) {
            return "";
        }
        String sanitized = Jsoup.clean(markup, "", safelist, outputSettings);
        if (logger.isDebugEnabled() && sanitized.length() != markup.length()) {
            logger.debug("Sanitizer adjusted markup: {} -> {} chars", markup.length(), sanitized.length());
        }
        return sanitized;
    }
}
