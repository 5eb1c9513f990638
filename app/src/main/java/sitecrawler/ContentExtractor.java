package sitecrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

// Turns fetched bytes into title, snippet and normalized outbound links. Never throws on bad markup.
public class ContentExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContentExtractor.class);

    private final HtmlParser parser;
    private final int snippetLength;

    public ContentExtractor(HtmlParser parser, int snippetLength) {
        this.parser = parser;
        this.snippetLength = snippetLength;
    }

    public Extraction extract(FetchedPage page) {
        if (!isHtml(page.contentType())) {
            LOGGER.debug("Not extracting {} content from {}", page.contentType(), page.url());
            return Extraction.empty();
        }
        return extract(page.body(), page.charset(), page.finalUrl());
    }

    public Extraction extract(byte[] body, String sourceUrl) {
        return extract(body, null, sourceUrl);
    }

    public Extraction extract(byte[] body, String charset, String sourceUrl) {
        if (body == null || body.length == 0) {
            return Extraction.empty();
        }

        ParsedHtml parsed;
        try {
            parsed = parser.parse(body, charset, sourceUrl);
        } catch (Exception e) {
            LOGGER.warn("Could not parse {}: {}", sourceUrl, e.toString());
            return Extraction.degraded(e.toString());
        }

        return new Extraction(
                parsed.title(),
                parsed.metaDescription(),
                snippet(parsed.text()),
                resolveLinks(parsed.rawLinks(), sourceUrl),
                null);
    }

    // Resolve against the page, normalize, dedupe keeping first-seen order.
    private List<String> resolveLinks(List<String> rawLinks, String sourceUrl) {
        Set<String> seen = new LinkedHashSet<>();
        for (String href : rawLinks) {
            try {
                seen.add(UrlNormalizer.normalize(href, sourceUrl));
            } catch (UrlNormalizationException e) {
                LOGGER.debug("Dropping link on {}: {}", sourceUrl, e.getMessage());
            }
        }
        return new ArrayList<>(seen);
    }

    private String snippet(String text) {
        String collapsed = text.replaceAll("\\s+", " ").trim();
        if (collapsed.length() <= snippetLength) return collapsed;
        int end = snippetLength;
        // do not cut a surrogate pair in half
        if (end > 0 && Character.isHighSurrogate(collapsed.charAt(end - 1))) end--;
        return collapsed.substring(0, end);
    }

    // Missing content type: let the parser try.
    static boolean isHtml(String contentType) {
        if (contentType == null || contentType.isBlank()) return true;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("html") || ct.contains("xml");
    }
}
