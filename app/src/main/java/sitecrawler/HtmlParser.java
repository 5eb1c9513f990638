package sitecrawler;

import java.io.IOException;

/**
 * Structural HTML parsing capability. The crawl core only needs a title, the visible text
 * and the raw href values; any parser able to produce those can be plugged in.
 */
@FunctionalInterface
public interface HtmlParser {

    /**
     * @param charset declared charset, or null to let the parser detect it
     * @param baseUrl URL the document was fetched from
     */
    ParsedHtml parse(byte[] body, String charset, String baseUrl) throws IOException;
}
