package sitecrawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

// HtmlParser backed by jsoup. jsoup repairs broken markup rather than rejecting it.
public class JsoupHtmlParser implements HtmlParser {

    @Override
    public ParsedHtml parse(byte[] body, String charset, String baseUrl) throws IOException {
        Document doc = Jsoup.parse(new ByteArrayInputStream(body), charset, baseUrl == null ? "" : baseUrl);

        Element meta = doc.selectFirst("meta[name=description]");
        String metaDescription = meta == null ? "" : meta.attr("content").trim();

        List<String> hrefs = new ArrayList<>();
        for (Element a : doc.select("a[href]")) {
            hrefs.add(a.attr("href"));
        }

        String text = doc.body() == null ? "" : doc.body().text();
        return new ParsedHtml(doc.title().trim(), metaDescription, text, hrefs);
    }
}
