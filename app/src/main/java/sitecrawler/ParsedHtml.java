package sitecrawler;

import java.util.List;

// What an HtmlParser hands back. rawLinks are href attribute values as written in the page.
public record ParsedHtml(String title, String metaDescription, String text, List<String> rawLinks) {

    public ParsedHtml {
        title = title == null ? "" : title;
        metaDescription = metaDescription == null ? "" : metaDescription;
        text = text == null ? "" : text;
        rawLinks = rawLinks == null ? List.of() : List.copyOf(rawLinks);
    }
}
