package sitecrawler;

import java.util.List;

// Fields the extractor contributes to a PageRecord. warning is non-null when extraction degraded.
public record Extraction(String title, String metaDescription, String snippet, List<String> links, String warning) {

    public Extraction {
        links = links == null ? List.of() : List.copyOf(links);
    }

    public static Extraction empty() {
        return new Extraction("", "", "", List.of(), null);
    }

    public static Extraction degraded(String warning) {
        return new Extraction("", "", "", List.of(), warning);
    }

    public boolean isDegraded() {
        return warning != null;
    }
}
