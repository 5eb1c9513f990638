package sitecrawler;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;

// One processed crawl task. Emitted exactly once per task and never changed afterwards.
@JsonPropertyOrder({"url", "depth", "status", "status_code", "title", "meta_description", "content_snippet",
        "discovered_links", "fetched_at", "error"})
public record PageRecord(
        @JsonProperty("url") String url,
        @JsonProperty("depth") int depth,
        @JsonProperty("status") RecordStatus status,
        @JsonProperty("status_code") Integer statusCode,
        @JsonProperty("title") String title,
        @JsonProperty("meta_description") String metaDescription,
        @JsonProperty("content_snippet") String contentSnippet,
        @JsonProperty("discovered_links") List<String> discoveredLinks,
        @JsonProperty("fetched_at") Instant fetchedAt,
        @JsonProperty("error") String error
) {

    public static final String REASON_ROBOTS = "robots";
    public static final String REASON_INTERNAL = "internal";
    // Prefix of the error field on a success record whose content could not be parsed
    public static final String WARNING_EXTRACTION = "extraction: ";

    public PageRecord {
        title = title == null ? "" : title;
        metaDescription = metaDescription == null ? "" : metaDescription;
        contentSnippet = contentSnippet == null ? "" : contentSnippet;
        discoveredLinks = discoveredLinks == null ? List.of() : List.copyOf(discoveredLinks);
    }

    public static PageRecord success(CrawlTask task, FetchedPage page, Extraction extraction,
                                     List<String> links, Instant at) {
        return new PageRecord(task.url(), task.depth(), RecordStatus.SUCCESS, page.statusCode(),
                extraction.title(), extraction.metaDescription(), extraction.snippet(), links, at,
                extraction.isDegraded() ? WARNING_EXTRACTION + extraction.warning() : null);
    }

    public static PageRecord failed(CrawlTask task, FetchException failure, Instant at) {
        return new PageRecord(task.url(), task.depth(), RecordStatus.FAILED, failure.statusCode(),
                null, null, null, null, at, failure.kind().label());
    }

    public static PageRecord failed(CrawlTask task, String reason, Instant at) {
        return new PageRecord(task.url(), task.depth(), RecordStatus.FAILED, null,
                null, null, null, null, at, reason);
    }

    public static PageRecord skipped(CrawlTask task, String reason, Instant at) {
        return new PageRecord(task.url(), task.depth(), RecordStatus.SKIPPED, null,
                null, null, null, null, at, reason);
    }
}
