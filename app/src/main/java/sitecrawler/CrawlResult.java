package sitecrawler;

import java.util.List;

// Outcome of one crawl run. records are in emission order.
public record CrawlResult(
        String seedUrl,
        List<PageRecord> records,
        int succeeded,
        int failed,
        int skipped,
        int duplicates,
        boolean cancelled
) {

    public CrawlResult {
        records = List.copyOf(records);
    }

    public int pagesProcessed() {
        return records.size();
    }

    // True when the seed itself could not be fetched (the CLI exits non-zero on this).
    public boolean seedFailed() {
        return !records.isEmpty()
                && records.get(0).depth() == 0
                && records.get(0).status() == RecordStatus.FAILED;
    }
}
