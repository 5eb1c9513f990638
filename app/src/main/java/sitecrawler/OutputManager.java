package sitecrawler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;

public class OutputManager {

    public static final String JSON_FILE = "crawl.json";
    public static final String CSV_FILE = "crawl.csv";

    // Separator for discovered_links inside one CSV cell
    public static final String LINK_DELIMITER = "|";

    private static final String CSV_HEADER =
            "url,depth,status,status_code,title,meta_description,content_snippet,discovered_links,fetched_at,error";

    // Base directory for this run: <outputDir>/<runId>
    private final Path runOutputDir;

    public OutputManager(Path runOutputDir) {
        this.runOutputDir = runOutputDir;
    }

    public Path runOutputDir() {
        return runOutputDir;
    }

    // Write the records in the requested format(s) and return the files written.
    public List<Path> write(List<PageRecord> records, OutputFormat format) throws IOException {
        Files.createDirectories(runOutputDir);

        List<Path> written = new ArrayList<>();
        if (format.includesJson()) written.add(writeJson(records));
        if (format.includesCsv()) written.add(writeCsv(records));
        return written;
    }

    public Path writeJson(List<PageRecord> records) throws IOException {
        Files.createDirectories(runOutputDir);
        Path out = runOutputDir.resolve(JSON_FILE);
        PageRecordJson.writeAll(records, out);
        return out;
    }

    public Path writeCsv(List<PageRecord> records) throws IOException {
        Files.createDirectories(runOutputDir);
        Path out = runOutputDir.resolve(CSV_FILE);

        // One row per record, every field quoted
        List<String> lines = new ArrayList<>();
        lines.add(CSV_HEADER);
        for (PageRecord r : records) {
            lines.add(String.join(",",
                    csv(r.url()),
                    csv(r.depth()),
                    csv(r.status().label()),
                    csv(r.statusCode()),
                    csv(r.title()),
                    csv(r.metaDescription()),
                    csv(r.contentSnippet()),
                    csv(String.join(LINK_DELIMITER, r.discoveredLinks())),
                    csv(r.fetchedAt()),
                    csv(r.error())));
        }

        Files.write(out, lines, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return out;
    }

    // Quote CSV fields safely (minimal)
    private static String csv(Object v) {
        String s = v == null ? "" : String.valueOf(v);
        s = s.replace("\"", "\"\"");
        return "\"" + s + "\"";
    }
}
