package sitecrawler;

// A frontier entry: a normalized URL and its link distance from the seed.
public record CrawlTask(String url, int depth) {

    public CrawlTask {
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
    }

    public CrawlTask child(String childUrl) {
        return new CrawlTask(childUrl, depth + 1);
    }
}
