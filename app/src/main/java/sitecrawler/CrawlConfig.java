package sitecrawler;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

// Parsed, validated parameters for a crawl run. Immutable; the engine never reads global state.
public record CrawlConfig(
        String seedUrl,
        int maxDepth,
        int maxPages,
        double delaySeconds,
        double timeoutSeconds,
        int maxRetries,
        double backoffSeconds,
        boolean respectRobots,
        boolean allowExternal,
        List<String> urlPatterns,
        String userAgent,
        int snippetLength,
        int concurrency,
        double maxDurationSeconds,
        OutputFormat outputFormat,
        Path outputDir
) {

    public static final String DEFAULT_USER_AGENT = "SiteCrawler/1.0 (+https://example.com/crawler)";

    // Upper bound for every seconds-valued setting (one week)
    public static final double MAX_SECONDS = 7 * 24 * 3600;

    public CrawlConfig {
        if (seedUrl == null || seedUrl.isBlank()) {
            throw new ConfigException("Seed URL is required");
        }
        String normalizedSeed;
        try {
            normalizedSeed = UrlNormalizer.normalize(seedUrl);
        } catch (UrlNormalizationException e) {
            throw new ConfigException("Invalid seed URL: " + seedUrl, e);
        }
        if (!UrlNormalizer.isHttpLike(normalizedSeed)) {
            throw new ConfigException("Seed URL must be http or https: " + seedUrl);
        }

        requireAtLeast(maxDepth, 0, "maxDepth");
        requireAtLeast(maxPages, 1, "maxPages");
        requireAtLeast(maxRetries, 0, "maxRetries");
        requireAtLeast(snippetLength, 0, "snippetLength");
        requireAtLeast(concurrency, 1, "concurrency");
        requireSeconds(delaySeconds, "delaySeconds");
        requireSeconds(backoffSeconds, "backoffSeconds");
        requireSeconds(maxDurationSeconds, "maxDurationSeconds");
        requireSeconds(timeoutSeconds, "timeoutSeconds");
        if (!(timeoutSeconds > 0)) {
            throw new ConfigException("timeoutSeconds must be > 0 (got " + timeoutSeconds + ")");
        }

        urlPatterns = urlPatterns == null ? List.of() : List.copyOf(urlPatterns);
        for (String p : urlPatterns) {
            try {
                Pattern.compile(p);
            } catch (PatternSyntaxException e) {
                throw new ConfigException("Invalid URL pattern: " + p + " (" + e.getDescription() + ")", e);
            }
        }

        if (userAgent == null || userAgent.isBlank()) userAgent = DEFAULT_USER_AGENT;
        if (outputFormat == null) outputFormat = OutputFormat.JSON;
        if (outputDir == null) outputDir = Path.of("output");
    }

    public static Builder builder(String seedUrl) {
        return new Builder(seedUrl);
    }

    // Canonical form of the seed; validated in the constructor so this cannot fail.
    public String normalizedSeedUrl() {
        try {
            return UrlNormalizer.normalize(seedUrl);
        } catch (UrlNormalizationException e) {
            throw new IllegalStateException(e);
        }
    }

    public List<Pattern> compiledPatterns() {
        List<Pattern> out = new ArrayList<>(urlPatterns.size());
        for (String p : urlPatterns) out.add(Pattern.compile(p));
        return out;
    }

    public Duration delay() {
        return seconds(delaySeconds);
    }

    public Duration timeout() {
        return seconds(timeoutSeconds);
    }

    public Duration backoff() {
        return seconds(backoffSeconds);
    }

    // Zero means no crawl-wide deadline.
    public Duration maxDuration() {
        return seconds(maxDurationSeconds);
    }

    public Builder toBuilder() {
        return new Builder(seedUrl)
                .maxDepth(maxDepth)
                .maxPages(maxPages)
                .delaySeconds(delaySeconds)
                .timeoutSeconds(timeoutSeconds)
                .maxRetries(maxRetries)
                .backoffSeconds(backoffSeconds)
                .respectRobots(respectRobots)
                .allowExternal(allowExternal)
                .urlPatterns(urlPatterns)
                .userAgent(userAgent)
                .snippetLength(snippetLength)
                .concurrency(concurrency)
                .maxDurationSeconds(maxDurationSeconds)
                .outputFormat(outputFormat)
                .outputDir(outputDir);
    }

    static Duration seconds(double value) {
        return Duration.ofNanos(Math.round(value * 1_000_000_000d));
    }

    private static void requireAtLeast(int value, int min, String name) {
        if (value < min) {
            throw new ConfigException(name + " must be >= " + min + " (got " + value + ")");
        }
    }

    private static void requireSeconds(double value, String name) {
        if (!(value >= 0 && value <= MAX_SECONDS)) {
            throw new ConfigException(name + " must be between 0 and " + (long) MAX_SECONDS + " (got " + value + ")");
        }
    }

    // Defaults mirror the CLI defaults.
    public static final class Builder {
        private final String seedUrl;
        private int maxDepth = 2;
        private int maxPages = 100;
        private double delaySeconds = 1.0;
        private double timeoutSeconds = 10;
        private int maxRetries = 2;
        private double backoffSeconds = 1.0;
        private boolean respectRobots = true;
        private boolean allowExternal = false;
        private List<String> urlPatterns = List.of();
        private String userAgent = DEFAULT_USER_AGENT;
        private int snippetLength = 500;
        private int concurrency = 1;
        private double maxDurationSeconds = 0;
        private OutputFormat outputFormat = OutputFormat.JSON;
        private Path outputDir = Path.of("output");

        private Builder(String seedUrl) {
            this.seedUrl = seedUrl;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxPages(int maxPages) {
            this.maxPages = maxPages;
            return this;
        }

        public Builder delaySeconds(double delaySeconds) {
            this.delaySeconds = delaySeconds;
            return this;
        }

        public Builder timeoutSeconds(double timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder backoffSeconds(double backoffSeconds) {
            this.backoffSeconds = backoffSeconds;
            return this;
        }

        public Builder respectRobots(boolean respectRobots) {
            this.respectRobots = respectRobots;
            return this;
        }

        public Builder allowExternal(boolean allowExternal) {
            this.allowExternal = allowExternal;
            return this;
        }

        public Builder urlPatterns(List<String> urlPatterns) {
            this.urlPatterns = urlPatterns;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder snippetLength(int snippetLength) {
            this.snippetLength = snippetLength;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder maxDurationSeconds(double maxDurationSeconds) {
            this.maxDurationSeconds = maxDurationSeconds;
            return this;
        }

        public Builder outputFormat(OutputFormat outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public CrawlConfig build() {
            return new CrawlConfig(seedUrl, maxDepth, maxPages, delaySeconds, timeoutSeconds, maxRetries,
                    backoffSeconds, respectRobots, allowExternal, urlPatterns, userAgent, snippetLength,
                    concurrency, maxDurationSeconds, outputFormat, outputDir);
        }
    }
}
