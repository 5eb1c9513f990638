package sitecrawler;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

// Parsed command line. Parsing never exits the JVM; bad input raises ConfigException.
public record CliArguments(CrawlConfig config, boolean verbose, boolean help, boolean version) {

    public static final String USAGE = """
            Usage: site-crawler [options] <url>
              -d, --max-depth <n>       Maximum link depth (default: 2)
              -n, --max-pages <n>       Maximum pages to record (default: 100)
                  --delay <seconds>     Minimum delay between requests to a host (default: 1.0)
                  --timeout <seconds>   HTTP request timeout (default: 10)
                  --retries <n>         Retries per request on transient errors (default: 2)
                  --backoff <seconds>   Initial retry backoff, doubled per retry (default: 1.0)
                  --no-robots           Ignore robots.txt
                  --allow-external      Follow links to other hosts
                  --url-pattern <regex> URL must match at least one pattern (repeatable)
                  --user-agent <ua>     User-Agent header and robots.txt agent
                  --snippet-length <n>  Characters of page text to keep (default: 500)
                  --concurrency <n>     Parallel fetch workers (default: 1)
                  --max-duration <sec>  Stop the crawl after this many seconds (default: no limit)
              -f, --format <fmt>        json, csv or both (default: json)
              -o, --output-dir <dir>    Output directory (default: output)
              -v, --verbose             Debug logging
              -h, --help                Show this help
                  --version             Show the version
            Example: site-crawler -d 1 -n 20 https://example.com
            """;

    public static CliArguments parse(String[] args) {
        String seed = null;
        List<String> patterns = new ArrayList<>();
        boolean verbose = false;

        // Collected first because the builder needs the seed URL
        List<String[]> options = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-h", "--help" -> {
                    return new CliArguments(null, false, true, false);
                }
                case "--version" -> {
                    return new CliArguments(null, false, false, true);
                }
                case "-v", "--verbose" -> verbose = true;
                case "--no-robots", "--allow-external" -> options.add(new String[] {arg, null});
                case "-d", "--max-depth", "-n", "--max-pages", "--delay", "--timeout", "--retries", "--backoff",
                        "--url-pattern", "--user-agent", "--snippet-length", "--concurrency", "--max-duration",
                        "-f", "--format", "-o", "--output-dir" -> {
                    if (i + 1 >= args.length) {
                        throw new ConfigException("Missing value for " + arg);
                    }
                    options.add(new String[] {arg, args[++i]});
                }
                default -> {
                    if (arg.startsWith("-") && arg.length() > 1) {
                        throw new ConfigException("Unknown option: " + arg);
                    }
                    if (seed != null) {
                        throw new ConfigException("Unexpected argument: " + arg + " (seed URL already given)");
                    }
                    seed = arg;
                }
            }
        }

        if (seed == null) {
            throw new ConfigException("Seed URL is required");
        }
        CrawlConfig.Builder builder = CrawlConfig.builder(seed);

        for (String[] option : options) {
            String name = option[0];
            String value = option[1];
            switch (name) {
                case "-d", "--max-depth" -> builder.maxDepth(parseInt(value, name));
                case "-n", "--max-pages" -> builder.maxPages(parseInt(value, name));
                case "--delay" -> builder.delaySeconds(parseDouble(value, name));
                case "--timeout" -> builder.timeoutSeconds(parseDouble(value, name));
                case "--retries" -> builder.maxRetries(parseInt(value, name));
                case "--backoff" -> builder.backoffSeconds(parseDouble(value, name));
                case "--no-robots" -> builder.respectRobots(false);
                case "--allow-external" -> builder.allowExternal(true);
                case "--url-pattern" -> patterns.add(value);
                case "--user-agent" -> builder.userAgent(value);
                case "--snippet-length" -> builder.snippetLength(parseInt(value, name));
                case "--concurrency" -> builder.concurrency(parseInt(value, name));
                case "--max-duration" -> builder.maxDurationSeconds(parseDouble(value, name));
                case "-f", "--format" -> builder.outputFormat(OutputFormat.parse(value));
                case "-o", "--output-dir" -> builder.outputDir(parsePath(value, name));
                default -> throw new IllegalStateException("Unhandled option " + name);
            }
        }
        builder.urlPatterns(patterns);

        return new CliArguments(builder.build(), verbose, false, false);
    }

    // Strict integer parsing with a clean error message.
    private static int parseInt(String s, String name) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("Invalid integer for " + name + ": " + s);
        }
    }

    private static Path parsePath(String s, String name) {
        try {
            return Path.of(s);
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path for " + name + ": " + s);
        }
    }

    private static double parseDouble(String s, String name) {
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("Invalid number for " + name + ": " + s);
        }
    }
}
