package sitecrawler;

import crawlercommons.robots.BaseRobotRules;
import crawlercommons.robots.SimpleRobotRules;
import crawlercommons.robots.SimpleRobotRulesParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Answers allow/deny for a URL from its origin's robots.txt.
 *
 * <p>Each origin's file is fetched once and cached for the run. Parsing and matching are done by
 * crawler-commons: the group naming our product token beats {@code *}, the longest matching rule
 * wins, ties go to Allow, and {@code *} / {@code $} patterns are supported.
 */
public class RobotsChecker {

    private static final Logger LOGGER = LoggerFactory.getLogger(RobotsChecker.class);

    private static final Duration MAX_ROBOTS_TIMEOUT = Duration.ofSeconds(5);

    private static final BaseRobotRules ALLOW_ALL = new SimpleRobotRules(SimpleRobotRules.RobotRulesMode.ALLOW_ALL);

    private final CrawlConfig config;
    private final HttpTransport transport;
    private final HostRateLimiter rateLimiter;
    private final SimpleRobotRulesParser parser = new SimpleRobotRulesParser();

    // Keyed by origin and agent token; the first caller loads the entry, later callers wait on its future.
    private final Map<String, CompletableFuture<BaseRobotRules>> cache = new ConcurrentHashMap<>();

    public RobotsChecker(CrawlConfig config, HttpTransport transport, HostRateLimiter rateLimiter) {
        this.config = config;
        this.transport = transport;
        this.rateLimiter = rateLimiter;
    }

    public boolean isAllowed(String url) {
        return isAllowed(url, config.userAgent());
    }

    public boolean isAllowed(String url, String userAgent) {
        if (!config.respectRobots()) return true;

        String origin;
        try {
            origin = UrlNormalizer.originOf(url);
        } catch (UrlNormalizationException e) {
            LOGGER.debug("Cannot evaluate robots.txt for {}: {}", url, e.getMessage());
            return true;
        }

        return rulesFor(origin, userAgent).isAllowed(url);
    }

    // Number of robots.txt lookups cached (one per origin for a single user agent).
    public int cachedOrigins() {
        return cache.size();
    }

    private BaseRobotRules rulesFor(String origin, String userAgent) {
        String key = origin + " " + productToken(userAgent);
        CompletableFuture<BaseRobotRules> pending = cache.get(key);
        if (pending == null) {
            CompletableFuture<BaseRobotRules> mine = new CompletableFuture<>();
            pending = cache.putIfAbsent(key, mine);
            if (pending == null) {
                pending = mine;
                mine.complete(load(origin, userAgent));
            }
        }
        return pending.join();
    }

    // Single attempt, short timeout. Anything but a 2xx answer means "allow all".
    private BaseRobotRules load(String origin, String userAgent) {
        String robotsUrl = origin + "/robots.txt";
        BaseRobotRules rules;
        try {
            TransportResponse response = transport.get(robotsUrl, config.userAgent(), robotsTimeout());
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                rules = parse(robotsUrl, response.body(), response.contentType(), userAgent);
                LOGGER.debug("Loaded robots.txt from {}", robotsUrl);
            } else {
                LOGGER.debug("No robots.txt at {} (HTTP {}), allowing all", robotsUrl, status);
                rules = ALLOW_ALL;
            }
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Could not fetch {} ({}), allowing all", robotsUrl, e.toString());
            rules = ALLOW_ALL;
        }

        applyCrawlDelay(origin, rules);
        return rules;
    }

    BaseRobotRules parse(String robotsUrl, byte[] content, String contentType, String userAgent) {
        return parser.parseContent(robotsUrl, content == null ? new byte[0] : content,
                contentType == null ? "text/plain" : contentType, List.of(productToken(userAgent)));
    }

    private void applyCrawlDelay(String origin, BaseRobotRules rules) {
        long delayMillis = rules.getCrawlDelay();
        if (delayMillis <= 0) return;

        Duration delay = Duration.ofMillis(delayMillis);
        String host = UrlNormalizer.hostOf(origin);
        if (delay.compareTo(config.delay()) > 0) {
            LOGGER.info("Using robots.txt Crawl-delay of {} ms for {}", delay.toMillis(), host);
        }
        rateLimiter.raiseInterval(host, delay);
    }

    private Duration robotsTimeout() {
        Duration configured = config.timeout();
        return configured.compareTo(MAX_ROBOTS_TIMEOUT) < 0 ? configured : MAX_ROBOTS_TIMEOUT;
    }

    // "SiteCrawler/1.0 (+https://...)" -> "sitecrawler"
    static String productToken(String userAgent) {
        if (userAgent == null) return "";
        String ua = userAgent.trim().toLowerCase(Locale.ROOT);
        int end = ua.length();
        for (int i = 0; i < ua.length(); i++) {
            char c = ua.charAt(i);
            if (c == '/' || c == ' ' || c == '(') {
                end = i;
                break;
            }
        }
        return ua.substring(0, end);
    }
}
