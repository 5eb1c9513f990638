package sitecrawler;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

// Decides whether a normalized URL may enter the frontier. Stateless after construction, safe to share.
public class UrlFilter {

    private final String seedHost;
    private final boolean allowExternal;
    private final List<Pattern> patterns;

    public UrlFilter(CrawlConfig config, String seedHost) {
        this.seedHost = seedHost == null ? null : seedHost.toLowerCase(Locale.ROOT);
        this.allowExternal = config.allowExternal();
        this.patterns = config.compiledPatterns();
    }

    public static UrlFilter forSeed(CrawlConfig config) {
        return new UrlFilter(config, UrlNormalizer.hostOf(config.normalizedSeedUrl()));
    }

    public static boolean shouldVisit(String url, CrawlConfig config, String seedHost) {
        return new UrlFilter(config, seedHost).shouldVisit(url);
    }

    public boolean shouldVisit(String url) {
        if (url == null) return false;

        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            return false;
        }

        // mailto:, javascript:, tel:, ftp: ...
        String scheme = uri.getScheme();
        if (scheme == null) return false;
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return false;

        if (!allowExternal) {
            String host = UrlNormalizer.hostOf(url);
            if (host == null || !host.equals(seedHost)) return false;
        }

        if (patterns.isEmpty()) return true;
        for (Pattern p : patterns) {
            if (p.matcher(url).find()) return true;
        }
        return false;
    }
}
