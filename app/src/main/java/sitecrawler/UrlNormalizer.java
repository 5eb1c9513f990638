package sitecrawler;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Canonicalizes URLs so that the visited set compares equivalent addresses as equal.
 *
 * <p>Rules: resolve against the base, drop the fragment, lower-case scheme and host,
 * drop the default port, use {@code /} for an empty path, remove dot segments and drop
 * empty query parameters ({@code ?id=1&} becomes {@code ?id=1}). Parameter order, path
 * case and trailing slashes are kept as they are.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    public static String normalize(String url) throws UrlNormalizationException {
        return normalize(url, null);
    }

    // Resolve url against base (may be null) and canonicalize the result.
    public static String normalize(String url, String base) throws UrlNormalizationException {
        String href = cleanHref(url);
        if (href == null) {
            throw new UrlNormalizationException("Empty URL", String.valueOf(url));
        }

        try {
            URI reference = new URI(escapeUnsafe(href));
            if (base == null || reference.isAbsolute()) {
                return canonicalize(reference, href);
            }

            URI baseUri = URI.create(normalize(base, null));
            return canonicalize(resolve(baseUri, reference), href);
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new UrlNormalizationException("Malformed URL", href, e);
        }
    }

    // Only accept http/https links.
    public static boolean isHttpLike(String url) {
        String u = url.toLowerCase(Locale.ROOT);
        return u.startsWith("http://") || u.startsWith("https://");
    }

    // Lower-cased host of an absolute URL, or null when it has none.
    public static String hostOf(String url) {
        try {
            URI uri = new URI(url);
            String host = uri.getHost();
            if (host == null) host = uri.getAuthority();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    // scheme://host[:port] of an absolute URL, used as the robots.txt cache key.
    public static String originOf(String url) throws UrlNormalizationException {
        try {
            URI uri = new URI(url);
            if (uri.getScheme() == null || uri.getRawAuthority() == null) {
                throw new UrlNormalizationException("URL has no origin", url);
            }
            return uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getRawAuthority().toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            throw new UrlNormalizationException("Malformed URL", url, e);
        }
    }

    // Trim and sanitize raw href strings from HTML.
    static String cleanHref(String href) {
        if (href == null) return null;
        String s = href.trim();
        if (s.isEmpty()) return null;

        // Strip surrounding quotes if present
        if ((s.startsWith("\"") && s.endsWith("\"") && s.length() > 1)
                || (s.startsWith("'") && s.endsWith("'") && s.length() > 1)) {
            s = s.substring(1, s.length() - 1).trim();
        }

        // Drop trailing quote/angle bracket artifacts
        while (s.endsWith("\"") || s.endsWith("'") || s.endsWith(">")) {
            s = s.substring(0, s.length() - 1).trim();
        }

        return s.isEmpty() ? null : s;
    }

    // Percent-encode the characters java.net.URI rejects but browsers tolerate.
    private static String escapeUnsafe(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case ' ' -> sb.append("%20");
                case '"' -> sb.append("%22");
                case '<' -> sb.append("%3C");
                case '>' -> sb.append("%3E");
                case '\\' -> sb.append("%5C");
                case '^' -> sb.append("%5E");
                case '`' -> sb.append("%60");
                case '{' -> sb.append("%7B");
                case '|' -> sb.append("%7C");
                case '}' -> sb.append("%7D");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static URI resolve(URI base, URI reference) throws URISyntaxException {
        String raw = reference.toString();
        if (raw.isEmpty() || raw.startsWith("#")) {
            return base;
        }
        // URI.resolve follows RFC 2396 here and would drop the last path segment.
        if (raw.startsWith("?")) {
            return new URI(base.getScheme() + "://" + base.getRawAuthority() + base.getRawPath() + raw);
        }
        return base.resolve(reference);
    }

    private static String canonicalize(URI uri, String input) throws URISyntaxException, UrlNormalizationException {
        String scheme = uri.getScheme();
        if (scheme == null) {
            throw new UrlNormalizationException("Relative URL without base", input);
        }
        scheme = scheme.toLowerCase(Locale.ROOT);

        if (uri.isOpaque()) {
            return scheme + ":" + uri.getRawSchemeSpecificPart();
        }

        String host = uri.getHost();
        String authority = host != null ? host : uri.getRawAuthority();
        if (authority == null || authority.isEmpty()) {
            throw new UrlNormalizationException("URL has no host", input);
        }
        authority = authority.toLowerCase(Locale.ROOT);

        StringBuilder out = new StringBuilder();
        out.append(scheme).append("://");
        if (host != null) {
            if (uri.getRawUserInfo() != null) {
                out.append(uri.getRawUserInfo()).append('@');
            }
            out.append(authority);
            int port = uri.getPort();
            if (port != -1 && port != defaultPort(scheme)) {
                out.append(':').append(port);
            }
        } else {
            // registry-based authority (e.g. a host with an underscore)
            out.append(authority);
        }

        String path = uri.getRawPath();
        out.append(path == null || path.isEmpty() ? "/" : path);

        String query = canonicalQuery(uri.getRawQuery());
        if (query != null) {
            out.append('?').append(query);
        }

        URI rebuilt = new URI(out.toString()).normalize();
        String result = rebuilt.toString();
        // normalize() leaves "http://host" alone when the path collapses to nothing
        return rebuilt.getRawPath() == null || rebuilt.getRawPath().isEmpty()
                ? result + "/"
                : result;
    }

    private static String canonicalQuery(String rawQuery) {
        if (rawQuery == null) return null;
        StringJoiner joiner = new StringJoiner("&");
        for (String part : rawQuery.split("&")) {
            if (!part.isEmpty()) joiner.add(part);
        }
        String q = joiner.toString();
        return q.isEmpty() ? null : q;
    }

    private static int defaultPort(String scheme) {
        return switch (scheme) {
            case "http" -> 80;
            case "https" -> 443;
            default -> -1;
        };
    }
}
