package sitecrawler;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UrlNormalizerTest {

    @Test
    void lowercasesSchemeAndHostAndDropsDefaultPortAndFragment() throws Exception {
        assertEquals("http://example.com/Path/Page?b=2&a=1",
                UrlNormalizer.normalize("HTTP://Example.COM:80/Path/Page?b=2&a=1#section"));
        assertEquals("https://example.com/",
                UrlNormalizer.normalize("https://EXAMPLE.com:443"));
    }

    @Test
    void keepsNonDefaultPort() throws Exception {
        assertEquals("http://example.com:8080/x", UrlNormalizer.normalize("http://example.com:8080/x"));
        assertEquals("https://example.com:80/", UrlNormalizer.normalize("https://example.com:80"));
    }

    @Test
    void resolvesRelativeReferencesAgainstBase() throws Exception {
        String base = "http://a.test/dir/page.html";

        assertEquals("http://a.test/x", UrlNormalizer.normalize("/x", base));
        assertEquals("http://a.test/dir/other", UrlNormalizer.normalize("other", base));
        assertEquals("http://a.test/up", UrlNormalizer.normalize("../up", base));
        assertEquals("http://cdn.test/lib.js", UrlNormalizer.normalize("//cdn.test/lib.js", base));
        assertEquals("http://a.test/dir/page.html?q=1", UrlNormalizer.normalize("?q=1", base));
        assertEquals("http://a.test/dir/page.html", UrlNormalizer.normalize("#top", base));
    }

    @Test
    void resolvesAgainstBaseWithoutPath() throws Exception {
        assertEquals("http://a.test/x", UrlNormalizer.normalize("x", "http://a.test"));
    }

    @Test
    void dropsEmptyQueryParameters() throws Exception {
        assertEquals("http://a.test/page?id=1", UrlNormalizer.normalize("http://a.test/page?id=1&"));
        assertEquals("http://a.test/page?id=1", UrlNormalizer.normalize("http://a.test/page?id=1"));
        assertEquals("http://a.test/page?a=1&b=2", UrlNormalizer.normalize("http://a.test/page?&a=1&&b=2"));
        assertEquals("http://a.test/page", UrlNormalizer.normalize("http://a.test/page?"));
    }

    @Test
    void keepsTrailingSlashDistinction() throws Exception {
        assertEquals("http://a.test/docs/", UrlNormalizer.normalize("http://a.test/docs/"));
        assertEquals("http://a.test/docs", UrlNormalizer.normalize("http://a.test/docs"));
    }

    @Test
    void removesDotSegments() throws Exception {
        assertEquals("http://a.test/b/d", UrlNormalizer.normalize("http://a.test/b/./c/../d"));
    }

    @Test
    void encodesSpacesInsteadOfFailing() throws Exception {
        assertEquals("http://a.test/my%20page", UrlNormalizer.normalize("/my page", "http://a.test/"));
    }

    @Test
    void normalizingIsIdempotent() throws Exception {
        List<String> inputs = List.of(
                "HTTP://Example.COM:80/a/../b/?x=1&&y=2#f",
                "https://a.test",
                "http://a.test/my page?q= 1",
                "http://user@a.test:8080/p",
                "http://a.test/../x",
                "mailto:Someone@Example.com");

        for (String input : inputs) {
            String once = UrlNormalizer.normalize(input);
            assertEquals(once, UrlNormalizer.normalize(once), "not idempotent for " + input);
        }
    }

    @Test
    void opaqueSchemesAreKeptSoTheFilterCanRejectThem() throws Exception {
        assertEquals("mailto:someone@example.com", UrlNormalizer.normalize("MAILTO:someone@example.com"));
        assertEquals("javascript:void(0)", UrlNormalizer.normalize("javascript:void(0)", "http://a.test/"));
    }

    @Test
    void rejectsEmptyRelativeAndMalformedInput() {
        assertThrows(UrlNormalizationException.class, () -> UrlNormalizer.normalize("   "));
        assertThrows(UrlNormalizationException.class, () -> UrlNormalizer.normalize("/relative/only"));
        assertThrows(UrlNormalizationException.class, () -> UrlNormalizer.normalize("http://a.test/%zz"));
        assertThrows(UrlNormalizationException.class, () -> UrlNormalizer.normalize("http:///nohost"));
    }

    @Test
    void extractsHostAndOrigin() throws Exception {
        assertEquals("a.test", UrlNormalizer.hostOf("http://A.test:8080/x"));
        assertEquals("http://a.test:8080", UrlNormalizer.originOf("http://A.test:8080/x?y"));
        assertNull(UrlNormalizer.hostOf("mailto:x@y.z"));
    }

    @Test
    void recognisesHttpLikeUrls() {
        assertTrue(UrlNormalizer.isHttpLike("HTTPS://a.test/"));
        assertFalse(UrlNormalizer.isHttpLike("ftp://a.test/"));
    }
}
