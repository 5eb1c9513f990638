package sitecrawler;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UrlFilterTest {

    private static CrawlConfig.Builder config() {
        return CrawlConfig.builder("http://a.test/");
    }

    @Test
    void rejectsOtherHostsUnlessExternalAllowed() {
        UrlFilter sameHost = UrlFilter.forSeed(config().build());
        assertTrue(sameHost.shouldVisit("http://a.test/x"));
        assertTrue(sameHost.shouldVisit("https://a.test/secure"));
        assertFalse(sameHost.shouldVisit("http://b.test/y"));
        assertFalse(sameHost.shouldVisit("http://sub.a.test/y"));

        UrlFilter external = UrlFilter.forSeed(config().allowExternal(true).build());
        assertTrue(external.shouldVisit("http://b.test/y"));
    }

    @Test
    void rejectsNonHttpSchemes() {
        UrlFilter filter = UrlFilter.forSeed(config().allowExternal(true).build());

        assertFalse(filter.shouldVisit("mailto:someone@a.test"));
        assertFalse(filter.shouldVisit("javascript:void(0)"));
        assertFalse(filter.shouldVisit("tel:+123456"));
        assertFalse(filter.shouldVisit("ftp://a.test/file"));
        assertFalse(filter.shouldVisit("not a url"));
        assertFalse(filter.shouldVisit(null));
    }

    @Test
    void patternsAreOrMatchedAndEmptySetAcceptsAll() {
        UrlFilter anyPattern = UrlFilter.forSeed(config().urlPatterns(List.of("/blog/", "\\.html$")).build());
        assertTrue(anyPattern.shouldVisit("http://a.test/blog/post"));
        assertTrue(anyPattern.shouldVisit("http://a.test/about.html"));
        assertFalse(anyPattern.shouldVisit("http://a.test/shop/item"));

        UrlFilter noPatterns = UrlFilter.forSeed(config().build());
        assertTrue(noPatterns.shouldVisit("http://a.test/shop/item"));
    }

    @Test
    void staticFormTakesSeedHostExplicitly() {
        CrawlConfig cfg = config().build();
        assertTrue(UrlFilter.shouldVisit("http://c.test/", cfg, "c.test"));
        assertFalse(UrlFilter.shouldVisit("http://a.test/", cfg, "c.test"));
    }
}
