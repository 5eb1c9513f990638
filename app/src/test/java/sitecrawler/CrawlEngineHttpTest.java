package sitecrawler;

import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

// End-to-end crawl against a local HTTP server with the real jsoup transport and parser.
class CrawlEngineHttpTest {

    private MockWebServer server;
    private final Map<String, MockResponse> routes = new ConcurrentHashMap<>();
    private final Set<String> requested = ConcurrentHashMap.newKeySet();

    @BeforeEach
    void startServer() throws IOException {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                requested.add(request.getPath());
                MockResponse response = routes.get(request.getPath());
                return response != null ? response : new MockResponse().setResponseCode(404).setBody("missing");
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() throws IOException {
        server.shutdown();
    }

    private void html(String path, String body) {
        routes.put(path, new MockResponse()
                .setHeader("Content-Type", "text/html; charset=utf-8")
                .setBody(body));
    }

    private String base() {
        return server.url("/").toString();
    }

    @Test
    void crawlsSiteHonouringRobotsAndScope() {
        routes.put("/robots.txt", new MockResponse()
                .setHeader("Content-Type", "text/plain")
                .setBody("User-agent: *\nDisallow: /private/\n"));
        html("/", """
                <html><head><title>Home</title><meta name="description" content="Start here"></head>
                <body><p>Welcome home.</p>
                <a href="/about">About</a>
                <a href="/private/secret">Secret</a>
                <a href="http://elsewhere.invalid/page">Elsewhere</a>
                <a href="/about#team">About again</a>
                </body></html>
                """);
        html("/about", "<html><head><title>About</title></head><body><a href=\"/deep\">Deep</a></body></html>");
        html("/deep", "<html><head><title>Deep</title></head><body>too deep</body></html>");

        CrawlConfig config = CrawlConfig.builder(base()).maxDepth(1).delaySeconds(0).backoffSeconds(0).build();
        CrawlResult result = new CrawlEngine(config).run();

        List<PageRecord> records = result.records();
        assertEquals(3, records.size());

        PageRecord home = records.get(0);
        assertEquals(RecordStatus.SUCCESS, home.status());
        assertEquals(200, home.statusCode());
        assertEquals("Home", home.title());
        assertEquals("Start here", home.metaDescription());
        assertTrue(home.contentSnippet().startsWith("Welcome home."));
        assertEquals(List.of(base() + "about", base() + "private/secret"), home.discoveredLinks());

        assertEquals("About", records.get(1).title());
        assertEquals(RecordStatus.SKIPPED, records.get(2).status());
        assertEquals("robots", records.get(2).error());

        assertFalse(requested.contains("/private/secret"));
        assertFalse(requested.contains("/deep"));
        assertFalse(result.seedFailed());
    }

    @Test
    void serverErrorsAreRetriedUntilTheyClear() {
        server.setDispatcher(new Dispatcher() {
            private int calls;

            @Override
            public synchronized MockResponse dispatch(RecordedRequest request) {
                if ("/robots.txt".equals(request.getPath())) {
                    return new MockResponse().setResponseCode(404);
                }
                calls++;
                if (calls == 1) {
                    return new MockResponse().setResponseCode(503);
                }
                return new MockResponse()
                        .setHeader("Content-Type", "text/html")
                        .setBody("<title>Recovered</title>");
            }
        });

        CrawlConfig config = CrawlConfig.builder(base()).maxDepth(0).delaySeconds(0).backoffSeconds(0).build();
        CrawlResult result = new CrawlEngine(config).run();

        assertEquals(RecordStatus.SUCCESS, result.records().get(0).status());
        assertEquals("Recovered", result.records().get(0).title());
    }

    @Test
    void bodyThatStallsIsRetriedAndReportedAsTimeout() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return new MockResponse()
                        .setHeader("Content-Type", "text/html")
                        .setBody("<p>" + "x".repeat(2000) + "</p>")
                        .throttleBody(100, 1, TimeUnit.SECONDS);
            }
        });

        CrawlConfig config = CrawlConfig.builder(base()).maxDepth(0).respectRobots(false)
                .timeoutSeconds(1).maxRetries(2).delaySeconds(0).backoffSeconds(0).build();
        CrawlResult result = new CrawlEngine(config).run();

        PageRecord seed = result.records().get(0);
        assertEquals(RecordStatus.FAILED, seed.status());
        assertEquals("timeout", seed.error());
        assertEquals(3, server.getRequestCount());
    }

    @Test
    void missingSeedIsAFailedRecord() {
        CrawlConfig config = CrawlConfig.builder(base() + "nothing-here").delaySeconds(0).backoffSeconds(0).build();

        CrawlResult result = new CrawlEngine(config).run();

        assertEquals(1, result.records().size());
        assertEquals("http_status", result.records().get(0).error());
        assertEquals(404, result.records().get(0).statusCode());
        assertTrue(result.seedFailed());
    }
}
