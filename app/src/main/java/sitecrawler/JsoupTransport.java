package sitecrawler;

import org.jsoup.Connection;
import org.jsoup.Jsoup;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;

// HttpTransport over jsoup's connection API.
public class JsoupTransport implements HttpTransport {

    // 0 = unlimited in jsoup; cap pages so one huge download cannot exhaust memory.
    private static final int MAX_BODY_BYTES = 5 * 1024 * 1024;

    @Override
    public TransportResponse get(String url, String userAgent, Duration timeout) throws IOException {
        Connection.Response response = Jsoup.connect(url)
                .userAgent(userAgent)
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9")
                .timeout((int) Math.min(Integer.MAX_VALUE, timeout.toMillis()))
                .followRedirects(true)
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                .maxBodySize(MAX_BODY_BYTES)
                .method(Connection.Method.GET)
                .execute();

        // jsoup reads the body lazily and wraps read failures (timeouts included) as unchecked
        byte[] body;
        try {
            body = response.bodyAsBytes();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        return new TransportResponse(
                response.statusCode(),
                body,
                response.contentType(),
                response.charset(),
                response.url().toString());
    }
}
