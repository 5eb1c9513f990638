package sitecrawler;

import java.io.IOException;
import java.time.Duration;

// Performs a single HTTP GET. Redirects are followed; non-2xx statuses are returned, not thrown.
@FunctionalInterface
public interface HttpTransport {

    /**
     * @throws java.net.SocketTimeoutException when the request times out
     * @throws IOException on any other network failure
     */
    TransportResponse get(String url, String userAgent, Duration timeout) throws IOException;
}
