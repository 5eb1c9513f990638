package sitecrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;

/**
 * Fetches one URL politely: waits for the host's rate-limit slot before every attempt,
 * retries transient failures with exponential backoff and gives up on terminal ones.
 *
 * <p>Transient: socket timeout, other I/O errors, HTTP 5xx and 429. Terminal: other 4xx,
 * and URLs the transport rejects outright.
 */
public class PageFetcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(PageFetcher.class);

    private static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private enum AttemptState {
        ATTEMPTING,
        SUCCESS,
        RETRYABLE_FAILURE,
        TERMINAL_FAILURE
    }

    private final CrawlConfig config;
    private final HttpTransport transport;
    private final HostRateLimiter rateLimiter;
    private final CrawlCancellation cancellation;

    public PageFetcher(CrawlConfig config, HttpTransport transport, HostRateLimiter rateLimiter,
                       CrawlCancellation cancellation) {
        this.config = config;
        this.transport = transport;
        this.rateLimiter = rateLimiter;
        this.cancellation = cancellation;
    }

    public FetchedPage fetch(String url) throws FetchException {
        String host = UrlNormalizer.hostOf(url);
        int maxAttempts = 1 + config.maxRetries();

        AttemptState state = AttemptState.ATTEMPTING;
        int attempt = 0;
        FetchedPage page = null;
        FetchException failure = null;

        try {
            while (state != AttemptState.SUCCESS && state != AttemptState.TERMINAL_FAILURE) {
                switch (state) {
                    case ATTEMPTING -> {
                        attempt++;
                        if (!rateLimiter.acquire(host, cancellation)) {
                            failure = cancelled(url, attempt);
                            state = AttemptState.TERMINAL_FAILURE;
                            break;
                        }
                        LOGGER.debug("Fetching {} (attempt {}/{})", url, attempt, maxAttempts);
                        try {
                            TransportResponse response = transport.get(url, config.userAgent(), config.timeout());
                            int status = response.statusCode();
                            if (status >= 200 && status < 400) {
                                page = new FetchedPage(url, response.finalUrl() == null ? url : response.finalUrl(),
                                        status, response.body(), response.contentType(), response.charset(), attempt);
                                state = AttemptState.SUCCESS;
                            } else {
                                failure = new FetchException(FetchErrorKind.HTTP_STATUS, "HTTP " + status, status, attempt);
                                state = isRetryableStatus(status)
                                        ? AttemptState.RETRYABLE_FAILURE
                                        : AttemptState.TERMINAL_FAILURE;
                            }
                        } catch (SocketTimeoutException e) {
                            failure = new FetchException(FetchErrorKind.TIMEOUT, "Timed out: " + e.getMessage(), attempt, e);
                            state = AttemptState.RETRYABLE_FAILURE;
                        } catch (IOException e) {
                            failure = new FetchException(FetchErrorKind.NETWORK, e.toString(), attempt, e);
                            state = AttemptState.RETRYABLE_FAILURE;
                        } catch (IllegalArgumentException e) {
                            // the transport refused the URL itself; retrying cannot help
                            failure = new FetchException(FetchErrorKind.NETWORK, e.toString(), attempt, e);
                            state = AttemptState.TERMINAL_FAILURE;
                        }
                    }
                    case RETRYABLE_FAILURE -> {
                        if (attempt >= maxAttempts) {
                            state = AttemptState.TERMINAL_FAILURE;
                            break;
                        }
                        Duration wait = backoffFor(attempt);
                        LOGGER.debug("Retrying {} in {} ms after {}", url, wait.toMillis(), failure.getMessage());
                        if (cancellation.pause(wait)) {
                            state = AttemptState.ATTEMPTING;
                        } else {
                            failure = cancelled(url, attempt);
                            state = AttemptState.TERMINAL_FAILURE;
                        }
                    }
                    default -> throw new IllegalStateException("Unexpected fetch state " + state);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled(url, attempt);
        }

        if (state == AttemptState.SUCCESS) {
            return page;
        }
        throw failure;
    }

    // backoff * 2^(attempt-1), capped.
    Duration backoffFor(int attempt) {
        Duration base = config.backoff();
        if (base.isZero()) return Duration.ZERO;
        int shift = Math.min(Math.max(attempt - 1, 0), 20);
        Duration wait = base.multipliedBy(1L << shift);
        return wait.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : wait;
    }

    static boolean isRetryableStatus(int status) {
        return status >= 500 || status == 429;
    }

    private static FetchException cancelled(String url, int attempt) {
        return new FetchException(FetchErrorKind.CANCELLED, "Crawl stopped while fetching " + url, null, attempt);
    }
}
