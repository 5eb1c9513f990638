package sitecrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Breadth-first crawl of one seed.
 *
 * <p>The coordinating thread (the caller of {@link #run()}) alone owns the frontier. It pops
 * tasks in FIFO order, claims each URL in the visited set before dispatching it, and
 * appends the children of a finished page to the back of the frontier, which keeps the
 * traversal in level order. Tasks run on a fixed pool of {@code concurrency} workers; with
 * the default of one worker the crawl is strictly sequential.
 *
 * <p>Every emitted record, whatever its status, counts against {@code maxPages}. Slots are
 * reserved for in-flight tasks so the limit is never overshot.
 */
public class CrawlEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(CrawlEngine.class);

    private final CrawlConfig config;
    private final RecordSink sink;
    private final Clock clock;

    private final CrawlCancellation cancellation = new CrawlCancellation();
    private final RobotsChecker robotsChecker;
    private final PageFetcher fetcher;
    private final ContentExtractor extractor;
    private final UrlFilter filter;

    // Frontier and visited set for this run only
    private final Deque<CrawlTask> frontier = new ArrayDeque<>();
    private final Set<String> visited = ConcurrentHashMap.newKeySet();

    private final AtomicBoolean started = new AtomicBoolean(false);

    // What a worker hands back; record is null when the crawl was stopped mid-fetch.
    private record TaskOutcome(CrawlTask task, PageRecord record, List<String> children) {

        static TaskOutcome recorded(CrawlTask task, PageRecord record) {
            return new TaskOutcome(task, record, List.of());
        }

        static TaskOutcome abandoned(CrawlTask task) {
            return new TaskOutcome(task, null, List.of());
        }
    }

    public CrawlEngine(CrawlConfig config) {
        this(config, RecordSink.NONE);
    }

    public CrawlEngine(CrawlConfig config, RecordSink sink) {
        this(config, new JsoupTransport(), new JsoupHtmlParser(), sink, Clock.systemUTC());
    }

    // Wire the per-run collaborators. Nothing here is shared with other runs.
    public CrawlEngine(CrawlConfig config, HttpTransport transport, HtmlParser parser, RecordSink sink, Clock clock) {
        this.config = config;
        this.sink = sink == null ? RecordSink.NONE : sink;
        this.clock = clock;

        HostRateLimiter rateLimiter = new HostRateLimiter(config.delay());
        this.robotsChecker = new RobotsChecker(config, transport, rateLimiter);
        this.fetcher = new PageFetcher(config, transport, rateLimiter, cancellation);
        this.extractor = new ContentExtractor(parser, config.snippetLength());
        this.filter = UrlFilter.forSeed(config);
    }

    // Stop dispatching and abort waiting fetches. Safe to call from any thread, e.g. a shutdown hook.
    public void cancel() {
        cancellation.cancel();
    }

    public CrawlResult run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("A CrawlEngine can only run once");
        }
        cancellation.armDeadline(config.maxDuration());

        String seed = config.normalizedSeedUrl();
        frontier.addLast(new CrawlTask(seed, 0));
        LOGGER.info("Starting crawl of {} (max depth {}, max pages {})", seed, config.maxDepth(), config.maxPages());

        List<PageRecord> records = new ArrayList<>();
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        int duplicates = 0;
        boolean stopped = false;

        ExecutorService pool = Executors.newFixedThreadPool(config.concurrency(), workerThreadFactory());
        // Completion service lets us process tasks as they finish
        ExecutorCompletionService<TaskOutcome> completion = new ExecutorCompletionService<>(pool);
        int inFlight = 0;

        try {
            while (true) {
                if (!stopped && cancellation.isCancelled()) {
                    stopped = true;
                    LOGGER.info("Crawl stopped with {} task(s) in flight and {} queued", inFlight, frontier.size());
                }

                while (!stopped
                        && inFlight < config.concurrency()
                        && !frontier.isEmpty()
                        && records.size() + inFlight < config.maxPages()) {
                    CrawlTask task = frontier.pollFirst();

                    if (!visited.add(task.url())) {
                        duplicates++;
                        continue;
                    }
                    if (task.depth() > config.maxDepth()) {
                        LOGGER.debug("Skipping {}: depth {} exceeds {}", task.url(), task.depth(), config.maxDepth());
                        continue;
                    }

                    completion.submit(() -> process(task));
                    inFlight++;
                }

                if (inFlight == 0) break;

                Future<TaskOutcome> future = completion.take();
                inFlight--;

                TaskOutcome outcome;
                try {
                    outcome = future.get();
                } catch (ExecutionException e) {
                    // process() turns every failure into a record; this only guards against Errors
                    LOGGER.error("Crawl task crashed", e.getCause());
                    continue;
                }

                PageRecord record = outcome.record();
                if (record == null) continue;

                records.add(record);
                sink.accept(record);

                switch (record.status()) {
                    case SUCCESS -> succeeded++;
                    case FAILED -> failed++;
                    case SKIPPED -> skipped++;
                    default -> throw new IllegalStateException("Unknown status " + record.status());
                }
                if (record.status() == RecordStatus.SUCCESS) {
                    LOGGER.info("[{}/{}] depth={} {} - {}", records.size(), config.maxPages(), record.depth(),
                            record.url(), record.title().isEmpty() ? "(no title)" : record.title());
                }

                if (!stopped) enqueueChildren(outcome);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel();
            stopped = true;
            LOGGER.warn("Crawl interrupted");
        } finally {
            pool.shutdownNow();
        }

        LOGGER.info("Crawl finished: {} ok, {} failed, {} skipped", succeeded, failed, skipped);
        return new CrawlResult(seed, records, succeeded, failed, skipped, duplicates, stopped);
    }

    // Children go to the back of the frontier, after everything already queued.
    private void enqueueChildren(TaskOutcome outcome) {
        int childDepth = outcome.task().depth() + 1;
        if (childDepth > config.maxDepth()) return;

        for (String child : outcome.children()) {
            if (!visited.contains(child)) {
                frontier.addLast(outcome.task().child(child));
            }
        }
    }

    // Robots, fetch, extract, filter. Runs on a worker; never throws.
    private TaskOutcome process(CrawlTask task) {
        try {
            if (!robotsChecker.isAllowed(task.url(), config.userAgent())) {
                LOGGER.info("Blocked by robots.txt: {}", task.url());
                return TaskOutcome.recorded(task, PageRecord.skipped(task, PageRecord.REASON_ROBOTS, now()));
            }

            FetchedPage page;
            try {
                page = fetcher.fetch(task.url());
            } catch (FetchException e) {
                if (e.kind() == FetchErrorKind.CANCELLED) {
                    return TaskOutcome.abandoned(task);
                }
                LOGGER.warn("Failed: {} ({} after {} attempt(s): {})", task.url(), e.kind().label(), e.attempts(),
                        e.detail());
                return TaskOutcome.recorded(task, PageRecord.failed(task, e, now()));
            }

            Extraction extraction = extractor.extract(page);
            List<String> survivors = new ArrayList<>();
            for (String link : extraction.links()) {
                if (filter.shouldVisit(link)) survivors.add(link);
            }

            PageRecord record = PageRecord.success(task, page, extraction, survivors, now());
            return new TaskOutcome(task, record, survivors);
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected error while processing {}", task.url(), e);
            return TaskOutcome.recorded(task, PageRecord.failed(task, PageRecord.REASON_INTERNAL, now()));
        }
    }

    private Instant now() {
        return clock.instant();
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "crawl-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
