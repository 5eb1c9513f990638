package sitecrawler;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

// CLI entry point that parses args, runs the crawl and writes the records.
public class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_SEED_UNREACHABLE = 2;

    // How long Ctrl+C waits for in-flight pages to finish and the output to be written
    private static final long SHUTDOWN_GRACE_SECONDS = 60;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    // Returns the process exit code instead of exiting, so it can be tested.
    static int run(String[] args) {
        CliArguments cli;
        try {
            cli = CliArguments.parse(args);
        } catch (ConfigException e) {
            System.err.println(e.getMessage());
            System.err.println(CliArguments.USAGE);
            return EXIT_ERROR;
        }

        if (cli.help()) {
            System.out.println(CliArguments.USAGE);
            return EXIT_OK;
        }
        if (cli.version()) {
            System.out.println("site-crawler " + version());
            return EXIT_OK;
        }

        // Must happen before the first logger is created
        if (cli.verbose()) {
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }

        CrawlConfig config = cli.config();

        // Each run gets its own folder so reruns never mix files. Example: 2025-12-25_15-30-12
        String runId = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss").format(LocalDateTime.now());
        OutputManager outputManager = new OutputManager(config.outputDir().resolve(runId));

        CrawlEngine engine = new CrawlEngine(config);

        // If user hits Ctrl+C, stop dispatching and keep the JVM alive until the records are written
        CountDownLatch outputDone = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(shutdownHook(engine, outputDone));

        try {
            CrawlResult result = engine.run();

            List<Path> written;
            try {
                written = outputManager.write(result.records(), config.outputFormat());
            } catch (IOException e) {
                System.err.println("Could not write output under " + outputManager.runOutputDir() + ": " + e.getMessage());
                return EXIT_ERROR;
            }

            printFinalSummary(result, written);

            if (result.seedFailed()) {
                System.err.println("Seed URL could not be fetched: " + result.seedUrl()
                        + " (" + result.records().get(0).error() + ")");
                return EXIT_SEED_UNREACHABLE;
            }
            return EXIT_OK;
        } finally {
            outputDone.countDown();
        }
    }

    static Thread shutdownHook(CrawlEngine engine, CountDownLatch outputDone) {
        return new Thread(() -> {
            engine.cancel();
            try {
                if (!outputDone.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    System.err.println("Gave up waiting for the crawl output to be written");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "crawl-shutdown");
    }

    // Print a minimal end-of-run summary.
    private static void printFinalSummary(CrawlResult result, List<Path> written) {
        System.out.println("==== Run summary ====");
        System.out.println("Seed     : " + result.seedUrl());
        System.out.println("Fetched OK: " + result.succeeded());
        System.out.println("Failed   : " + result.failed());
        System.out.println("Skipped  : " + result.skipped());
        if (result.cancelled()) {
            System.out.println("Stopped early (cancelled or time limit reached)");
        }
        for (Path p : written) {
            System.out.println("Wrote " + p);
        }
    }

    private static String version() {
        String v = Main.class.getPackage().getImplementationVersion();
        return v == null ? "dev" : v;
    }
}
