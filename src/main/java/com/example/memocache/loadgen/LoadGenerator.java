package com.example.memocache.loadgen;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a running cache service over HTTP.
 * <p>
 * Usage: {@code LoadGenerator <scenario> [durationSeconds] [threads] [universe] [alpha] [scanRatio]}
 * <ul>
 *   <li>{@code A}: Zipfian workload over a key universe, optionally mixed with scan keys</li>
 *   <li>{@code B}: thundering herd, every thread requests the same key</li>
 * </ul>
 */
public class LoadGenerator {

    private static final Logger log = LoggerFactory.getLogger(LoadGenerator.class);

    private static final HttpClient client = HttpClient.newHttpClient();
    private static final String BASE_URL = System.getProperty("loadgen.baseUrl", "http://localhost:8080");

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.out.println("Usage: java LoadGenerator <scenario> [durationSeconds] [threads] [universe] [alpha] [scanRatio]");
            return;
        }

        String scenario = args[0];
        int duration = args.length > 1 ? Integer.parseInt(args[1]) : 60;

        System.out.println("Starting Scenario: " + scenario + " Duration: " + duration + "s");

        switch (scenario) {
            case "A":
                int threads = args.length > 2 ? Integer.parseInt(args[2]) : 50;
                int universe = args.length > 3 ? Integer.parseInt(args[3]) : 1_000_000;
                double alpha = args.length > 4 ? Double.parseDouble(args[4]) : 0.9;
                double scanRatio = args.length > 5 ? Double.parseDouble(args[5]) : 0.0;
                runZipfian(duration, threads, universe, alpha, scanRatio);
                break;
            case "B":
                int herd = args.length > 2 ? Integer.parseInt(args[2]) : 100;
                runThunderingHerd(duration, herd);
                break;
            default:
                System.out.println("Unknown scenario: " + scenario);
        }
    }

    // Scenario A: Zipfian workload with optional scan traffic
    private static void runZipfian(int durationSeconds, int threads, int universeSize, double alpha, double scanRatio)
        throws InterruptedException {
        System.out.println(String.format(
            "Initializing Zipfian Scenario A (Universe=%d, Threads=%d, Alpha=%.2f, ScanRatio=%.2f)...",
            universeSize, threads, alpha, scanRatio));

        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();
        AtomicLong scanIndex = ZipfKeySampler.scanCounter(universeSize);
        AtomicLong requestCount = runWorkers(durationSeconds, threads, latencies,
            worker -> new ZipfKeySampler(universeSize, alpha, scanRatio, worker, scanIndex)::next);

        System.out.println("Scenario A finished. Total Requests: " + requestCount.get());
        System.out.println(summarize(latencies));
    }

    // Scenario B: many threads hammering one key; with single-flight the backend sees one
    // request per TTL period.
    private static void runThunderingHerd(int durationSeconds, int threads) throws InterruptedException {
        System.out.println(String.format("Initializing Scenario B (Threads=%d, Duration=%ds)...", threads, durationSeconds));

        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();
        AtomicLong requestCount = runWorkers(durationSeconds, threads, latencies, worker -> () -> "hot-key-stampede");

        System.out.println("Scenario B finished. Requests: " + requestCount.get());
        System.out.println(summarize(latencies));
    }

    private interface KeySource {
        String next();
    }

    private interface KeySourceFactory {
        KeySource forWorker(int worker);
    }

    private static AtomicLong runWorkers(
        int durationSeconds,
        int threads,
        ConcurrentLinkedQueue<Double> latencies,
        KeySourceFactory keys
    ) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        AtomicLong requestCount = new AtomicLong();
        long endTime = System.currentTimeMillis() + durationSeconds * 1000L;

        for (int i = 0; i < threads; i++) {
            KeySource source = keys.forWorker(i);
            executor.submit(() -> {
                while (System.currentTimeMillis() < endTime) {
                    try {
                        long start = System.nanoTime();
                        sendGet(source.next());
                        latencies.add((System.nanoTime() - start) / 1_000_000.0);
                        requestCount.incrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    } catch (Exception e) {
                        log.warn("[LoadGenerator] Request failed: {}", e.toString());
                    }
                }
            });
        }

        executor.shutdown();
        executor.awaitTermination(durationSeconds + 10L, TimeUnit.SECONDS);
        return requestCount;
    }

    static String summarize(Iterable<Double> latenciesMillis) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        latenciesMillis.forEach(stats::addValue);
        if (stats.getN() == 0) {
            return "Stats: no successful requests";
        }
        return String.format(Locale.ROOT, "Stats: N=%d, Avg=%.2fms, P95=%.2fms, P99=%.2fms, Max=%.2fms",
            stats.getN(), stats.getMean(), stats.getPercentile(95), stats.getPercentile(99), stats.getMax());
    }

    private static void sendGet(String key) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(BASE_URL + "/item?key=" + URLEncoder.encode(key, StandardCharsets.UTF_8)))
            .GET()
            .build();
        client.send(request, HttpResponse.BodyHandlers.discarding());
    }
}
