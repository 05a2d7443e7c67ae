package com.medusa.benchmark;

import com.medusa.MedusaClient;
import com.medusa.client.ClientConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Load generator for benchmarking a Medusa server.
 * Each worker holds its own connection and issues a mix of SET and GET requests.
 * A run with one thread is the sequential benchmark.
 */
public class LoadGenerator {

    private static final Logger logger = LoggerFactory.getLogger(LoadGenerator.class);

    private static final int KEY_SPACE = 1000;
    private static final String VALUE_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final ClientConfig clientConfig;
    private final int numThreads;
    private final int opsPerThread;
    private final double readRatio;
    private final int valueSize;

    private final LongAdder totalOps = new LongAdder();
    private final LongAdder readOps = new LongAdder();
    private final LongAdder writeOps = new LongAdder();
    private final LongAdder totalLatencyNanos = new LongAdder();
    private final LongAdder errors = new LongAdder();

    /**
     * Create a load generator.
     *
     * @param clientConfig server address and client timeouts
     * @param threads      number of concurrent connections
     * @param opsPerThread requests sent on each connection
     * @param readRatio    share of GET requests, 0.0 for a pure SET load
     * @param valueSize    length of the values written
     */
    public LoadGenerator(ClientConfig clientConfig, int threads, int opsPerThread, double readRatio, int valueSize) {
        if (threads <= 0 || opsPerThread <= 0 || valueSize <= 0) {
            throw new IllegalArgumentException("threads, ops and value size must be positive");
        }
        if (readRatio < 0.0 || readRatio > 1.0) {
            throw new IllegalArgumentException("readRatio must be between 0.0 and 1.0, got: " + readRatio);
        }
        this.clientConfig = clientConfig;
        this.numThreads = threads;
        this.opsPerThread = opsPerThread;
        this.readRatio = readRatio;
        this.valueSize = valueSize;
    }

    /**
     * Run the benchmark.
     *
     * @return benchmark results
     * @throws IOException          if the keys for the read share cannot be preloaded
     * @throws InterruptedException if interrupted while waiting for the workers
     */
    public BenchmarkResult run() throws IOException, InterruptedException {
        if (readRatio > 0.0) {
            preload();
        }

        totalOps.reset();
        readOps.reset();
        writeOps.reset();
        totalLatencyNanos.reset();
        errors.reset();

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(numThreads);

        for (int t = 0; t < numThreads; t++) {
            final int threadId = t;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    runWorker(threadId);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (IOException e) {
                    logger.warn("Worker {} could not connect: {}", threadId, e.getMessage());
                    errors.add(opsPerThread);
                } finally {
                    endLatch.countDown();
                }
            });
        }

        long startTime = System.nanoTime();
        startLatch.countDown();
        try {
            endLatch.await();
        } finally {
            executor.shutdown();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
        long endTime = System.nanoTime();

        return new BenchmarkResult(
            totalOps.sum(),
            readOps.sum(),
            writeOps.sum(),
            errors.sum(),
            endTime - startTime,
            totalLatencyNanos.sum()
        );
    }

    private void preload() throws IOException {
        try (MedusaClient client = new MedusaClient(clientConfig)) {
            for (int t = 0; t < numThreads; t++) {
                for (int i = 0; i < Math.min(opsPerThread, KEY_SPACE); i++) {
                    client.set(key(t, i), generateValue());
                }
            }
        }
    }

    private void runWorker(int threadId) throws IOException {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        try (MedusaClient client = new MedusaClient(clientConfig)) {
            for (int i = 0; i < opsPerThread; i++) {
                String key = key(threadId, i % KEY_SPACE);
                boolean read = random.nextDouble() < readRatio;
                String value = read ? null : generateValue();

                long opStart = System.nanoTime();
                try {
                    if (read) {
                        client.get(key);
                        readOps.increment();
                    } else {
                        client.set(key, value);
                        writeOps.increment();
                    }
                    totalLatencyNanos.add(System.nanoTime() - opStart);
                    totalOps.increment();
                } catch (IOException e) {
                    logger.debug("Request for {} failed: {}", key, e.getMessage());
                    errors.increment();
                }
            }
        }
    }

    private static String key(int threadId, int index) {
        return "bench:" + threadId + ":" + index;
    }

    private String generateValue() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(valueSize);
        for (int i = 0; i < valueSize; i++) {
            sb.append(VALUE_ALPHABET.charAt(random.nextInt(VALUE_ALPHABET.length())));
        }
        return sb.toString();
    }

    /**
     * Counts and timings of one benchmark run.
     */
    public static class BenchmarkResult {
        public final long totalOps;
        public final long readOps;
        public final long writeOps;
        public final long errors;
        public final long durationNanos;
        public final long totalLatencyNanos;

        public BenchmarkResult(long totalOps, long readOps, long writeOps,
                               long errors, long durationNanos, long totalLatencyNanos) {
            this.totalOps = totalOps;
            this.readOps = readOps;
            this.writeOps = writeOps;
            this.errors = errors;
            this.durationNanos = durationNanos;
            this.totalLatencyNanos = totalLatencyNanos;
        }

        public double getOpsPerSecond() {
            return durationNanos > 0 ? totalOps / getDurationSeconds() : 0;
        }

        public double getAvgLatencyMs() {
            return totalOps > 0 ? (totalLatencyNanos / (double) totalOps) / 1_000_000.0 : 0;
        }

        public double getDurationSeconds() {
            return durationNanos / 1_000_000_000.0;
        }

        /**
         * Render the result as a short report.
         */
        public String format(String title) {
            return String.format(Locale.ROOT,
                    "%s%n" +
                    "  Operations:  %,d (%,d SET, %,d GET)%n" +
                    "  Errors:      %,d%n" +
                    "  Duration:    %.2f s%n" +
                    "  Throughput:  %,.0f ops/sec%n" +
                    "  Avg latency: %.3f ms%n",
                    title, totalOps, writeOps, readOps, errors,
                    getDurationSeconds(), getOpsPerSecond(), getAvgLatencyMs());
        }
    }

    /**
     * Runs a sequential benchmark on one connection, then a concurrent one.
     */
    public static void main(String[] args) throws Exception {
        ClientConfig.Builder config = ClientConfig.fromEnvironment().toBuilder();
        int threads = 10;
        int opsPerThread = 1000;
        double readRatio = 0.0;
        int valueSize = 32;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--host":
                    config.host(args[++i]);
                    break;
                case "--port":
                case "-p":
                    config.port(Integer.parseInt(args[++i]));
                    break;
                case "--threads":
                case "-t":
                    threads = Integer.parseInt(args[++i]);
                    break;
                case "--ops":
                case "-o":
                    opsPerThread = Integer.parseInt(args[++i]);
                    break;
                case "--read-ratio":
                case "-r":
                    readRatio = Double.parseDouble(args[++i]);
                    break;
                case "--value-size":
                case "-v":
                    valueSize = Integer.parseInt(args[++i]);
                    break;
                case "--help":
                case "-h":
                    printUsage();
                    return;
                default:
                    System.err.println("Unknown option: " + args[i]);
                    printUsage();
                    System.exit(1);
            }
        }

        ClientConfig clientConfig = config.build();
        System.out.println("Medusa Load Generator against " + clientConfig.getHost() + ":" + clientConfig.getPort());
        System.out.println();

        BenchmarkResult sequential =
                new LoadGenerator(clientConfig, 1, opsPerThread, readRatio, valueSize).run();
        System.out.println(sequential.format("Sequential (1 connection)"));

        BenchmarkResult concurrent =
                new LoadGenerator(clientConfig, threads, opsPerThread, readRatio, valueSize).run();
        System.out.println(concurrent.format("Concurrent (" + threads + " connections)"));
    }

    private static void printUsage() {
        System.out.println("Medusa Load Generator");
        System.out.println();
        System.out.println("Usage: LoadGenerator [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("      --host <host>             Server host (default: " + ClientConfig.DEFAULT_HOST + ")");
        System.out.println("  -p, --port <port>             Server port (default: " + ClientConfig.DEFAULT_PORT + ")");
        System.out.println("  -t, --threads <n>             Connections in the concurrent run (default: 10)");
        System.out.println("  -o, --ops <n>                 Requests per connection (default: 1000)");
        System.out.println("  -r, --read-ratio <ratio>      Share of GET requests 0.0-1.0 (default: 0.0)");
        System.out.println("  -v, --value-size <chars>      Value length (default: 32)");
        System.out.println("  -h, --help                    Show this help");
    }
}
