package io.linedecode.config;

public record DecoderConfig(
        int workers,
        int bufferPerWorker,
        int maxLineBytes
) {
    public DecoderConfig {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1: " + workers);
        if (bufferPerWorker < 1) throw new IllegalArgumentException("bufferPerWorker must be >= 1: " + bufferPerWorker);
        if (maxLineBytes < 0) throw new IllegalArgumentException("maxLineBytes must be >= 0: " + maxLineBytes);
    }

    public static DecoderConfig defaults() {
        return new DecoderConfig(Runtime.getRuntime().availableProcessors(), 10, 0);
    }

    /** System properties win over environment variables, which win over {@link #defaults()}. */
    public static DecoderConfig fromEnv() {
        DecoderConfig d = defaults();
        int workers = Integer.parseInt(System.getProperty("linedecode.workers", System.getenv().getOrDefault("LINEDECODE_WORKERS", String.valueOf(d.workers()))));
        int buffer = Integer.parseInt(System.getProperty("linedecode.bufferPerWorker", System.getenv().getOrDefault("LINEDECODE_BUFFER_PER_WORKER", String.valueOf(d.bufferPerWorker()))));
        int maxLine = Integer.parseInt(System.getProperty("linedecode.maxLineBytes", System.getenv().getOrDefault("LINEDECODE_MAX_LINE_BYTES", String.valueOf(d.maxLineBytes()))));
        return new DecoderConfig(workers, buffer, maxLine);
    }

    public DecoderConfig withWorkers(int n) { return new DecoderConfig(n, bufferPerWorker, maxLineBytes); }

    /** Capacity of the work and result queues for a session with {@code n} workers. */
    public int queueCapacity(int n) {
        long c = (long) n * bufferPerWorker;
        return (int) Math.min(Integer.MAX_VALUE - 8, c);
    }
}
