package io.linedecode.runtime;

import io.linedecode.config.DecoderConfig;
import io.linedecode.core.Record;
import io.linedecode.core.ReceiveChannel;
import io.linedecode.decode.DecoderSettings;
import io.linedecode.decode.DiagnosticLog;
import io.linedecode.error.DecodePipelineException;
import io.linedecode.error.InputReadException;
import io.linedecode.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * One run of the pipeline: a splitter thread feeding a fixed pool of decode workers through a
 * bounded work channel, and a closer thread that closes the result and error channels once the
 * splitter and every worker have finished.
 *
 * <p>Sessions are created and started by {@link ParallelDecoder#decode}. Consumers read
 * {@link #results()} and {@link #errors()} until both are drained; there is no way to abort a
 * session, so a consumer that stops reading leaves its threads parked on the full channels.
 */
public final class DecodeSession<T> {
    private static final Logger log = LoggerFactory.getLogger(DecodeSession.class);

    private final long id;
    private final InputStream input;
    private final int workers;
    private final Supplier<? extends T> factory;
    private final DecoderSettings settings;
    private final DecoderConfig config;
    private final Metrics metrics;

    private final BoundedChannel<Record> work;
    private final BoundedChannel<T> results;
    private final BoundedChannel<DecodePipelineException> errors;

    // splitter + workers
    private final CountDownLatch finished;
    private final CountDownLatch closed = new CountDownLatch(1);
    private final AtomicInteger liveWorkers;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CREATED);
    private final ExecutorService workerPool;

    DecodeSession(long id,
                  InputStream input,
                  int workers,
                  Supplier<? extends T> factory,
                  DecoderSettings settings,
                  DecoderConfig config,
                  Metrics metrics) {
        this.id = id;
        this.input = Objects.requireNonNull(input, "input");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1: " + workers);
        this.workers = workers;
        int capacity = config.queueCapacity(workers);
        this.work = new BoundedChannel<>("work-" + id, capacity);
        this.results = new BoundedChannel<>("results-" + id, capacity);
        // one slot per worker plus one for the splitter, so reporting a failure never blocks
        this.errors = new BoundedChannel<>("errors-" + id, workers + 1);
        this.finished = new CountDownLatch(workers + 1);
        this.liveWorkers = new AtomicInteger(workers);
        this.workerPool = Executors.newFixedThreadPool(workers, threadFactory("linedecode-worker-" + id + "-"));
    }

    void start() {
        if (!state.compareAndSet(SessionState.CREATED, SessionState.RUNNING)) {
            throw new IllegalStateException("session " + id + " already started");
        }
        metrics.sessions().inc();
        log.debug("Session started: session={}, workers={}, queueCapacity={}", id, workers, work.capacity());
        for (int i = 0; i < workers; i++) {
            workerPool.execute(new DecodeWorker<>(i, this, factory, settings.decoder()));
        }
        daemon(this::runSplitter, "linedecode-splitter-" + id).start();
        daemon(this::runCloser, "linedecode-closer-" + id).start();
    }

    public long id() { return id; }

    /**
     * Decoded values, in no particular order. Closed once the session completes. Iterating it from
     * a thread that gets interrupted throws {@link io.linedecode.error.ReceiveInterruptedException}.
     */
    public ReceiveChannel<T> results() { return results; }

    /** Read and decode failures. At most one per worker plus one for the input. */
    public ReceiveChannel<DecodePipelineException> errors() { return errors; }

    public SessionState state() { return state.get(); }

    public boolean isClosed() { return state.get() == SessionState.CLOSED; }

    public int workers() { return workers; }

    /**
     * Waits for the session to reach {@link SessionState#CLOSED}. Only returns true if the
     * consumer keeps the output channels from filling up, or they are large enough for the input.
     */
    public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        return closed.await(timeout, unit);
    }

    BoundedChannel<Record> work() { return work; }
    BoundedChannel<T> resultChannel() { return results; }
    BoundedChannel<DecodePipelineException> errorChannel() { return errors; }
    Metrics metrics() { return metrics; }
    DiagnosticLog diagnostics() { return settings.diagnostics(); }

    void workerExited() {
        liveWorkers.decrementAndGet();
        finished.countDown();
    }

    private void runSplitter() {
        LineSplitter splitter = new LineSplitter(input, work, config.maxLineBytes(), liveWorkers::get);
        try {
            splitter.split();
        } catch (IOException | RuntimeException e) {
            // e.g. UncheckedIOException from wrapping streams
            reportReadFailure(splitter.emitted(), e);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.debug("Splitter interrupted: session={}, records={}", id, splitter.emitted());
        } finally {
            metrics.recordsRead().mark(splitter.emitted());
            if (splitter.abandoned()) {
                log.warn("All workers failed, input abandoned: session={}, records={}", id, splitter.emitted());
            }
            work.close();
            state.compareAndSet(SessionState.RUNNING, SessionState.DRAINING);
            finished.countDown();
        }
    }

    private void reportReadFailure(long emitted, Exception cause) {
        metrics.readErrors().mark();
        log.warn("Reading input failed: session={}, records={}, reason={}", id, emitted, cause.toString());
        settings.diagnostics().printf("readlines: %s", cause);
        try {
            errors.send(new InputReadException(emitted, cause));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private void runCloser() {
        try {
            finished.await();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Closer interrupted before pipeline finished: session={}", id);
            return;
        }
        results.close();
        errors.close();
        state.set(SessionState.CLOSED);
        closed.countDown();
        workerPool.shutdown();
        log.debug("Session closed: session={}", id);
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> daemon(r, prefix + n.getAndIncrement());
    }

    @Override
    public String toString() {
        return "DecodeSession{id=" + id + ", workers=" + workers + ", state=" + state.get() + '}';
    }
}
