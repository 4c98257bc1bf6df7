package io.linedecode.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.linedecode.core.Record;
import io.linedecode.core.RecordDecoder;
import io.linedecode.error.DecodePipelineException;
import io.linedecode.error.RecordDecodeException;
import io.linedecode.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Pulls records off the work channel, decodes each into a fresh value from the factory and sends
 * it to the result channel. Stops at end of input or at its first decode failure, which it reports
 * on the error channel.
 */
final class DecodeWorker<T> implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(DecodeWorker.class);

    private final int id;
    private final DecodeSession<T> session;
    private final BoundedChannel<Record> work;
    private final BoundedChannel<T> results;
    private final BoundedChannel<DecodePipelineException> errors;
    private final Supplier<? extends T> factory;
    private final RecordDecoder decoder;
    private final Timer decodeTimer;
    private final Meter decodedMeter;
    private final Meter errorMeter;
    private long decoded = 0;

    DecodeWorker(int id, DecodeSession<T> session, Supplier<? extends T> factory, RecordDecoder decoder) {
        this.id = id;
        this.session = session;
        this.work = session.work();
        this.results = session.resultChannel();
        this.errors = session.errorChannel();
        this.factory = factory;
        this.decoder = decoder;
        Metrics metrics = session.metrics();
        this.decodeTimer = metrics.decodeTime();
        this.decodedMeter = metrics.valuesDecoded();
        this.errorMeter = metrics.decodeErrors();
    }

    @Override
    public void run() {
        try {
            Optional<Record> next;
            while ((next = work.receive()).isPresent()) {
                Record record = next.get();
                T value;
                try (Timer.Context ignored = decodeTimer.time()) {
                    value = factory.get();
                    if (value == null) throw new NullPointerException("value factory returned null");
                    decoder.decode(record.payload(), value);
                } catch (Throwable t) {
                    // Errors included: every dequeued record ends up as a value or an error
                    fail(record, t);
                    return;
                }
                results.send(value);
                decodedMeter.mark();
                decoded++;
            }
            log.debug("Worker finished: session={}, worker={}, decoded={}", session.id(), id, decoded);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.debug("Worker interrupted: session={}, worker={}, decoded={}", session.id(), id, decoded);
        } finally {
            session.workerExited();
        }
    }

    private void fail(Record record, Throwable cause) throws InterruptedException {
        errorMeter.mark();
        RecordDecodeException error = new RecordDecodeException(id, record.seq(), cause);
        log.warn("Decode failed, worker stopping: session={}, worker={}, record={}, reason={}",
                session.id(), id, record.seq(), cause.toString());
        session.diagnostics().printf("decoder %d: %s", id, cause);
        errors.send(error);
    }
}
