package com.raid.roundsync.r2dbc.store;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import com.raid.roundsync.core.error.LocalStorageException;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.publisher.Sinks;

/**
 * Single writer for the local database.
 *
 * <p>Every write is queued and executed one at a time, in submission order, so appends to the
 * score log and the one-shot network record guard never interleave. Reads do not go through
 * the queue.</p>
 *
 * <p>Failures of a write are reported to its submitter as {@link LocalStorageException}; they do
 * not stop the queue.</p>
 */
@Component
public class LocalWriteQueue implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(LocalWriteQueue.class);

    private final Sinks.Many<Task<?>> tasks = Sinks.many().unicast().onBackpressureBuffer();
    private final Disposable worker;

    public LocalWriteQueue() {
        this.worker = tasks.asFlux()
                .concatMap(Task::run)
                .subscribe(
                        v -> { },
                        err -> log.error("Local write queue terminated unexpectedly: {}", err.toString(), err));
    }

    /**
     * Queues {@code write}; it is subscribed to only after every earlier write has finished.
     *
     * @param description short label used in logs and error messages
     */
    public <T> Mono<T> submit(String description, Mono<T> write) {
        return Mono.create(sink -> tasks.emitNext(new Task<>(description, write, sink),
                Sinks.EmitFailureHandler.busyLooping(Duration.ofSeconds(1))));
    }

    @Override
    public void destroy() {
        tasks.tryEmitComplete();
        worker.dispose();
    }

    private record Task<T>(String description, Mono<T> write, MonoSink<T> sink) {

        Mono<Void> run() {
            return write
                    .doOnSuccess(sink::success)
                    .onErrorResume(err -> {
                        log.error("Local write '{}' failed: {}", description, err.toString());
                        sink.error(err instanceof LocalStorageException
                                ? err
                                : new LocalStorageException("Local write failed: " + description, err));
                        return Mono.empty();
                    })
                    .then();
        }
    }
}
