package com.raid.roundsync.service.task;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Owner of fire-and-forget work started on behalf of a round (background initiation publish,
 * initiation polling). Tasks outlive the request that started them and are disposed on
 * shutdown.
 *
 * <p>One task per key: submitting under a key that is still running returns the running task.</p>
 */
@Component
public class RoundTaskRegistry implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(RoundTaskRegistry.class);

    private final Map<String, Disposable> running = new ConcurrentHashMap<>();

    /**
     * Subscribes to {@code task} on the bounded-elastic scheduler. Failures are logged and never
     * propagate.
     */
    public Disposable submit(String key, Mono<?> task) {
        return running.computeIfAbsent(key, k -> task
                .subscribeOn(Schedulers.boundedElastic())
                .doFinally(signal -> running.remove(k))
                .subscribe(
                        v -> log.debug("Task {} finished: {}", k, v),
                        err -> log.warn("Task {} failed: {}", k, err.toString())));
    }

    public boolean isRunning(String key) {
        Disposable d = running.get(key);
        return d != null && !d.isDisposed();
    }

    public void cancel(String key) {
        Disposable d = running.remove(key);
        if (d != null && !d.isDisposed()) {
            d.dispose();
            log.debug("Task {} cancelled", key);
        }
    }

    @Override
    public void destroy() {
        running.forEach((key, d) -> {
            if (!d.isDisposed()) {
                d.dispose();
            }
        });
        running.clear();
    }
}
