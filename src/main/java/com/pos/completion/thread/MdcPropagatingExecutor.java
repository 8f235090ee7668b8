package com.pos.completion.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pool that carries the caller's MDC context into each task.
 *
 * Worker threads are daemons so that an un-closed pool never blocks JVM exit.
 */
public class MdcPropagatingExecutor implements Executor, AutoCloseable {

    private final ExecutorService delegate;

    public MdcPropagatingExecutor(int threads, String namePrefix) {
        this.delegate = Executors.newFixedThreadPool(Math.max(1, threads), daemonFactory(namePrefix));
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the calling thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    @Override
    public void close() {
        delegate.shutdown();
        try {
            if (!delegate.awaitTermination(5, TimeUnit.SECONDS)) {
                delegate.shutdownNow();
            }
        } catch (InterruptedException e) {
            delegate.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonFactory(String namePrefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
