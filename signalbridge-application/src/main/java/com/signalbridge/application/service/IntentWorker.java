package com.signalbridge.application.service;

import com.signalbridge.application.usecase.PipelineResult;
import com.signalbridge.application.usecase.TransactionPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Background service loop feeding queued raw events through the pipeline, one at a time.
 *
 * Cancellation is cooperative: {@link #stop()} clears a flag that is polled between events.
 * An event already inside the pipeline (including an in-flight HTTP call) runs to completion.
 * The flag is armed at construction, so a stop issued before the thread enters {@link #run()} still ends it.
 */
public final class IntentWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(IntentWorker.class);

    private final TransactionPipeline pipeline;
    private final BlockingQueue<String> queue;
    private final Consumer<PipelineResult> listener;
    private final long pollMillis;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicBoolean running = new AtomicBoolean(true);

    public IntentWorker(TransactionPipeline pipeline, int capacity, Consumer<PipelineResult> listener) {
        this(pipeline, capacity, listener, 1000L);
    }

    public IntentWorker(TransactionPipeline pipeline, int capacity, Consumer<PipelineResult> listener, long pollMillis) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.listener = listener == null ? r -> { } : listener;
        this.pollMillis = pollMillis;
    }

    /** Enqueues an event; returns false when the queue is full. */
    public boolean submit(String rawEvent) {
        Objects.requireNonNull(rawEvent, "rawEvent");
        boolean accepted = queue.offer(rawEvent);
        if (!accepted) {
            log.warn("Worker queue full, dropping event {}", rawEvent);
        }
        return accepted;
    }

    @Override
    public void run() {
        log.info("Intent worker started");

        while (running.get()) {
            String event;
            try {
                event = queue.poll(pollMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (event == null) continue;

            PipelineResult result = pipeline.process(event);
            processed.incrementAndGet();
            try {
                listener.accept(result);
            } catch (RuntimeException e) {
                log.warn("Result listener failed for event {}", event, e);
            }
        }

        running.set(false);
        log.info("Intent worker stopped after {} events", processed.get());
    }

    public void stop() {
        running.set(false);
    }

    public boolean isRunning() {
        return running.get();
    }

    public long processedCount() {
        return processed.get();
    }

    public int pending() {
        return queue.size();
    }
}
