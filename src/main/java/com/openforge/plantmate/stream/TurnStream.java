package com.openforge.plantmate.stream;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bounded channel between one turn (producer) and its client transport (consumer).
 *
 * The producer blocks for at most {@code publishTimeout} when the buffer is full;
 * a client that stays that slow gets its turn cancelled instead of losing events.
 * Exactly one terminal event is accepted; anything published after it is dropped.
 *
 * Cancellation is one-way and may come from either side: the transport (client
 * went away) or the producer itself (buffer stayed full). The registered hook
 * runs once and is expected to interrupt the turn's thread.
 */
@Slf4j
public class TurnStream {

    private final String                     sessionId;
    private final BlockingQueue<StreamEvent> queue;
    private final Duration                   publishTimeout;
    private final AtomicBoolean              terminated = new AtomicBoolean();
    private final AtomicBoolean              cancelled  = new AtomicBoolean();
    private final AtomicReference<Runnable>  onCancel   = new AtomicReference<>();

    public TurnStream(String sessionId, int capacity, Duration publishTimeout) {
        this.sessionId      = sessionId;
        this.queue          = new ArrayBlockingQueue<>(capacity);
        this.publishTimeout = publishTimeout;
    }

    public String sessionId() {
        return sessionId;
    }

    // ── Producer side ────────────────────────────────────────────────────────

    /**
     * Enqueue an event. Returns false when it was not delivered: the stream is
     * cancelled, already terminated, the client stayed too slow, or the caller
     * was interrupted (the interrupt flag is kept).
     */
    public boolean publish(StreamEvent event) {
        if (cancelled.get()) {
            log.debug("[Stream:{}] Cancelled, dropping {}", sessionId, event.type());
            return false;
        }
        if (event.isTerminal() ? !terminated.compareAndSet(false, true) : terminated.get()) {
            log.warn("[Stream:{}] {} after terminal event dropped", sessionId, event.type());
            return false;
        }
        try {
            if (queue.offer(event, publishTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.warn("[Stream:{}] Client did not read for {}s, cancelling turn",
                    sessionId, publishTimeout.toSeconds());
            cancel();
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isTerminated() {
        return terminated.get();
    }

    // ── Consumer side ────────────────────────────────────────────────────────

    /** Next event, or null if none arrived within {@code wait}. */
    public StreamEvent poll(Duration wait) throws InterruptedException {
        return queue.poll(wait.toMillis(), TimeUnit.MILLISECONDS);
    }

    // ── Cancellation ─────────────────────────────────────────────────────────

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        log.info("[Stream:{}] Turn cancelled", sessionId);
        queue.clear();
        Runnable hook = onCancel.getAndSet(null);
        if (hook != null) {
            hook.run();
        }
    }

    /** Registers the action run on cancellation; runs it immediately if already cancelled. */
    public void onCancel(Runnable hook) {
        onCancel.set(hook);
        if (cancelled.get()) {
            Runnable pending = onCancel.getAndSet(null);
            if (pending != null) {
                pending.run();
            }
        }
    }
}
