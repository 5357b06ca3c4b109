package com.ryuqq.factory.adapter.inmemory.queue;

import com.ryuqq.factory.core.model.Event;
import com.ryuqq.factory.core.spi.EventQueue;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * In-memory implementation of {@link EventQueue} SPI.
 *
 * <p>Strict FIFO over an {@link ArrayDeque} guarded by the instance monitor. Priority does not
 * reorder the queue. {@link #requeueFirst(Event)} puts an event that could not be admitted back
 * at the head so it keeps its position.</p>
 *
 * <p>The queue is unbounded and not persisted.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public class InMemoryEventQueue implements EventQueue {

    private final Deque<Event> events = new ArrayDeque<>();

    @Override
    public synchronized void enqueue(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.addLast(event);
    }

    @Override
    public synchronized void requeueFirst(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.addFirst(event);
    }

    @Override
    public synchronized Optional<Event> poll() {
        return Optional.ofNullable(events.pollFirst());
    }

    @Override
    public synchronized int size() {
        return events.size();
    }

    @Override
    public synchronized List<Event> snapshot() {
        return List.copyOf(events);
    }

    /**
     * Clears all queued events (for testing purposes).
     */
    public synchronized void clear() {
        events.clear();
    }
}
