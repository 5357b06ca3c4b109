package com.ryuqq.factory.core.spi;

import com.ryuqq.factory.core.model.Event;

import java.util.List;
import java.util.Optional;

/**
 * FIFO backlog of deferred Events.
 *
 * <p>Ordering is strictly first-in first-out; an Event's priority never reorders the queue.
 * An Event taken with {@link #poll()} that cannot be admitted goes back to the head with
 * {@link #requeueFirst(Event)}.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public interface EventQueue {

    /**
     * Appends to the tail.
     *
     * @throws IllegalArgumentException if event is null
     */
    void enqueue(Event event);

    /**
     * Puts an event back at the head.
     *
     * @throws IllegalArgumentException if event is null
     */
    void requeueFirst(Event event);

    /**
     * Removes and returns the head.
     *
     * @return head event, empty when the queue is empty
     */
    Optional<Event> poll();

    int size();

    /**
     * @return queued events in order, head first
     */
    List<Event> snapshot();
}
