package com.toolflow.core.repository;

import com.toolflow.core.model.Event;

import java.util.List;

/**
 * Repository for event persistence.
 * Events are append-only and immutable.
 */
public interface EventRepository {

    /**
     * Append a new event to the log.
     *
     * @param event The event to append
     */
    void append(Event event);

    /**
     * Get all events with the given name in emission order.
     *
     * @param name The event name
     * @return Matching events ordered by sequence
     */
    List<Event> findByName(String name);

    /**
     * Get events from a sequence number onwards.
     *
     * @param fromSequence Start sequence (inclusive)
     * @param limit Maximum number of results
     * @return Events ordered by sequence
     */
    List<Event> findFrom(long fromSequence, int limit);

    /**
     * @return Highest stored sequence number, or 0 when the log is empty
     */
    long lastSequence();
}
