package com.toolflow.engine.persistence;

import com.toolflow.core.model.Event;
import com.toolflow.core.repository.EventRepository;

import java.util.List;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of EventRepository, ordered by sequence.
 */
public class InMemoryEventRepository implements EventRepository {

    private final ConcurrentSkipListMap<Long, Event> events = new ConcurrentSkipListMap<>();

    @Override
    public void append(Event event) {
        events.putIfAbsent(event.sequence(), event);
    }

    @Override
    public List<Event> findByName(String name) {
        return events.values().stream()
            .filter(e -> e.name().equals(name))
            .collect(Collectors.toList());
    }

    @Override
    public List<Event> findFrom(long fromSequence, int limit) {
        return events.tailMap(fromSequence, true).values().stream()
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public long lastSequence() {
        return events.isEmpty() ? 0 : events.lastKey();
    }
}
