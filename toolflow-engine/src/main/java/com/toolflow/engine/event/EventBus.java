package com.toolflow.engine.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolflow.core.model.Event;
import com.toolflow.core.repository.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Named publish/subscribe channel with an optional durable event log.
 *
 * {@link #emit} appends the event to the repository first and then delivers it
 * synchronously to every subscriber of that name. A failed append is logged and
 * delivery still happens. Events of one name are persisted and delivered in
 * emission order; a subscriber that throws does not stop delivery to the others.
 *
 * {@link #emitAsync} is for high-volume diagnostics: the event is delivered on a
 * background thread and never persisted.
 */
public class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final EventRepository eventRepository;
    private final ObjectMapper objectMapper;
    private final AtomicLong sequence = new AtomicLong(0);
    private final Map<String, List<EventListener>> listeners = new ConcurrentHashMap<>();
    private final Map<String, Object> nameLocks = new ConcurrentHashMap<>();
    private final ExecutorService asyncDelivery;

    /**
     * @param eventRepository durable log, or null to deliver without persisting
     * @param objectMapper mapper used to turn payload objects into JSON
     */
    public EventBus(EventRepository eventRepository, ObjectMapper objectMapper) {
        this.eventRepository = eventRepository;
        this.objectMapper = objectMapper;
        this.sequence.set(storedSequence(eventRepository));
        this.asyncDelivery = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "toolflow-event-async");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Register a listener for one event name.
     */
    public Subscription subscribe(String name, EventListener listener) {
        List<EventListener> forName = listeners.computeIfAbsent(name, k -> new CopyOnWriteArrayList<>());
        forName.add(listener);
        return () -> forName.remove(listener);
    }

    /**
     * Persist (best-effort) and deliver an event.
     *
     * @param name event name, see {@link com.toolflow.core.model.EventNames}
     * @param payload any Jackson-serializable value; a {@link JsonNode} is used as-is
     * @return the emitted event
     */
    public Event emit(String name, Object payload) {
        JsonNode json = toJson(payload);
        synchronized (lockFor(name)) {
            Event event = Event.create(sequence.incrementAndGet(), name, json);
            persist(event);
            deliver(event);
            return event;
        }
    }

    /**
     * Deliver an event on the background thread without persisting it.
     * Never throws; an event emitted after {@link #close} is dropped.
     */
    public void emitAsync(String name, Object payload) {
        Event event;
        try {
            event = Event.create(sequence.incrementAndGet(), name, toJson(payload));
        } catch (RuntimeException e) {
            log.warn("Dropping async event {}: {}", name, e.getMessage());
            return;
        }
        try {
            asyncDelivery.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.debug("Event bus closed, dropping async event {}", name);
        }
    }

    public int subscriberCount(String name) {
        List<EventListener> forName = listeners.get(name);
        return forName != null ? forName.size() : 0;
    }

    /**
     * Continue numbering after the stored log so sequences stay unique across restarts.
     */
    private static long storedSequence(EventRepository repository) {
        if (repository == null) {
            return 0;
        }
        try {
            return repository.lastSequence();
        } catch (RuntimeException e) {
            log.warn("Could not read last event sequence, numbering from 1: {}", e.getMessage());
            return 0;
        }
    }

    private void persist(Event event) {
        if (eventRepository == null) {
            return;
        }
        try {
            eventRepository.append(event);
        } catch (Exception e) {
            log.warn("Failed to persist event {} (seq={}): {}", event.name(), event.sequence(), e.getMessage());
        }
    }

    private void deliver(Event event) {
        List<EventListener> forName = listeners.get(event.name());
        if (forName == null) {
            return;
        }
        for (EventListener listener : forName) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.error("Listener for {} threw: {}", event.name(), e.getMessage(), e);
            }
        }
    }

    private JsonNode toJson(Object payload) {
        if (payload == null) {
            return objectMapper.nullNode();
        }
        if (payload instanceof JsonNode node) {
            return node;
        }
        return objectMapper.valueToTree(payload);
    }

    private Object lockFor(String name) {
        return nameLocks.computeIfAbsent(name, k -> new Object());
    }

    @Override
    public void close() {
        asyncDelivery.shutdown();
        try {
            if (!asyncDelivery.awaitTermination(5, TimeUnit.SECONDS)) {
                asyncDelivery.shutdownNow();
            }
        } catch (InterruptedException e) {
            asyncDelivery.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
