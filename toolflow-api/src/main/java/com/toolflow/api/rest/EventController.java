package com.toolflow.api.rest;

import com.toolflow.core.model.Event;
import com.toolflow.core.repository.EventRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read-only REST API over the persisted event log.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventRepository eventRepository;

    public EventController(EventRepository eventRepository) {
        this.eventRepository = eventRepository;
    }

    /**
     * Events of one name, or a page of the whole log starting at a sequence number.
     */
    @GetMapping
    public ResponseEntity<List<Event>> listEvents(
            @RequestParam(required = false) String name,
            @RequestParam(defaultValue = "0") long from,
            @RequestParam(defaultValue = "100") int limit) {

        if (name != null) {
            return ResponseEntity.ok(eventRepository.findByName(name));
        }
        if (from < 0) {
            throw new IllegalArgumentException("from must be >= 0");
        }
        return ResponseEntity.ok(eventRepository.findFrom(from, ToolRunController.checkLimit(limit)));
    }
}
