package com.toolflow.engine.event;

import com.toolflow.core.model.Event;

/**
 * Receives events of the names it subscribed to.
 * Called on the emitting thread; long work should be handed off.
 */
@FunctionalInterface
public interface EventListener {

    void onEvent(Event event);
}
