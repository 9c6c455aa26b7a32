package com.toolflow.engine.event;

/**
 * Handle returned by {@link EventBus#subscribe}. Closing it stops delivery.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
