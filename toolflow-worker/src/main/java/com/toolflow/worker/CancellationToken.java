package com.toolflow.worker;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag shared between a scheduler and the code it runs.
 * Cancelling never interrupts anything; running code decides where to check.
 */
public class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();

    /**
     * Request cancellation. Only the first reason is kept.
     *
     * @return true if this call cancelled the token
     */
    public boolean cancel(String cancelReason) {
        return reason.compareAndSet(null, cancelReason != null ? cancelReason : "cancelled");
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }

    /**
     * Throw if cancellation was requested.
     */
    public void throwIfCancelled() throws ToolException {
        if (isCancelled()) {
            throw ToolException.permanent("CANCELLED", "Cancelled: " + reason.get());
        }
    }
}
