package com.toolflow.worker;

/**
 * Callbacks offered to a running tool handler.
 */
public interface ToolHooks {

    /**
     * Report progress. Fire-and-forget: never blocks and never throws.
     */
    void onLog(String message);

    /**
     * Token the handler may poll at its own checkpoints.
     */
    CancellationToken cancellation();

    /**
     * Hooks that drop log lines and are never cancelled.
     */
    static ToolHooks none() {
        CancellationToken token = new CancellationToken();
        return new ToolHooks() {
            @Override
            public void onLog(String message) {
            }

            @Override
            public CancellationToken cancellation() {
                return token;
            }
        };
    }
}
