package com.toolflow.engine.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.toolflow.worker.CancellationToken;

/**
 * The function a scheduled unit runs. It may be attempted more than once when retries are configured.
 */
@FunctionalInterface
public interface WorkUnit {

    /**
     * @param cancellation token the unit may poll; cancelling it never interrupts the call
     * @return the unit's result, may be null
     * @throws Exception any failure; retried when the policy allows it
     */
    JsonNode execute(CancellationToken cancellation) throws Exception;
}
