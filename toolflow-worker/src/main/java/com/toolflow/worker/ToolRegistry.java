package com.toolflow.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to handler lookup for the tools a runner may call.
 *
 * Usage:
 * <pre>
 * ToolRegistry tools = new ToolRegistry();
 * tools.register("apply_patch", (args, context, hooks) -> {
 *     hooks.onLog("patching " + args.path("file").asText());
 *     return patcher.apply(args);
 * });
 * </pre>
 */
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Register a tool handler, replacing any handler with the same name.
     */
    public ToolRegistry register(String toolName, ToolHandler handler) {
        if (toolName == null || toolName.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        ToolHandler previous = handlers.put(toolName, handler);
        if (previous != null) {
            log.info("Replaced tool handler: {}", toolName);
        } else {
            log.info("Registered tool handler: {}", toolName);
        }
        return this;
    }

    public Optional<ToolHandler> find(String toolName) {
        return Optional.ofNullable(handlers.get(toolName));
    }

    public boolean contains(String toolName) {
        return handlers.containsKey(toolName);
    }

    public Set<String> toolNames() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }
}
