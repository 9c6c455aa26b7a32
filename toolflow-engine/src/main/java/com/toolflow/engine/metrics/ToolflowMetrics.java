package com.toolflow.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer meters for tool calls and scheduled units.
 *
 * Metrics exposed:
 * - tool call counts by tool and outcome, and call latency
 * - unit counts by outcome, retry count, and units currently executing
 */
public class ToolflowMetrics implements MeterBinder {

    public static final String TOOL_CALLS = "toolflow.tool.calls";
    public static final String TOOL_DURATION = "toolflow.tool.duration";
    public static final String UNITS = "toolflow.units";
    public static final String UNIT_RETRIES = "toolflow.unit.retries";
    public static final String UNITS_ACTIVE = "toolflow.units.active";

    private final AtomicInteger activeUnits = new AtomicInteger(0);
    private MeterRegistry registry;

    public ToolflowMetrics(MeterRegistry registry) {
        bindTo(registry);
    }

    /**
     * Metrics backed by a private registry, for callers that do not export meters.
     */
    public static ToolflowMetrics detached() {
        return new ToolflowMetrics(new SimpleMeterRegistry());
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(UNITS_ACTIVE, activeUnits, AtomicInteger::get)
            .description("Number of units currently executing")
            .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    // ========== Tool Metrics ==========

    public void toolSucceeded(String toolName, Duration duration) {
        toolOutcome(toolName, "success");
        toolDuration(toolName, duration);
    }

    public void toolFailed(String toolName, Duration duration) {
        toolOutcome(toolName, "failure");
        toolDuration(toolName, duration);
    }

    public void toolRejected(String toolName) {
        toolOutcome(toolName, "rejected");
    }

    public void toolRectified(String toolName) {
        toolOutcome(toolName, "rectified");
    }

    private void toolOutcome(String toolName, String outcome) {
        Counter.builder(TOOL_CALLS)
            .tag("tool", toolName)
            .tag("outcome", outcome)
            .description("Tool calls by outcome")
            .register(registry)
            .increment();
    }

    private void toolDuration(String toolName, Duration duration) {
        Timer.builder(TOOL_DURATION)
            .tag("tool", toolName)
            .description("Tool handler execution time")
            .register(registry)
            .record(duration);
    }

    // ========== Unit Metrics ==========

    public void unitStarted() {
        activeUnits.incrementAndGet();
    }

    public void unitFinished() {
        activeUnits.decrementAndGet();
    }

    public void unitSettled(String outcome) {
        Counter.builder(UNITS)
            .tag("outcome", outcome)
            .description("Scheduled units by final outcome")
            .register(registry)
            .increment();
    }

    public void unitRetried() {
        Counter.builder(UNIT_RETRIES)
            .description("Retry attempts scheduled after a failed unit attempt")
            .register(registry)
            .increment();
    }

    public int activeUnits() {
        return activeUnits.get();
    }
}
