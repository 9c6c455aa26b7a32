package com.toolflow.core.repository;

import com.toolflow.core.model.ToolRun;

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage for tool run records.
 */
public interface ToolRunRepository {

    /**
     * Save a tool run record. Records are never updated.
     *
     * @param run The record to save
     */
    void save(ToolRun run);

    Optional<ToolRun> findById(String id);

    /**
     * @param toolName The tool name
     * @return Runs of the tool ordered by start time
     */
    List<ToolRun> findByToolName(String toolName);

    /**
     * @return All runs ordered by start time
     */
    List<ToolRun> findAll();
}
