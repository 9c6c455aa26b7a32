package com.toolflow.core.repository;

import com.toolflow.core.model.ToolTranscript;

import java.util.List;

/**
 * Storage for short tool call transcripts.
 */
public interface TranscriptRepository {

    void save(ToolTranscript transcript);

    /**
     * @param toolName The tool name
     * @param limit Maximum number of results
     * @return Most recent transcripts of the tool, newest first
     */
    List<ToolTranscript> findRecent(String toolName, int limit);
}
