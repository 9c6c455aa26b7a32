package com.toolflow.engine.persistence;

import com.toolflow.core.model.ToolTranscript;
import com.toolflow.core.repository.TranscriptRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of TranscriptRepository.
 */
public class InMemoryTranscriptRepository implements TranscriptRepository {

    private final List<ToolTranscript> transcripts = new CopyOnWriteArrayList<>();

    @Override
    public void save(ToolTranscript transcript) {
        transcripts.add(transcript);
    }

    @Override
    public List<ToolTranscript> findRecent(String toolName, int limit) {
        List<ToolTranscript> recent = new ArrayList<>();
        for (int i = transcripts.size() - 1; i >= 0 && recent.size() < limit; i--) {
            ToolTranscript transcript = transcripts.get(i);
            if (transcript.toolName().equals(toolName)) {
                recent.add(transcript);
            }
        }
        return recent;
    }
}
