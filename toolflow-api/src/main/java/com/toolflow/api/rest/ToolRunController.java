package com.toolflow.api.rest;

import com.toolflow.core.exception.NotFoundException;
import com.toolflow.core.model.ToolRun;
import com.toolflow.core.model.ToolTranscript;
import com.toolflow.core.repository.ToolRunRepository;
import com.toolflow.core.repository.TranscriptRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read-only REST API over the tool-call audit trail.
 */
@RestController
@RequestMapping("/api/v1/tool-runs")
public class ToolRunController {

    static final int MAX_LIMIT = 500;

    private final ToolRunRepository toolRunRepository;
    private final TranscriptRepository transcriptRepository;

    public ToolRunController(ToolRunRepository toolRunRepository, TranscriptRepository transcriptRepository) {
        this.toolRunRepository = toolRunRepository;
        this.transcriptRepository = transcriptRepository;
    }

    /**
     * List tool runs in start order, optionally for one tool.
     */
    @GetMapping
    public ResponseEntity<List<ToolRun>> listRuns(@RequestParam(required = false) String tool) {
        List<ToolRun> runs = tool != null
            ? toolRunRepository.findByToolName(tool)
            : toolRunRepository.findAll();
        return ResponseEntity.ok(runs);
    }

    @GetMapping("/{runId}")
    public ResponseEntity<ToolRun> getRun(@PathVariable String runId) {
        return ResponseEntity.ok(toolRunRepository.findById(runId)
            .orElseThrow(() -> new NotFoundException("ToolRun", runId)));
    }

    /**
     * Most recent transcripts for a tool, newest first.
     */
    @GetMapping("/transcripts")
    public ResponseEntity<List<ToolTranscript>> recentTranscripts(
            @RequestParam String tool,
            @RequestParam(defaultValue = "20") int limit) {

        return ResponseEntity.ok(transcriptRepository.findRecent(tool, checkLimit(limit)));
    }

    static int checkLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return limit;
    }
}
