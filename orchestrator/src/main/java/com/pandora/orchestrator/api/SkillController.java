package com.pandora.orchestrator.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pandora.orchestrator.api.dto.RunSkillRequest;
import com.pandora.orchestrator.api.dto.SkillRunResponse;
import com.pandora.orchestrator.api.dto.SkillSummaryResponse;
import com.pandora.orchestrator.runtime.RunRequest;
import com.pandora.orchestrator.runtime.SkillRunService;
import com.pandora.orchestrator.skill.SkillRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * REST API for skills.
 *
 * GET  /skills                                  registered skills
 * POST /workspaces/{ws}/skills/{skillId}/runs   run a skill on demand (202 with the run id)
 * GET  /workspaces/{ws}/skill-runs/{runId}      poll a run
 */
@RestController
public class SkillController {

    private final SkillRegistry   skills;
    private final SkillRunService runService;
    private final ObjectMapper    objectMapper;

    public SkillController(SkillRegistry skills, SkillRunService runService, ObjectMapper objectMapper) {
        this.skills       = skills;
        this.runService   = runService;
        this.objectMapper = objectMapper;
    }

    @GetMapping("/skills")
    public List<SkillSummaryResponse> list() {
        return skills.list().stream()
                .map(SkillSummaryResponse::from)
                .toList();
    }

    /**
     * The run starts in the background; poll GET /workspaces/{ws}/skill-runs/{runId}.
     * Unknown skills give 404 and malformed step graphs 422, both before anything runs.
     */
    @PostMapping("/workspaces/{workspaceId}/skills/{skillId}/runs")
    public ResponseEntity<Map<String, String>> run(@PathVariable String workspaceId,
                                                   @PathVariable String skillId,
                                                   @RequestBody(required = false) RunSkillRequest body) {
        RunRequest request = RunRequest.onDemand(workspaceId, body == null ? Map.of() : body.params());
        runService.submit(skillId, request);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("runId", request.runId(), "skillId", skillId));
    }

    @GetMapping("/workspaces/{workspaceId}/skill-runs/{runId}")
    public SkillRunResponse getRun(@PathVariable String workspaceId, @PathVariable String runId) {
        return runService.findRun(workspaceId, runId)
                .map(run -> SkillRunResponse.from(run, objectMapper))
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Skill run not found: " + runId));
    }
}
