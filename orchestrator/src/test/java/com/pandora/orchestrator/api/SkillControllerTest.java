package com.pandora.orchestrator.api;

import com.pandora.orchestrator.model.SkillRun;
import com.pandora.orchestrator.runtime.InvalidGraphException;
import com.pandora.orchestrator.runtime.RunRequest;
import com.pandora.orchestrator.runtime.RunStatus;
import com.pandora.orchestrator.runtime.SkillNotFoundException;
import com.pandora.orchestrator.runtime.SkillRunService;
import com.pandora.orchestrator.library.PipelineHygieneSkill;
import com.pandora.orchestrator.skill.SkillRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for SkillController.
 */
@WebMvcTest(SkillController.class)
class SkillControllerTest {

    @Autowired MockMvc           mockMvc;
    @MockitoBean SkillRegistry   skills;
    @MockitoBean SkillRunService runService;

    @Test
    void list_returnsSkillSummaries() throws Exception {
        when(skills.list()).thenReturn(List.of(PipelineHygieneSkill.definition()));

        mockMvc.perform(get("/skills"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("pipeline-hygiene"))
                .andExpect(jsonPath("$[0].steps").value(5))
                .andExpect(jsonPath("$[0].triggers[0]").value("ON_DEMAND"))
                .andExpect(jsonPath("$[0].triggers[1]").value("POST_SYNC"));
    }

    // ------------------------------------------------------------------
    // POST /workspaces/{ws}/skills/{skillId}/runs
    // ------------------------------------------------------------------

    @Test
    void run_known_returns202WithRunIdAndPassesParams() throws Exception {
        mockMvc.perform(post("/workspaces/ws-1/skills/pipeline-hygiene/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"params":{"staleDays":21}}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.runId").isNotEmpty())
                .andExpect(jsonPath("$.skillId").value("pipeline-hygiene"));

        ArgumentCaptor<RunRequest> request = ArgumentCaptor.forClass(RunRequest.class);
        verify(runService).submit(eq("pipeline-hygiene"), request.capture());
        assertThat(request.getValue().params()).containsEntry("staleDays", 21);
        assertThat(request.getValue().trigger()).isEqualTo(RunRequest.ON_DEMAND);
    }

    @Test
    void run_unknownSkill_returns404() throws Exception {
        when(runService.submit(eq("nope"), any())).thenThrow(new SkillNotFoundException("nope"));

        mockMvc.perform(post("/workspaces/ws-1/skills/nope/runs"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").isNotEmpty());
    }

    @Test
    void run_malformedGraph_returns422WithStep() throws Exception {
        when(runService.submit(eq("broken"), any()))
                .thenThrow(new InvalidGraphException("broken", "b", "depends on unknown step 'zzz'"));

        mockMvc.perform(post("/workspaces/ws-1/skills/broken/runs"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.stepId").value("b"));
    }

    // ------------------------------------------------------------------
    // GET /workspaces/{ws}/skill-runs/{runId}
    // ------------------------------------------------------------------

    @Test
    void getRun_existing_returnsStoredJsonAsObjects() throws Exception {
        SkillRun run = new SkillRun("run-1", "pipeline-hygiene", "ws-1", RunRequest.ON_DEMAND,
                Instant.parse("2026-03-04T10:00:00Z"));
        run.setStatus(RunStatus.COMPLETED);
        run.setOutputJson("{\"summary\":\"ok\"}");
        run.setErrorsJson("[]");
        when(runService.findRun("ws-1", "run-1")).thenReturn(Optional.of(run));

        mockMvc.perform(get("/workspaces/ws-1/skill-runs/run-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.output.summary").value("ok"))
                .andExpect(jsonPath("$.errors").isArray());
    }

    @Test
    void getRun_unknown_returns404() throws Exception {
        when(runService.findRun(any(), any())).thenReturn(Optional.empty());

        mockMvc.perform(get("/workspaces/ws-1/skill-runs/missing"))
                .andExpect(status().isNotFound());
    }
}
