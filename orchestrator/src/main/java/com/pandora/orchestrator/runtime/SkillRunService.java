package com.pandora.orchestrator.runtime;

import com.pandora.orchestrator.model.SkillRun;
import com.pandora.orchestrator.repository.SkillRunRepository;
import com.pandora.orchestrator.skill.SkillDefinition;
import com.pandora.orchestrator.skill.SkillRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Entry point for running skills by id: synchronously, or submitted in the
 * background with a run id the caller can poll.
 */
@Service
public class SkillRunService {

    private static final Logger log = LoggerFactory.getLogger(SkillRunService.class);

    private final SkillRegistry      skills;
    private final SkillRuntime       runtime;
    private final SkillRunRepository runs;
    private final Executor           background;
    private final Clock              clock;
    private final Duration           recentRunWindow;

    public SkillRunService(SkillRegistry skills,
                           SkillRuntime runtime,
                           SkillRunRepository runs,
                           @Qualifier("skillTriggerExecutor") Executor background,
                           Clock clock,
                           @Value("${pandora.skills.recent-run-window:PT6H}") Duration recentRunWindow) {
        this.skills          = skills;
        this.runtime         = runtime;
        this.runs            = runs;
        this.background      = background;
        this.clock           = clock;
        this.recentRunWindow = recentRunWindow;
    }

    /**
     * @throws SkillNotFoundException if no skill has that id
     * @throws InvalidGraphException  if the skill's steps are malformed
     */
    public SkillRunResult runNow(String skillId, RunRequest request) {
        return runtime.execute(require(skillId), request);
    }

    /**
     * Validate, then run in the background.
     *
     * @return the run id, already assigned so the caller can poll for it
     * @throws SkillNotFoundException if no skill has that id
     * @throws InvalidGraphException  if the skill's steps are malformed
     */
    public CompletableFuture<SkillRunResult> submit(String skillId, RunRequest request) {
        SkillDefinition skill = require(skillId);
        StepGraph.of(skill);
        return CompletableFuture.supplyAsync(() -> runtime.execute(skill, request), background)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("Background run {} of skill '{}' crashed for workspace {}",
                                request.runId(), skillId, request.workspaceId(), error);
                    }
                });
    }

    @Transactional(readOnly = true)
    public Optional<SkillRun> findRun(String workspaceId, String runId) {
        return runs.findByIdAndWorkspaceId(runId, workspaceId);
    }

    /** True when the skill is running, or completed, for the workspace within the recent-run window. */
    @Transactional(readOnly = true)
    public boolean hasRecentRun(String skillId, String workspaceId) {
        return runs.existsBySkillIdAndWorkspaceIdAndStatusInAndStartedAtAfter(skillId, workspaceId,
                EnumSet.of(RunStatus.RUNNING, RunStatus.COMPLETED), clock.instant().minus(recentRunWindow));
    }

    public SkillDefinition require(String skillId) {
        return skills.get(skillId).orElseThrow(() -> new SkillNotFoundException(skillId));
    }
}
