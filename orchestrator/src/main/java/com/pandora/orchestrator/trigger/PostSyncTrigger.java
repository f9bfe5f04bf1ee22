package com.pandora.orchestrator.trigger;

import com.pandora.orchestrator.runtime.RunRequest;
import com.pandora.orchestrator.runtime.RunStatus;
import com.pandora.orchestrator.runtime.SkillRunResult;
import com.pandora.orchestrator.runtime.SkillRuntime;
import com.pandora.orchestrator.skill.ScheduleTrigger;
import com.pandora.orchestrator.skill.SkillDefinition;
import com.pandora.orchestrator.skill.SkillRegistry;
import com.pandora.orchestrator.sync.SyncCompletedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Starts every {@code post_sync} skill for a workspace once its sync finishes.
 *
 * <p>Each skill runs as its own task on the trigger executor. Nothing a
 * triggered skill does, including throwing, reaches the caller or the other
 * skills: every returned future completes normally, and failures are only
 * logged with the skill id and workspace id.
 */
@Component
public class PostSyncTrigger {

    private static final Logger log = LoggerFactory.getLogger(PostSyncTrigger.class);

    private final SkillRegistry skills;
    private final SkillRuntime  runtime;
    private final Executor      executor;

    public PostSyncTrigger(SkillRegistry skills,
                           SkillRuntime runtime,
                           @Qualifier("skillTriggerExecutor") Executor executor) {
        this.skills   = skills;
        this.runtime  = runtime;
        this.executor = executor;
    }

    /**
     * @return one future per triggered skill; none of them completes exceptionally
     */
    public List<CompletableFuture<Void>> onSyncCompleted(SyncCompletedEvent event) {
        List<SkillDefinition> matches = skills.listByTrigger(ScheduleTrigger.POST_SYNC);
        if (matches.isEmpty()) {
            log.debug("No post-sync skills registered; nothing to run for workspace {}", event.workspaceId());
            return List.of();
        }
        log.info("Sync completed for workspace {}; triggering {} skill(s)", event.workspaceId(), matches.size());

        List<CompletableFuture<Void>> tasks = new ArrayList<>(matches.size());
        for (SkillDefinition skill : matches) {
            tasks.add(spawn(skill, event));
        }
        return tasks;
    }

    private CompletableFuture<Void> spawn(SkillDefinition skill, SyncCompletedEvent event) {
        CompletableFuture<Void> task;
        try {
            task = CompletableFuture.runAsync(() -> runOne(skill, event), executor);
        } catch (RejectedExecutionException e) {
            log.error("Could not schedule post-sync skill '{}' for workspace {}: {}",
                    skill.id(), event.workspaceId(), e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        return task.exceptionally(error -> {
            log.error("Post-sync skill '{}' crashed for workspace {}",
                    skill.id(), event.workspaceId(), error);
            return null;
        });
    }

    private void runOne(SkillDefinition skill, SyncCompletedEvent event) {
        SkillRunResult result = runtime.execute(skill, RunRequest.postSync(event.workspaceId(), event.toPayload()));
        if (result.status() == RunStatus.FAILED) {
            log.warn("Post-sync skill '{}' finished with failed steps for workspace {} (run {}): {}",
                    skill.id(), event.workspaceId(), result.runId(), result.errors());
        }
    }
}
