package com.pandora.orchestrator.repository;

import com.pandora.orchestrator.model.SkillRun;
import com.pandora.orchestrator.runtime.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface SkillRunRepository extends JpaRepository<SkillRun, String> {

    Optional<SkillRun> findByIdAndWorkspaceId(String id, String workspaceId);

    List<SkillRun> findTop20ByWorkspaceIdAndSkillIdOrderByStartedAtDesc(String workspaceId, String skillId);

    /** Cron dedupe: did this skill already run (or is it running) for the workspace recently? */
    boolean existsBySkillIdAndWorkspaceIdAndStatusInAndStartedAtAfter(
            String skillId, String workspaceId, Collection<RunStatus> statuses, Instant since);
}
