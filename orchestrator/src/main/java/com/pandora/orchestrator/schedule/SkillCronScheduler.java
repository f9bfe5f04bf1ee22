package com.pandora.orchestrator.schedule;

import com.pandora.orchestrator.agent.AgentDefinition;
import com.pandora.orchestrator.agent.AgentRegistry;
import com.pandora.orchestrator.agent.AgentRunner;
import com.pandora.orchestrator.repository.ConnectorWatermarkRepository;
import com.pandora.orchestrator.runtime.RunRequest;
import com.pandora.orchestrator.runtime.SkillRunService;
import com.pandora.orchestrator.runtime.SkillRuntime;
import com.pandora.orchestrator.skill.ScheduleTrigger;
import com.pandora.orchestrator.skill.SkillDefinition;
import com.pandora.orchestrator.skill.SkillRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Registers cron-triggered skills and agents with the {@link TaskScheduler}
 * once the application is ready.
 *
 * Skills sharing an expression share one trigger. On each tick every
 * workspace with a synced connector is processed; a skill that ran (or is
 * running) for the workspace within the recent-run window is skipped.
 */
@Component
public class SkillCronScheduler {

    private static final Logger log = LoggerFactory.getLogger(SkillCronScheduler.class);

    private final TaskScheduler                taskScheduler;
    private final SkillRegistry                skills;
    private final AgentRegistry                agents;
    private final SkillRuntime                 runtime;
    private final SkillRunService              runService;
    private final AgentRunner                  agentRunner;
    private final ConnectorWatermarkRepository watermarks;
    private final List<ScheduledFuture<?>>     scheduled = new ArrayList<>();

    public SkillCronScheduler(TaskScheduler taskScheduler,
                              SkillRegistry skills,
                              AgentRegistry agents,
                              SkillRuntime runtime,
                              SkillRunService runService,
                              AgentRunner agentRunner,
                              ConnectorWatermarkRepository watermarks) {
        this.taskScheduler = taskScheduler;
        this.skills        = skills;
        this.agents        = agents;
        this.runtime       = runtime;
        this.runService    = runService;
        this.agentRunner   = agentRunner;
        this.watermarks    = watermarks;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        int count = scheduleAll();
        log.info("Cron scheduler registered {} trigger(s)", count);
    }

    /** @return how many cron triggers were registered */
    public synchronized int scheduleAll() {
        Map<String, List<SkillDefinition>> byCron = new LinkedHashMap<>();
        for (SkillDefinition skill : skills.listByTrigger(ScheduleTrigger.CRON)) {
            byCron.computeIfAbsent(skill.schedule().cron(), k -> new ArrayList<>()).add(skill);
        }

        int registered = 0;
        for (Map.Entry<String, List<SkillDefinition>> entry : byCron.entrySet()) {
            List<SkillDefinition> group = List.copyOf(entry.getValue());
            if (register(entry.getKey(), () -> runSkills(group), group.stream().map(SkillDefinition::id).toList())) {
                registered++;
            }
        }
        for (AgentDefinition agent : agents.listEnabled()) {
            if (agent.schedule() == null || agent.schedule().cron() == null) continue;
            String agentId = agent.id();
            if (register(agent.schedule().cron(), () -> runAgent(agentId), List.of("agent:" + agentId))) {
                registered++;
            }
        }
        return registered;
    }

    private boolean register(String cron, Runnable task, List<String> names) {
        String spring;
        try {
            spring = CronExpressions.toSpring(cron);
        } catch (IllegalArgumentException e) {
            log.error("Not scheduling {}: {}", names, e.getMessage());
            return false;
        }
        ScheduledFuture<?> future = taskScheduler.schedule(task, new CronTrigger(spring, ZoneOffset.UTC));
        if (future != null) {
            scheduled.add(future);
        }
        log.info("Scheduled {} on '{}'", names, cron);
        return true;
    }

    // ------------------------------------------------------------------
    // Ticks
    // ------------------------------------------------------------------

    void runSkills(List<SkillDefinition> group) {
        for (String workspaceId : watermarks.findSyncedWorkspaceIds()) {
            for (SkillDefinition skill : group) {
                if (runService.hasRecentRun(skill.id(), workspaceId)) {
                    log.info("Skipping cron run of '{}' for workspace {}: ran recently", skill.id(), workspaceId);
                    continue;
                }
                try {
                    runtime.execute(skill, RunRequest.cron(workspaceId));
                } catch (RuntimeException e) {
                    log.error("Cron run of skill '{}' failed for workspace {}: {}",
                            skill.id(), workspaceId, e.getMessage(), e);
                }
            }
        }
    }

    void runAgent(String agentId) {
        // the agent may have been disabled or replaced since it was scheduled
        AgentDefinition agent = agents.get(agentId).orElse(null);
        if (agent == null || !agent.enabled()) {
            log.info("Skipping cron tick for agent '{}': not enabled", agentId);
            return;
        }
        for (String workspaceId : watermarks.findSyncedWorkspaceIds()) {
            if (agent.appliesTo(workspaceId)) {
                agentRunner.run(agent, workspaceId);
            }
        }
    }

    @PreDestroy
    synchronized void stop() {
        scheduled.forEach(f -> f.cancel(false));
        scheduled.clear();
    }
}
