package com.pandora.orchestrator.evidence;

import com.pandora.orchestrator.runtime.RunContext;

/**
 * Turns the step outputs of one skill run into an {@link EvidenceBundle}.
 *
 * <p>Called after the last step, whether or not every step completed.
 * Implementations must treat a missing output key as empty.
 */
public interface SkillEvidenceBuilder {

    /** Skill whose runs this builder handles. */
    String skillId();

    EvidenceBundle build(RunContext context);
}
