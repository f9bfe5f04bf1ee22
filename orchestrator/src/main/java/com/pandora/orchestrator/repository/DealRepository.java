package com.pandora.orchestrator.repository;

import com.pandora.orchestrator.model.Deal;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DealRepository extends JpaRepository<Deal, String> {

    /** Open pipeline for a workspace. */
    List<Deal> findByWorkspaceIdAndClosedFalse(String workspaceId);
}
