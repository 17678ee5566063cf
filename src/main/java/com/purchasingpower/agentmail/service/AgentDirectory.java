package com.purchasingpower.agentmail.service;

import com.purchasingpower.agentmail.model.directory.DirectoryContext;

/**
 * Source of agent and team data.
 */
public interface AgentDirectory {

    /**
     * Current read-only view of agents and teams.
     */
    DirectoryContext snapshot();
}
