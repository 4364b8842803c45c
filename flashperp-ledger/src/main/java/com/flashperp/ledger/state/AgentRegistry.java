package com.flashperp.ledger.state;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Agents an owner has authorized to manage their positions.
 */
public class AgentRegistry {

    private final Map<String, Set<String>> agentsByOwner = new ConcurrentHashMap<>();

    public void authorize(String owner, String agent) {
        agentsByOwner.computeIfAbsent(owner, k -> ConcurrentHashMap.newKeySet()).add(agent);
    }

    public void revoke(String owner, String agent) {
        Set<String> agents = agentsByOwner.get(owner);
        if (agents != null) {
            agents.remove(agent);
        }
    }

    /**
     * Whether {@code caller} may act on positions of {@code owner}.
     */
    public boolean mayActFor(String caller, String owner) {
        if (caller == null) {
            return false;
        }
        if (caller.equals(owner)) {
            return true;
        }
        Set<String> agents = agentsByOwner.get(owner);
        return agents != null && agents.contains(caller);
    }
}
