package com.di.statsrollup.selector;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reports every container except the monitoring agent, recognised by having the agent name
 * among its names. The check runs over the whole name list, not only the chosen name.
 */
public class MatchAllExceptAgentSelector implements ContainerSelector {

    private final String agentName;
    private final MatchAllSelector delegate = new MatchAllSelector();

    public MatchAllExceptAgentSelector(String agentName) {
        this.agentName = Objects.requireNonNull(agentName, "agentName");
    }

    @Override
    public Optional<String> select(List<String> names) {
        if (isAgent(agentName, names)) {
            return Optional.empty();
        }
        return delegate.select(names);
    }

    @Override
    public MatchType getMatchType() {
        return MatchType.NO_AGENT;
    }

    static boolean isAgent(String agentName, List<String> names) {
        return names != null && names.contains(agentName);
    }
}
