package com.di.statsrollup.selector;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether a container is reported, and under which of its names.
 * One implementation per {@link MatchType}; the active one is injected at startup.
 */
public interface ContainerSelector {

    /**
     * @param names every name the container is known by, in source order
     * @return the first qualifying name, or empty when the container should be skipped
     */
    Optional<String> select(List<String> names);

    MatchType getMatchType();
}
