package com.di.statsrollup.source;

import com.di.statsrollup.model.ContainerInfo;

import java.util.List;

/** Supplies the most recent window of samples for every container on the host. */
public interface ContainerStatsSource {

    /**
     * @return one entry per known container, in source order
     * @throws com.di.statsrollup.exception.SourceUnavailableException if the source cannot be read
     */
    List<ContainerInfo> fetchContainers();
}
