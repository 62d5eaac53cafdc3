package com.di.statsrollup.job;

import com.di.statsrollup.exception.RollupErrorCategory;

/** A container left out of the report because its rollup failed. */
public record ContainerFailure(
    String containerName,
    RollupErrorCategory category,
    String message
) {}
