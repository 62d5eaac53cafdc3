package com.di.statsrollup.source;

import com.fasterxml.jackson.databind.JsonNode;

/** Supplies host-level metadata, kept opaque and passed through into the report. */
public interface MachineInfoSource {

    /**
     * @throws com.di.statsrollup.exception.SourceUnavailableException if the source cannot be read
     */
    JsonNode fetchMachineInfo();
}
