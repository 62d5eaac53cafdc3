package com.di.statsrollup.sink;

import com.di.statsrollup.model.Report;

/** Delivers the assembled report downstream. */
public interface ReportSink {

    /**
     * @throws com.di.statsrollup.exception.SinkRejectedException if delivery fails for any reason
     */
    void send(Report report);
}
