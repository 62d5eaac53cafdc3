package com.di.statsrollup.sink;

import com.di.statsrollup.config.RollupProperties;
import com.di.statsrollup.exception.SinkRejectedException;
import com.di.statsrollup.model.Report;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * POSTs the report as {@code application/json} to the collector endpoint.
 * A non-2xx answer or a transport failure is a {@link SinkRejectedException}.
 */
@Slf4j
@Component
public class CollectorReportSink implements ReportSink {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String url;

    public CollectorReportSink(RestClient.Builder restClientBuilder, RollupProperties props, ObjectMapper objectMapper) {
        this.restClient = restClientBuilder.build();
        this.objectMapper = objectMapper;
        this.url = props.getSink().getUrl();
    }

    @Override
    public void send(Report report) {
        String json;
        try {
            json = objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new SinkRejectedException("Failed to encode report: " + e.getOriginalMessage(), -1, e);
        }

        try {
            restClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(json)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientResponseException e) {
            throw new SinkRejectedException("Collector at " + url + " rejected report: HTTP "
                    + e.getStatusCode().value(), e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new SinkRejectedException("Failed to deliver report to " + url + ": " + e.getMessage(), -1, e);
        }
        log.info("[SINK] Delivered report timestamp={} containers={} to {}", report.timestamp(), report.stats().size(), url);
    }
}
