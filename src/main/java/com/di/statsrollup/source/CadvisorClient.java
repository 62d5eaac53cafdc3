package com.di.statsrollup.source;

import com.di.statsrollup.config.RollupProperties;
import com.di.statsrollup.exception.SourceUnavailableException;
import com.di.statsrollup.model.ContainerInfo;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * cAdvisor REST API (v1.2) adapter: {@code GET /docker} for per-container samples and
 * {@code GET /machine} for host metadata. Any transport, status or decoding failure becomes a
 * {@link SourceUnavailableException}; nothing is retried.
 */
@Slf4j
@Component
public class CadvisorClient implements ContainerStatsSource, MachineInfoSource {

    private static final ParameterizedTypeReference<LinkedHashMap<String, ContainerInfo>> DOCKER_RESPONSE =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;
    private final String baseUrl;

    public CadvisorClient(RestClient.Builder restClientBuilder, RollupProperties props) {
        this.baseUrl = stripTrailingSlash(props.getSource().getBaseUrl());
        this.restClient = restClientBuilder.baseUrl(baseUrl).build();
    }

    @Override
    public List<ContainerInfo> fetchContainers() {
        long startMs = System.currentTimeMillis();
        Map<String, ContainerInfo> body;
        try {
            body = restClient.get()
                    .uri("/docker")
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(DOCKER_RESPONSE);
        } catch (RestClientException e) {
            throw new SourceUnavailableException("Failed to fetch container stats from " + baseUrl + "/docker: " + e.getMessage(), e);
        }
        if (body == null) {
            throw new SourceUnavailableException("Empty container stats response from " + baseUrl + "/docker", null);
        }

        List<ContainerInfo> containers = new ArrayList<>(body.size());
        body.forEach((key, info) -> {
            if (info == null) {
                log.warn("[SOURCE] Ignoring null entry for container key={}", key);
                return;
            }
            containers.add(info.name() != null ? info : new ContainerInfo(key, info.aliases(), info.stats()));
        });
        log.info("[SOURCE] Fetched stats for {} container(s) in {} ms", containers.size(), System.currentTimeMillis() - startMs);
        return containers;
    }

    @Override
    public JsonNode fetchMachineInfo() {
        try {
            JsonNode machine = restClient.get()
                    .uri("/machine")
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(JsonNode.class);
            if (machine == null) {
                throw new SourceUnavailableException("Empty machine info response from " + baseUrl + "/machine", null);
            }
            return machine;
        } catch (RestClientException e) {
            throw new SourceUnavailableException("Failed to fetch machine info from " + baseUrl + "/machine: " + e.getMessage(), e);
        }
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
