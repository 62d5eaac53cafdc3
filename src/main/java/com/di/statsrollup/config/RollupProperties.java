package com.di.statsrollup.config;

import com.di.statsrollup.rollup.CounterResetPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Single binding for all rollup job configuration.
 *
 * <p>Defaults live here and in {@code application.yml}; the environment variables the job has
 * always been driven by ({@code CADVISOR_URL}, {@code COLLECTOR_URL}, {@code MATCH_TYPE}) are
 * mapped onto these properties in {@code application.yml}.
 *
 * <pre>
 * statsrollup:
 *   run-on-startup: true
 *   window-seconds: 60
 *   source:
 *     base-url: http://cadvisor.local:8989/api/v1.2
 *   sink:
 *     url: http://collector.local:8787/cadvisor/metrics/
 *   selector:
 *     match-type: ALL          # ALL | NO_CADVISOR | UUID
 *     agent-name: cadvisor
 *   rollup:
 *     parallelism: 4
 *     counter-reset-policy: PASS_THROUGH
 *   http:
 *     connect-timeout: 5s
 *     read-timeout: 30s
 * </pre>
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "statsrollup")
public class RollupProperties {

    /** Run one rollup as soon as the context is up, then exit. Disabled in tests. */
    private boolean runOnStartup = true;

    /**
     * Length of the collection window in seconds, written verbatim into the report.
     * It does not drive any average: those divide by the sample count actually received.
     */
    @Min(1)
    private long windowSeconds = 60;

    @Valid
    private Source source = new Source();

    @Valid
    private Sink sink = new Sink();

    @Valid
    private Selector selector = new Selector();

    @Valid
    private Rollup rollup = new Rollup();

    @Valid
    private Http http = new Http();

    @Data
    public static class Source {
        /** cAdvisor REST base, without trailing slash; {@code /docker} and {@code /machine} are appended. */
        @NotBlank
        private String baseUrl = "http://cadvisor.local:8989/api/v1.2";
    }

    @Data
    public static class Sink {
        /** Collector endpoint the report is POSTed to. */
        @NotBlank
        private String url = "http://collector.local:8787/cadvisor/metrics/";
    }

    @Data
    public static class Selector {
        /** ALL, NO_CADVISOR (alias NO_AGENT) or UUID. Unknown values fall back to ALL. */
        private String matchType = "ALL";

        /** Name the monitoring agent's own container is known by. */
        @NotBlank
        private String agentName = "cadvisor";
    }

    @Data
    public static class Rollup {
        /** Worker threads used to roll up containers of one run concurrently. */
        @Min(1)
        private int parallelism = 4;

        @NotNull
        private CounterResetPolicy counterResetPolicy = CounterResetPolicy.PASS_THROUGH;
    }

    @Data
    public static class Http {
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);
    }
}
