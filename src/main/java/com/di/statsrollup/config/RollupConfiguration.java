package com.di.statsrollup.config;

import com.di.statsrollup.rollup.CounterDelta;
import com.di.statsrollup.selector.ContainerSelector;
import com.di.statsrollup.selector.IdentifierFormatSelector;
import com.di.statsrollup.selector.MatchAllExceptAgentSelector;
import com.di.statsrollup.selector.MatchAllSelector;
import com.di.statsrollup.selector.MatchType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Clock;

/**
 * Wires the pieces whose implementation is picked from {@link RollupProperties}:
 * the container selector, the counter reset handling and the HTTP timeouts.
 */
@Slf4j
@Configuration
public class RollupConfiguration {

    @Bean
    public ContainerSelector containerSelector(RollupProperties props) {
        MatchType matchType = MatchType.fromConfig(props.getSelector().getMatchType());
        String agentName = props.getSelector().getAgentName();
        log.info("[CONFIG] Container selection: matchType={} agentName={}", matchType, agentName);
        return forMatchType(matchType, agentName);
    }

    public static ContainerSelector forMatchType(MatchType matchType, String agentName) {
        switch (matchType) {
            case NO_AGENT:
                return new MatchAllExceptAgentSelector(agentName);
            case UUID:
                return new IdentifierFormatSelector(agentName);
            case ALL:
            default:
                return new MatchAllSelector();
        }
    }

    @Bean
    public CounterDelta counterDelta(RollupProperties props) {
        return new CounterDelta(props.getRollup().getCounterResetPolicy());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestClientCustomizer timeoutRestClientCustomizer(RollupProperties props) {
        return builder -> {
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout(props.getHttp().getConnectTimeout());
            factory.setReadTimeout(props.getHttp().getReadTimeout());
            builder.requestFactory(factory);
        };
    }
}
