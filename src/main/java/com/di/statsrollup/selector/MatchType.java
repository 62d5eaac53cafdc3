package com.di.statsrollup.selector;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/** Container selection policies, chosen with {@code statsrollup.selector.match-type}. */
@Slf4j
public enum MatchType {

    /** Every container, the monitoring agent's own included. */
    ALL,
    /** Every container except the monitoring agent. Config value {@code NO_CADVISOR} is accepted too. */
    NO_AGENT,
    /** Containers with a UUID among their names; the monitoring agent is never matched. */
    UUID;

    /**
     * Parses a configured value. Blank and unrecognised values fall back to {@link #ALL}.
     */
    public static MatchType fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "ALL":
                return ALL;
            case "NO_AGENT":
            case "NO_CADVISOR":
                return NO_AGENT;
            case "UUID":
                return UUID;
            default:
                log.warn("[SELECTOR] Unknown match type '{}', falling back to ALL", value);
                return ALL;
        }
    }
}
