package com.di.statsrollup.selector;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reports containers that carry a UUID among their names, under that name.
 * The monitoring agent is excluded whatever its names look like.
 *
 * <p>Accepted forms: 32 hex digits in either case, hyphens anywhere. Lower-case {@code urn:} and
 * {@code uuid:} are removed wherever they occur and any run of braces is stripped from both ends,
 * paired or not. Surrounding whitespace is not accepted. The version nibble is not checked.
 */
public class IdentifierFormatSelector implements ContainerSelector {

    private static final Pattern HEX_32 = Pattern.compile("[0-9a-fA-F]{32}");

    private final String agentName;

    public IdentifierFormatSelector(String agentName) {
        this.agentName = Objects.requireNonNull(agentName, "agentName");
    }

    @Override
    public Optional<String> select(List<String> names) {
        if (names == null || MatchAllExceptAgentSelector.isAgent(agentName, names)) {
            return Optional.empty();
        }
        return names.stream().filter(IdentifierFormatSelector::isUuid).findFirst();
    }

    @Override
    public MatchType getMatchType() {
        return MatchType.UUID;
    }

    static boolean isUuid(String candidate) {
        if (candidate == null) {
            return false;
        }
        String hex = candidate.replace("urn:", "").replace("uuid:", "");
        int start = 0;
        int end = hex.length();
        while (start < end && isBrace(hex.charAt(start))) {
            start++;
        }
        while (end > start && isBrace(hex.charAt(end - 1))) {
            end--;
        }
        hex = hex.substring(start, end).replace("-", "");
        return HEX_32.matcher(hex).matches();
    }

    private static boolean isBrace(char c) {
        return c == '{' || c == '}';
    }
}
