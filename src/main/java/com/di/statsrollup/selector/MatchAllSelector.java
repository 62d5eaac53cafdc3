package com.di.statsrollup.selector;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Reports every container under its first name, taken as-is. */
public class MatchAllSelector implements ContainerSelector {

    @Override
    public Optional<String> select(List<String> names) {
        if (names == null) {
            return Optional.empty();
        }
        return names.stream().filter(Objects::nonNull).findFirst();
    }

    @Override
    public MatchType getMatchType() {
        return MatchType.ALL;
    }
}
