package com.aicmd.cache.matching;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record NormalizedQuery(List<String> tokens, String canonical) {

    public NormalizedQuery {
        tokens = List.copyOf(tokens);
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public Set<String> tokenSet() {
        return new LinkedHashSet<>(tokens);
    }

    public String hashKey() {
        if (tokens.isEmpty()) {
            return canonical;
        }
        List<String> sorted = new ArrayList<>(tokens);
        Collections.sort(sorted);
        return String.join(" ", sorted);
    }
}
