package org.pragmatica.completion.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a candidate collection.
 *
 * <p>{@code tokens} maps each candidate token type to the token types that must literally follow it.
 * {@code rules} maps each candidate preferred rule to where and how it was reached.
 * Both maps keep discovery order and are unmodifiable.
 */
public record CandidatesCollection(
    Map<Integer, List<Integer>> tokens,
    Map<Integer, CandidateRule> rules
) {
    public static final CandidatesCollection EMPTY = new CandidatesCollection(Map.of(), Map.of());

    public CandidatesCollection {
        var tokenCopy = new LinkedHashMap<Integer, List<Integer>>();
        tokens.forEach((type, following) -> tokenCopy.put(type, List.copyOf(following)));
        tokens = Collections.unmodifiableMap(tokenCopy);
        rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public boolean isEmpty() {
        return tokens.isEmpty() && rules.isEmpty();
    }
}
