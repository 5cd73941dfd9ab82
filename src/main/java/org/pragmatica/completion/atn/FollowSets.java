package org.pragmatica.completion.atn;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.IntervalSet;

import java.util.List;

/**
 * All follow sets of a rule start state, split by path, plus their union for quick hit tests.
 */
public record FollowSets(List<FollowSet> sets, IntervalSet combined) {

    public static FollowSets of(List<FollowSet> sets) {
        var combined = new IntervalSet();
        for (var set : sets) {
            combined.addAll(set.intervals());
        }
        combined.setReadonly(true);
        return new FollowSets(List.copyOf(sets), combined);
    }

    /**
     * Whether the rule can match the given token first, or can be passed without consuming anything.
     */
    public boolean admits(int tokenType) {
        return combined.contains(Token.EPSILON) || combined.contains(tokenType);
    }
}
