package org.pragmatica.completion.atn;

import org.antlr.v4.runtime.atn.Transition;
import org.antlr.v4.runtime.misc.IntervalSet;

import java.util.List;
import java.util.Optional;

/**
 * Tokens reachable from a rule start along one path, without consuming input.
 *
 * @param intervals token types matched at the end of the path; {@code Token.EPSILON} if the path reaches a rule end
 * @param path      indexes of the rules entered along the path, outermost first, the analyzed rule excluded
 * @param origin    the token-consuming transition the path ends with, used to compute follow chains
 */
public record FollowSet(IntervalSet intervals, List<Integer> path, Optional<Transition> origin) {

    public FollowSet {
        path = List.copyOf(path);
    }
}
