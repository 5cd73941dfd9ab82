package org.pragmatica.completion.atn;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.atn.ATNState;
import org.antlr.v4.runtime.atn.PredicateTransition;
import org.antlr.v4.runtime.atn.RuleTransition;
import org.antlr.v4.runtime.atn.Transition;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.pragmatica.completion.error.CompletionError;
import org.pragmatica.completion.error.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computes, per rule start state, which tokens can be matched first when the rule is entered.
 *
 * <p>This is essentially the LL(1) closure of the ANTLR runtime, but predicates are evaluated,
 * no parser context is involved and the rule path leading to each token is kept so that tokens
 * can be translated into preferred rules later. An entered rule that can match nothing continues
 * at its follow state; only the end of the analyzed rule itself yields {@code Token.EPSILON}.
 * Results only depend on the grammar and are cached per start state; the cache is safe for
 * concurrent use.
 */
public final class FollowSetAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(FollowSetAnalyzer.class);

    private final AtnView atn;
    private final Map<Integer, FollowSets> cache = new ConcurrentHashMap<>();

    private FollowSetAnalyzer(AtnView atn) {
        this.atn = atn;
    }

    public static FollowSetAnalyzer create(AtnView atn) {
        return new FollowSetAnalyzer(atn);
    }

    /**
     * Follow sets for the rule starting at the given state.
     */
    public FollowSets followSets(ATNState ruleStart) {
        var cached = cache.get(ruleStart.stateNumber);
        if (cached != null) {
            return cached;
        }
        var computed = determine(ruleStart);
        var previous = cache.putIfAbsent(ruleStart.stateNumber, computed);
        return previous != null ? previous : computed;
    }

    private FollowSets determine(ATNState ruleStart) {
        var stop = atn.ruleStop(atn.ruleOf(ruleStart));
        var sets = new ArrayList<FollowSet>();
        collect(ruleStart, stop, sets, new HashSet<>(), new ArrayList<>(), new ArrayList<>());

        var result = FollowSets.of(sets);
        log.trace("Follow sets for rule {}: {} paths, combined {}",
                  atn.ruleName(atn.ruleOf(ruleStart)), sets.size(), result.combined());
        return result;
    }

    /**
     * Collect the follow sets reachable from a state.
     *
     * @param ruleStack    rules entered since the analyzed rule, outermost first
     * @param followStack  states to resume at when the entered rules end, parallel to {@code ruleStack}
     */
    private void collect(ATNState state,
                         ATNState stop,
                         List<FollowSet> sets,
                         Set<SeenKey> seen,
                         List<Integer> ruleStack,
                         List<ATNState> followStack) {
        if (!seen.add(new SeenKey(state, List.copyOf(followStack)))) {
            return;
        }

        if (state == stop && followStack.isEmpty()) {
            sets.add(new FollowSet(IntervalSet.of(Token.EPSILON), ruleStack, Optional.empty()));
            return;
        }

        if (state.getStateType() == ATNState.RULE_STOP) {
            resumeAfterRule(stop, sets, seen, ruleStack, followStack);
            return;
        }

        for (var transition : atn.transitionsOf(state)) {
            var kind = TransitionKind.of(transition);
            switch (kind) {
                case RULE -> enterRule((RuleTransition) transition, stop, sets, seen, ruleStack, followStack);
                case PREDICATE -> {
                    if (atn.evaluate((PredicateTransition) transition)) {
                        collect(transition.target, stop, sets, seen, ruleStack, followStack);
                    }
                }
                case EPSILON, PRECEDENCE -> collect(transition.target, stop, sets, seen, ruleStack, followStack);
                case WILDCARD -> sets.add(new FollowSet(atn.userTokens(), ruleStack, Optional.empty()));
                case ATOM, SET, NOT_SET -> {
                    var label = atn.tokensOf(transition, kind);
                    if (label != null && label.size() > 0) {
                        sets.add(new FollowSet(label, ruleStack, Optional.of(transition)));
                    }
                }
            }
        }
    }

    private void enterRule(RuleTransition transition,
                           ATNState stop,
                           List<FollowSet> sets,
                           Set<SeenKey> seen,
                           List<Integer> ruleStack,
                           List<ATNState> followStack) {
        var invoked = atn.ruleOf(transition.target);
        // A rule already on the path would only repeat what is collected already.
        if (ruleStack.contains(invoked)) {
            return;
        }
        ruleStack.add(invoked);
        followStack.add(transition.followState);
        collect(transition.target, stop, sets, seen, ruleStack, followStack);
        followStack.remove(followStack.size() - 1);
        ruleStack.remove(ruleStack.size() - 1);
    }

    /**
     * An entered rule can end without consuming input: go on where it was invoked.
     */
    private void resumeAfterRule(ATNState stop,
                                 List<FollowSet> sets,
                                 Set<SeenKey> seen,
                                 List<Integer> ruleStack,
                                 List<ATNState> followStack) {
        if (followStack.isEmpty()) {
            throw new CompletionException(new CompletionError.MalformedAtn(
                "rule stop state reached outside of rule " + atn.ruleName(atn.ruleOf(stop))));
        }
        var last = followStack.size() - 1;
        var followState = followStack.remove(last);
        var rule = ruleStack.remove(last);

        collect(followState, stop, sets, seen, ruleStack, followStack);

        ruleStack.add(rule);
        followStack.add(followState);
    }

    private record SeenKey(ATNState state, List<ATNState> followStack) {}

    /**
     * Tokens that must literally follow the given transition within its rule.
     *
     * <p>Single-token transitions are chained as long as each state offers exactly one way on.
     * Ignored tokens are not added to the chain but do not end it. The chain ends at rule
     * invocations, decisions, multi-token sets and the rule end.
     */
    public List<Integer> followingTokens(Transition transition, Set<Integer> ignoredTokens) {
        var result = new ArrayList<Integer>();
        var visited = new HashSet<ATNState>();
        var pending = new ArrayDeque<ATNState>();
        pending.push(transition.target);

        while (!pending.isEmpty()) {
            var state = pending.pop();
            if (!visited.add(state) || state.getNumberOfTransitions() != 1) {
                continue;
            }

            var next = state.transition(0);
            if (TransitionKind.of(next) != TransitionKind.ATOM) {
                continue;
            }
            var symbols = next.label().toList();
            if (symbols.size() != 1) {
                continue;
            }
            var symbol = symbols.get(0);
            if (!ignoredTokens.contains(symbol)) {
                result.add(symbol);
            }
            pending.push(next.target);
        }
        return List.copyOf(result);
    }
}
