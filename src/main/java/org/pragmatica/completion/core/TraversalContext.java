package org.pragmatica.completion.core;

import org.pragmatica.completion.input.TokenWindow;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one candidate collection: memo tables, precedence stack and the candidates
 * found so far. Never shared between calls.
 */
public final class TraversalContext {
    private final TokenWindow window;
    private final CompletionConfig config;

    // Rule end positions keyed by (rule, position)
    private final Map<Long, Set<Integer>> ruleEnds = new HashMap<>();
    private final Set<Long> inProgress = new HashSet<>();
    private final Set<VisitKey> visited = new HashSet<>();
    private final Deque<Integer> precedenceStack = new ArrayDeque<>();

    private final Map<Integer, List<Integer>> tokens = new LinkedHashMap<>();
    private final Map<Integer, CandidateRule> rules = new LinkedHashMap<>();

    private int statesProcessed;

    private TraversalContext(TokenWindow window, CompletionConfig config) {
        this.window = window;
        this.config = config;
    }

    public static TraversalContext create(TokenWindow window, CompletionConfig config) {
        return new TraversalContext(window, config);
    }

    public TokenWindow window() {
        return window;
    }

    public CompletionConfig config() {
        return config;
    }

    // === Rule Memo ===

    public Set<Integer> cachedEnds(int ruleIndex, int position) {
        return ruleEnds.get(key(ruleIndex, position));
    }

    public void cacheEnds(int ruleIndex, int position, Set<Integer> ends) {
        ruleEnds.put(key(ruleIndex, position), Set.copyOf(ends));
    }

    /**
     * Mark the rule as being expanded at the position.
     *
     * @return false if it already is, i.e. the walk came back to it without consuming input
     */
    public boolean enterRule(int ruleIndex, int position) {
        return inProgress.add(key(ruleIndex, position));
    }

    public void exitRule(int ruleIndex, int position) {
        inProgress.remove(key(ruleIndex, position));
    }

    /**
     * Mark a state as expanded for the given position, call stack and precedence.
     *
     * @return false if it was expanded before
     */
    public boolean markVisited(int stateNumber, int position, CallStack callStack) {
        return visited.add(new VisitKey(stateNumber, position, callStack, currentPrecedence()));
    }

    private static long key(int ruleIndex, int position) {
        return ((long) ruleIndex << 32) | (position & 0xFFFFFFFFL);
    }

    private record VisitKey(int stateNumber, int position, CallStack callStack, int precedence) {}

    // === Precedence ===

    public void pushPrecedence(int precedence) {
        precedenceStack.push(precedence);
    }

    public void popPrecedence() {
        precedenceStack.pop();
    }

    public int currentPrecedence() {
        var top = precedenceStack.peek();
        return top == null ? 0 : top;
    }

    // === Statistics ===

    public void stateProcessed() {
        statesProcessed++;
    }

    public int statesProcessed() {
        return statesProcessed;
    }

    // === Candidates ===

    /**
     * Record a token candidate. A token reached again with a different follow chain keeps an empty chain.
     */
    public void recordToken(int tokenType, List<Integer> following) {
        if (config.isIgnored(tokenType)) {
            return;
        }
        var existing = tokens.get(tokenType);
        if (existing == null) {
            tokens.put(tokenType, List.copyOf(following));
        } else if (!existing.equals(following)) {
            tokens.put(tokenType, List.of());
        }
    }

    /**
     * Turn the call stack into a rule candidate if it holds a preferred rule.
     *
     * <p>Frames are scanned from the outermost one, or from the innermost one when rules are translated
     * top-down. The first preferred rule found is the candidate; the frames outside of it form its rule list.
     *
     * @return true if a preferred rule was found, in which case the caller must not expand the stack into tokens
     */
    public boolean translateStack(List<RuleFrame> frames) {
        if (config.preferredRules().isEmpty()) {
            return false;
        }
        var topDown = config.translateRulesTopDown();
        for (int n = 0; n < frames.size(); n++) {
            var i = topDown ? frames.size() - 1 - n : n;
            var frame = frames.get(i);
            if (config.isPreferred(frame.ruleIndex())) {
                var ruleList = frames.subList(0, i)
                                     .stream()
                                     .map(RuleFrame::ruleIndex)
                                     .toList();
                recordRule(frame.ruleIndex(), new CandidateRule(frame.startTokenIndex(), ruleList));
                return true;
            }
        }
        return false;
    }

    /**
     * Bottom-up keeps the first candidate recorded for a rule. Top-down keeps the most specific one:
     * the one starting closest to the caret, and on equal starts the one with the deeper rule list.
     */
    private void recordRule(int ruleIndex, CandidateRule candidate) {
        var existing = rules.get(ruleIndex);
        if (existing == null || config.translateRulesTopDown() && isMoreSpecific(candidate, existing)) {
            rules.put(ruleIndex, candidate);
        }
    }

    private static boolean isMoreSpecific(CandidateRule candidate, CandidateRule existing) {
        if (candidate.startTokenIndex() != existing.startTokenIndex()) {
            return candidate.startTokenIndex() > existing.startTokenIndex();
        }
        return candidate.ruleList().size() > existing.ruleList().size();
    }

    public int tokenCount() {
        return tokens.size();
    }

    public int ruleCount() {
        return rules.size();
    }

    public CandidatesCollection toCandidates() {
        if (tokens.isEmpty() && rules.isEmpty()) {
            return CandidatesCollection.EMPTY;
        }
        return new CandidatesCollection(tokens, rules);
    }
}
