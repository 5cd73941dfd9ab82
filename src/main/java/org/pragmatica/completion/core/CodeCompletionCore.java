package org.pragmatica.completion.core;

import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.atn.ATNState;
import org.antlr.v4.runtime.atn.PrecedencePredicateTransition;
import org.antlr.v4.runtime.atn.PredicateTransition;
import org.antlr.v4.runtime.atn.RuleStartState;
import org.antlr.v4.runtime.atn.RuleTransition;
import org.antlr.v4.runtime.atn.Transition;
import org.pragmatica.completion.atn.AtnView;
import org.pragmatica.completion.atn.FollowSetAnalyzer;
import org.pragmatica.completion.atn.FollowSets;
import org.pragmatica.completion.atn.TransitionKind;
import org.pragmatica.completion.input.TokenStreamView;
import org.pragmatica.completion.input.TokenWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Candidate collection engine - walks the parser ATN along the real input up to the caret and
 * collects every token and preferred rule that could continue the input there.
 *
 * <p>Each rule is walked on its own: a pipeline of (state, token position) entries is drained,
 * token transitions advance only when the real token matches and rule transitions recurse, resuming
 * at the follow state for every position the invoked rule can end at. Once a path reaches the caret,
 * the walk stops advancing and records what the transitions there would match instead.
 */
public final class CodeCompletionCore implements CompletionEngine {
    private static final Logger log = LoggerFactory.getLogger(CodeCompletionCore.class);

    private final Parser parser;
    private final AtnView atn;
    private final FollowSetAnalyzer followSets;
    private volatile CompletionConfig config;

    private CodeCompletionCore(Parser parser, AtnView atn, CompletionConfig config) {
        this.parser = parser;
        this.atn = atn;
        this.followSets = FollowSetAnalyzer.create(atn);
        this.config = config;
    }

    public static CodeCompletionCore create(Parser parser, CompletionConfig config) {
        return new CodeCompletionCore(parser, AtnView.of(parser), config);
    }

    // === Configuration ===

    @Override
    public CompletionConfig config() {
        return config;
    }

    @Override
    public void configure(CompletionConfig config) {
        this.config = config;
    }

    public void setIgnoredTokens(Set<Integer> ignoredTokens) {
        config = config.withIgnoredTokens(ignoredTokens);
    }

    public void setPreferredRules(Set<Integer> preferredRules) {
        config = config.withPreferredRules(preferredRules);
    }

    public void setTranslateRulesTopDown(boolean translateRulesTopDown) {
        config = config.withTranslateRulesTopDown(translateRulesTopDown);
    }

    // === Collection ===

    @Override
    public CandidatesCollection collectCandidates(int caretTokenIndex) {
        return collect(caretTokenIndex, config.entryRule(), 0);
    }

    @Override
    public CandidatesCollection collectCandidates(int caretTokenIndex, ParserRuleContext context) {
        if (context == null) {
            return collectCandidates(caretTokenIndex);
        }
        var startTokenIndex = context.start == null ? 0 : context.start.getTokenIndex();
        return collect(caretTokenIndex, context.getRuleIndex(), startTokenIndex);
    }

    private CandidatesCollection collect(int caretTokenIndex, int startRule, int startTokenIndex) {
        var snapshot = config;
        var ruleStart = atn.ruleStart(startRule);
        var window = TokenWindow.collect(TokenStreamView.of(parser.getInputStream()),
                                         startTokenIndex,
                                         caretTokenIndex);
        var ctx = TraversalContext.create(window, snapshot);

        processRule(ctx, ruleStart, 0, CallStack.empty(), 0, RuleFrame.NO_RETURN_STATE);

        var result = ctx.toCandidates();
        log.debug("Collected {} tokens and {} rules at token {} from rule {} ({} window tokens, {} states processed)",
                  ctx.tokenCount(), ctx.ruleCount(), window.caretTokenIndex(), atn.ruleName(startRule),
                  window.size(), ctx.statesProcessed());
        if (log.isDebugEnabled() && !result.isEmpty()) {
            log.debug("Candidates: {}", describe(result));
        }
        return result;
    }

    /**
     * Walk a single rule from the given window position.
     *
     * @return window positions at which the rule can end; empty if no path gets past the caret
     */
    private Set<Integer> processRule(TraversalContext ctx,
                                     RuleStartState startState,
                                     int position,
                                     CallStack callStack,
                                     int precedence,
                                     int returnState) {
        var ruleIndex = atn.ruleOf(startState);
        var cached = ctx.cachedEnds(ruleIndex, position);
        if (cached != null) {
            log.trace("Rule {} at {}: already walked, ends {}", atn.ruleName(ruleIndex), position, cached);
            return cached;
        }
        if (!ctx.enterRule(ruleIndex, position)) {
            log.trace("Rule {} at {}: re-entered without consuming input", atn.ruleName(ruleIndex), position);
            return Set.of();
        }
        try {
            return walkRule(ctx, startState, ruleIndex, position, callStack, precedence, returnState);
        } finally {
            ctx.exitRule(ruleIndex, position);
        }
    }

    private Set<Integer> walkRule(TraversalContext ctx,
                                  RuleStartState startState,
                                  int ruleIndex,
                                  int position,
                                  CallStack callStack,
                                  int precedence,
                                  int returnState) {
        var window = ctx.window();
        var sets = followSets.followSets(startState);
        var stack = callStack.push(new RuleFrame(ruleIndex, window.streamIndexAt(position), returnState));

        log.trace("Entering rule {} at {} (depth {})", atn.ruleName(ruleIndex), position, stack.depth());

        if (window.isAtCaret(position)) {
            collectAtRuleEntry(ctx, ruleIndex, sets, stack);
            // A rule that can match nothing also ends right here; the caller goes on past it.
            return !ctx.config().isPreferred(ruleIndex) && sets.combined().contains(Token.EPSILON)
                   ? Set.of(position)
                   : Set.of();
        }
        if (!sets.admits(window.typeAt(position))) {
            return Set.of();
        }

        if (startState.isLeftRecursiveRule) {
            ctx.pushPrecedence(precedence);
        }
        try {
            var ends = walkPipeline(ctx, startState, position, stack);
            ctx.cacheEnds(ruleIndex, position, ends);
            return ends;
        } finally {
            if (startState.isLeftRecursiveRule) {
                ctx.popPrecedence();
            }
        }
    }

    private Set<Integer> walkPipeline(TraversalContext ctx, ATNState startState, int position, CallStack stack) {
        var window = ctx.window();
        var ends = new HashSet<Integer>();
        var pipeline = new ArrayDeque<PipelineEntry>();
        pipeline.push(new PipelineEntry(startState, position));

        while (!pipeline.isEmpty()) {
            var entry = pipeline.pop();
            if (!ctx.markVisited(entry.state().stateNumber, entry.position(), stack)) {
                continue;
            }
            ctx.stateProcessed();

            if (entry.state().getStateType() == ATNState.RULE_STOP) {
                ends.add(entry.position());
                continue;
            }

            var atCaret = window.isAtCaret(entry.position());
            for (var transition : atn.transitionsOf(entry.state())) {
                var kind = TransitionKind.of(transition);
                switch (kind) {
                    case RULE -> {
                        var ruleTransition = (RuleTransition) transition;
                        var invokedEnds = processRule(ctx,
                                                      (RuleStartState) ruleTransition.target,
                                                      entry.position(),
                                                      stack,
                                                      ruleTransition.precedence,
                                                      ruleTransition.followState.stateNumber);
                        for (var end : invokedEnds) {
                            pipeline.push(new PipelineEntry(ruleTransition.followState, end));
                        }
                    }
                    case PREDICATE -> {
                        if (atn.evaluate((PredicateTransition) transition)) {
                            pipeline.push(new PipelineEntry(transition.target, entry.position()));
                        }
                    }
                    case PRECEDENCE -> {
                        if (((PrecedencePredicateTransition) transition).precedence >= ctx.currentPrecedence()) {
                            pipeline.push(new PipelineEntry(transition.target, entry.position()));
                        }
                    }
                    case EPSILON -> pipeline.push(new PipelineEntry(transition.target, entry.position()));
                    case WILDCARD -> {
                        if (!atCaret) {
                            pipeline.push(new PipelineEntry(transition.target, entry.position() + 1));
                        } else if (!ctx.translateStack(stack.frames())) {
                            for (var symbol : atn.userTokens().toList()) {
                                ctx.recordToken(symbol, List.of());
                            }
                        }
                    }
                    case ATOM, SET, NOT_SET -> {
                        var symbols = atn.tokensOf(transition, kind);
                        if (symbols == null || symbols.isNil()) {
                            continue;
                        }
                        if (atCaret) {
                            collectAtToken(ctx, transition, symbols.toList(), stack);
                        } else if (symbols.contains(window.typeAt(entry.position()))) {
                            pipeline.push(new PipelineEntry(transition.target, entry.position() + 1));
                        }
                    }
                }
            }
        }
        return ends;
    }

    // === Caret handling ===

    private void collectAtRuleEntry(TraversalContext ctx, int ruleIndex, FollowSets sets, CallStack stack) {
        if (ctx.config().isPreferred(ruleIndex)) {
            ctx.translateStack(stack.frames());
            return;
        }

        var frames = stack.frames();
        var startTokenIndex = stack.top().startTokenIndex();
        for (var set : sets.sets()) {
            var fullPath = new ArrayList<>(frames);
            for (var rule : set.path()) {
                fullPath.add(new RuleFrame(rule, startTokenIndex, RuleFrame.NO_RETURN_STATE));
            }
            if (ctx.translateStack(fullPath)) {
                continue;
            }
            var following = set.origin()
                               .map(origin -> followSets.followingTokens(origin, ctx.config().ignoredTokens()))
                               .orElse(List.of());
            for (var symbol : set.intervals().toList()) {
                if (symbol != Token.EPSILON) {
                    ctx.recordToken(symbol, following);
                }
            }
        }
    }

    private void collectAtToken(TraversalContext ctx, Transition transition, List<Integer> symbols, CallStack stack) {
        if (ctx.translateStack(stack.frames())) {
            return;
        }
        var following = symbols.size() == 1
                        ? followSets.followingTokens(transition, ctx.config().ignoredTokens())
                        : List.<Integer>of();
        for (var symbol : symbols) {
            ctx.recordToken(symbol, following);
        }
    }

    private String describe(CandidatesCollection result) {
        var tokens = result.tokens()
                           .entrySet()
                           .stream()
                           .map(e -> atn.tokenName(e.getKey()) + e.getValue()
                                                                  .stream()
                                                                  .map(atn::tokenName)
                                                                  .collect(Collectors.joining(" ", " [", "]")))
                           .collect(Collectors.joining(", "));
        var rules = result.rules()
                          .entrySet()
                          .stream()
                          .map(e -> atn.ruleName(e.getKey()) + "@" + e.getValue().startTokenIndex())
                          .collect(Collectors.joining(", "));
        return "tokens {" + tokens + "}, rules {" + rules + "}";
    }

    private record PipelineEntry(ATNState state, int position) {}
}
