package org.pragmatica.completion.atn;

import org.antlr.v4.runtime.atn.Transition;
import org.pragmatica.completion.error.CompletionError;
import org.pragmatica.completion.error.CompletionException;

/**
 * ATN transition kinds as seen by the completion walk.
 *
 * <p>Action transitions consume nothing and are folded into {@link #EPSILON}; range
 * transitions match a contiguous token set and are folded into {@link #SET}.
 */
public enum TransitionKind {
    EPSILON,
    PREDICATE,
    PRECEDENCE,
    RULE,
    ATOM,
    SET,
    NOT_SET,
    WILDCARD;

    public static TransitionKind of(Transition transition) {
        return switch (transition.getSerializationType()) {
            case Transition.EPSILON, Transition.ACTION -> EPSILON;
            case Transition.PREDICATE -> PREDICATE;
            case Transition.PRECEDENCE -> PRECEDENCE;
            case Transition.RULE -> RULE;
            case Transition.ATOM -> ATOM;
            case Transition.RANGE, Transition.SET -> SET;
            case Transition.NOT_SET -> NOT_SET;
            case Transition.WILDCARD -> WILDCARD;
            default -> throw new CompletionException(new CompletionError.MalformedAtn(
                "unsupported transition type " + transition.getSerializationType()));
        };
    }
}
