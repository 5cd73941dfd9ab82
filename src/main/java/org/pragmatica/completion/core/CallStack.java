package org.pragmatica.completion.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Immutable stack of rule invocations.
 *
 * <p>Pushing returns a new stack sharing the frames below, so branches of the walk never see each
 * other's frames. Hash code is computed once per node.
 */
public final class CallStack {
    private static final CallStack EMPTY = new CallStack(null, null, 0, 1);

    private final RuleFrame top;
    private final CallStack below;
    private final int depth;
    private final int hash;

    private CallStack(RuleFrame top, CallStack below, int depth, int hash) {
        this.top = top;
        this.below = below;
        this.depth = depth;
        this.hash = hash;
    }

    public static CallStack empty() {
        return EMPTY;
    }

    public CallStack push(RuleFrame frame) {
        return new CallStack(frame, this, depth + 1, 31 * hash + frame.hashCode());
    }

    public boolean isEmpty() {
        return depth == 0;
    }

    public int depth() {
        return depth;
    }

    /**
     * The innermost frame.
     *
     * @throws NoSuchElementException if the stack is empty
     */
    public RuleFrame top() {
        if (isEmpty()) {
            throw new NoSuchElementException("Call stack is empty");
        }
        return top;
    }

    /**
     * Frames from the outermost invocation to the innermost one.
     */
    public List<RuleFrame> frames() {
        var result = new ArrayList<RuleFrame>(depth);
        for (var node = this; !node.isEmpty(); node = node.below) {
            result.add(node.top);
        }
        Collections.reverse(result);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CallStack other) || depth != other.depth || hash != other.hash) {
            return false;
        }
        var left = this;
        var right = other;
        while (left != right) {
            if (!left.top.equals(right.top)) {
                return false;
            }
            left = left.below;
            right = right.below;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return frames().toString();
    }
}
