package se.kth.widen.expand;

import java.util.Objects;

/** How many lines a conflict region should be widened by on each side. */
public class ExpansionDecision {
    public static final ExpansionDecision NONE = new ExpansionDecision(0, 0);

    private final int expandBefore;
    private final int expandAfter;

    private ExpansionDecision(int expandBefore, int expandAfter) {
        this.expandBefore = expandBefore;
        this.expandAfter = expandAfter;
    }

    /**
     * Compute the widening needed for a conflict occupying {@code conflictSpan} to cover {@code
     * nodeSpan}. Both spans are in lines of the same resolved text. Negative deltas are clamped to
     * zero.
     */
    public static ExpansionDecision between(LineSpan conflictSpan, LineSpan nodeSpan) {
        int before = Math.max(0, conflictSpan.getStartLine() - nodeSpan.getStartLine());
        int after = Math.max(0, nodeSpan.getEndLine() - conflictSpan.getEndLine());
        return before == 0 && after == 0 ? NONE : new ExpansionDecision(before, after);
    }

    public int getExpandBefore() {
        return expandBefore;
    }

    public int getExpandAfter() {
        return expandAfter;
    }

    public boolean isNone() {
        return expandBefore == 0 && expandAfter == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExpansionDecision that = (ExpansionDecision) o;
        return expandBefore == that.expandBefore && expandAfter == that.expandAfter;
    }

    @Override
    public int hashCode() {
        return Objects.hash(expandBefore, expandAfter);
    }

    @Override
    public String toString() {
        return "ExpansionDecision(before=" + expandBefore + ", after=" + expandAfter + ")";
    }
}
