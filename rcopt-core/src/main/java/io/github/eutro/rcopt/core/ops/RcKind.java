package io.github.eutro.rcopt.core.ops;

import io.github.eutro.rcopt.core.ext.RcExts;
import io.github.eutro.rcopt.core.ssa.Insn;

/**
 * The role an instruction plays for reference counting.
 */
public enum RcKind {
    /**
     * Increments a reference count.
     */
    RETAIN,
    /**
     * Decrements a reference count.
     */
    RELEASE,
    /**
     * Opens a guaranteed scope, producing a value and a token.
     */
    GUARANTEED_BEGIN,
    /**
     * Closes the guaranteed scope of its token.
     */
    GUARANTEED_END,
    /**
     * Projects one element out of a tuple.
     */
    EXTRACT,
    /**
     * Only records a value for debuggers.
     */
    DEBUG,
    /**
     * Calls, or partially applies, a function.
     */
    CALL,
    /**
     * Anything else.
     */
    OTHER,
    ;

    /**
     * Get the kind of an instruction.
     *
     * @param insn The instruction.
     * @return The kind, {@link #OTHER} if its operation has none.
     */
    public static RcKind of(Insn insn) {
        return insn.getExt(RcExts.RC_KIND).orElse(OTHER);
    }

    /**
     * Check the kind of an instruction.
     *
     * @param insn The instruction.
     * @return Whether the instruction is of this kind.
     */
    public boolean is(Insn insn) {
        return of(insn) == this;
    }
}
