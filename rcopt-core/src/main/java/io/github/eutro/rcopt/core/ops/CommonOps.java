package io.github.eutro.rcopt.core.ops;

import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.ext.RcExts;
import io.github.eutro.rcopt.core.ssa.Insn;

/**
 * {@link Op}s and {@link OpKey}s for control flow and plain values,
 * which say nothing about reference counting.
 */
public class CommonOps {
    /**
     * Control: an unconditional jump.
     */
    public static final Op BR = new SimpleOpKey("br").create();
    /**
     * Control: jumps to its first target if its argument is true, otherwise to its second.
     */
    public static final Op BR_IF = new SimpleOpKey("br_if").create();
    /**
     * Control: returns from the function.
     */
    public static final Op RETURN = new SimpleOpKey("return").create();
    /**
     * Control: traps with the given message, leaving the function.
     */
    public static final UnaryOpKey<String> TRAP = new UnaryOpKey<>("trap");

    /**
     * Effect: returns its argument.
     */
    public static final Op IDENTITY = new SimpleOpKey("id").create();
    /**
     * Effect: returns the {@code n}th argument of the function.
     */
    public static final UnaryOpKey<Integer> ARG = new UnaryOpKey<>("arg");
    /**
     * Effect: returns the constant.
     */
    public static final UnaryOpKey<Object> CONST = new UnaryOpKey<>("const").allowNull();

    static {
        for (OpKey key : new OpKey[]{
                IDENTITY.key,
                ARG,
                CONST,
        }) {
            CommonExts.markPure(key);
        }
        IDENTITY.key.attachExt(RcExts.IS_RC_IDENTITY_PRESERVING, true);
    }

    /**
     * Return a constant instruction which returns {@code k}.
     *
     * @param k The constant.
     * @return The instruction.
     */
    public static Insn constant(Object k) {
        return CONST.create(k).insn();
    }
}
