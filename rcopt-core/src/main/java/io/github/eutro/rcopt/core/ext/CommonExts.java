package io.github.eutro.rcopt.core.ext;

import io.github.eutro.rcopt.core.ops.Op;
import io.github.eutro.rcopt.core.ops.OpKey;
import io.github.eutro.rcopt.core.passes.meta.ComputePostDoms;
import io.github.eutro.rcopt.core.passes.meta.ComputeUses;
import io.github.eutro.rcopt.core.ssa.*;

import java.util.Set;

/**
 * {@link Ext}s of the IR itself, independent of any particular optimisation.
 */
public class CommonExts {
    /**
     * Attached to a {@link Function}. Which analysis results of the function are up to date.
     *
     * @see MetadataState
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * Attached to a {@link BasicBlock}. Its immediate post-dominator, absent if that is the
     * function exit, or if the block cannot reach an exit at all.
     * <p>
     * Computed by {@link ComputePostDoms}.
     */
    public static final Ext<BasicBlock> IPDOM = Ext.create(BasicBlock.class, "IPDOM");

    /**
     * Attached to an {@link Insn}, {@link Op} or {@link OpKey}.
     * Whether the instruction has no side effects. Absent means it may have some.
     */
    public static final Ext<Boolean> IS_PURE = Ext.create(Boolean.class, "IS_PURE");

    /**
     * Attached to a {@link Var}. The {@link Effect} that assigns it.
     */
    public static final Ext<Effect> ASSIGNED_AT = Ext.create(Effect.class, "ASSIGNED_AT");
    /**
     * Attached to a {@link Var}, computed by {@link ComputeUses}. The instructions that use the variable.
     */
    public static final Ext<Set<Insn>> USED_AT = Ext.create(Set.class, "USED_AT");

    /**
     * Attached to a {@link BasicBlock}. The function the block is in.
     */
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    /**
     * Attached to an {@link Effect} or {@link Control}. The block the instruction is in.
     */
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");
    /**
     * Attached to an {@link Insn}. The control instruction wrapping it, if any.
     */
    public static final Ext<Control> OWNING_CONTROL = Ext.create(Control.class, "OWNING_CONTROL");
    /**
     * Attached to an {@link Insn}. The effect instruction wrapping it, if any.
     */
    public static final Ext<Effect> OWNING_EFFECT = Ext.create(Effect.class, "OWNING_EFFECT");

    /**
     * Mark something as pure, by attaching {@link #IS_PURE} {@code = true} to it.
     *
     * @param t   The thing to mark.
     * @param <T> The type of {@code t}.
     * @return {@code t}.
     */
    public static <T extends ExtContainer> T markPure(T t) {
        t.attachExt(IS_PURE, true);
        return t;
    }
}
