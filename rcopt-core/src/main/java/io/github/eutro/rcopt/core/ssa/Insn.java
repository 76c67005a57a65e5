package io.github.eutro.rcopt.core.ssa;

import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.ext.DelegatingExtHolder;
import io.github.eutro.rcopt.core.ext.Ext;
import io.github.eutro.rcopt.core.ext.ExtContainer;
import io.github.eutro.rcopt.core.ops.Op;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A raw instruction: an {@link Op operation} applied to argument {@link Var variables}.
 * <p>
 * An instruction is placed in a block by wrapping it in an {@link Effect} or a {@link Control}.
 * Exts not attached to the instruction itself are looked up on its operation.
 */
public final class Insn extends DelegatingExtHolder implements Iterable<Var> {
    /**
     * Whether to record where each instruction was constructed, for debugging.
     */
    public static boolean TRACK_INSN_CREATIONS = System.getenv("RCOPT_TRACK_INSN_CREATIONS") != null;

    /**
     * Where this instruction was constructed, if {@link #TRACK_INSN_CREATIONS} is set.
     */
    public final Throwable created = TRACK_INSN_CREATIONS ? new Throwable("constructed") : null;

    /**
     * The operation of this instruction.
     */
    public Op op;
    private final List<Var> args;

    /**
     * Construct an instruction.
     *
     * @param op   The operation.
     * @param args The arguments, which are copied.
     */
    public Insn(Op op, List<Var> args) {
        this.op = op;
        this.args = new ArrayList<>(args);
    }

    /**
     * Construct an instruction.
     *
     * @param op   The operation.
     * @param args The arguments.
     */
    public Insn(Op op, Var... args) {
        this(op, Arrays.asList(args));
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }

    /**
     * Get the mutable list of arguments of this instruction.
     * <p>
     * Replacing an argument does not update {@link CommonExts#USED_AT};
     * see {@link io.github.eutro.rcopt.core.util.IRUtils#replaceAllUsesWith(Var, Var)}.
     *
     * @return The arguments.
     */
    public List<Var> args() {
        return args;
    }

    /**
     * Create an effect assigning the results of this instruction to the given variables.
     *
     * @param vars The variables, possibly none.
     * @return The effect.
     */
    public Effect assignTo(Var... vars) {
        return assignTo(Arrays.asList(vars));
    }

    /**
     * Create an effect assigning the results of this instruction to the given variables.
     *
     * @param vars The variables, possibly none.
     * @return The effect.
     */
    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    /**
     * Create a control instruction jumping to the given targets.
     *
     * @param targets The targets, possibly none.
     * @return The control instruction.
     */
    public Control jumpsTo(BasicBlock... targets) {
        return new Control(this, new ArrayList<>(Arrays.asList(targets)));
    }

    @NotNull
    @Override
    public Iterator<Var> iterator() {
        return args.iterator();
    }

    // exts
    private Object owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT) {
            return owner instanceof Effect ? (T) owner : null;
        }
        if (ext == CommonExts.OWNING_CONTROL) {
            return owner instanceof Control ? (T) owner : null;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
