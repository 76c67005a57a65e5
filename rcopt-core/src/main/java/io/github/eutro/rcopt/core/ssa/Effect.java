package io.github.eutro.rcopt.core.ssa;

import io.github.eutro.rcopt.core.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An effect instruction: an {@link Insn instruction} placed in a {@link BasicBlock},
 * together with the variables its results are assigned to.
 * <p>
 * An effect may assign any number of variables. An instruction producing a pair of
 * results, for example, assigns two.
 */
public final class Effect extends DelegatingExtHolder {
    private final List<Var> assignsTo;
    private Insn insn;

    Effect(List<Var> assignsTo, Insn insn) {
        this.assignsTo = new ArrayList<>(assignsTo);
        for (Var var : this.assignsTo) {
            var.attachExt(CommonExts.ASSIGNED_AT, this);
        }
        setInsn(insn);
    }

    @Override
    protected ExtContainer getDelegate() {
        return insn;
    }

    @Override
    public String toString() {
        if (assignsTo.isEmpty()) return insn.toString();
        return assignsTo.stream()
                .map(Objects::toString)
                .collect(Collectors.joining(", ", "", " = ")) + insn;
    }

    /**
     * Get the variables this effect assigns to, in result order.
     *
     * @return The unmodifiable list of variables.
     */
    public List<Var> getAssignsTo() {
        return Collections.unmodifiableList(assignsTo);
    }

    /**
     * Get the {@link Insn underlying instruction} of this effect.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }

    /**
     * Set the {@link Insn underlying instruction} of this effect.
     *
     * @param insn The instruction.
     */
    public void setInsn(Insn insn) {
        insn.attachExt(CommonExts.OWNING_EFFECT, this);
        this.insn = insn;
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
