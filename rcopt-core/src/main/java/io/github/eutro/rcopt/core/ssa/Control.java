package io.github.eutro.rcopt.core.ssa;

import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.ext.Ext;
import io.github.eutro.rcopt.core.ext.ExtHolder;
import io.github.eutro.rcopt.core.ops.CommonOps;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A control instruction, ending a {@link BasicBlock}: a raw {@link Insn instruction} and its jump targets.
 * <p>
 * A control instruction with no targets leaves the function.
 */
public final class Control extends ExtHolder {
    private Insn insn;
    /**
     * The jump targets. What the order means depends on the instruction.
     */
    public final List<BasicBlock> targets;

    Control(Insn insn, List<BasicBlock> targets) {
        setInsn(insn);
        this.targets = targets;
    }

    /**
     * Construct an unconditional jump.
     *
     * @param target The block to jump to.
     * @return The control instruction.
     */
    public static Control br(BasicBlock target) {
        return CommonOps.BR.insn().jumpsTo(target);
    }

    /**
     * Whether this instruction leaves the function.
     *
     * @return Whether there are no jump targets.
     */
    public boolean isExit() {
        return targets.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(insn);
        if (!targets.isEmpty()) {
            sb.append(" ->");
            for (BasicBlock target : targets) {
                sb.append(' ').append(target.toTargetString());
            }
        }
        return sb.toString();
    }

    /**
     * Get the {@link Insn underlying instruction}.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }

    /**
     * Set the {@link Insn underlying instruction}.
     *
     * @param insn The instruction.
     */
    public void setInsn(Insn insn) {
        insn.attachExt(CommonExts.OWNING_CONTROL, this);
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
