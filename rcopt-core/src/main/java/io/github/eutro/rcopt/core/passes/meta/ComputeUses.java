package io.github.eutro.rcopt.core.passes.meta;

import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.ext.MetadataState;
import io.github.eutro.rcopt.core.passes.InPlaceIRPass;
import io.github.eutro.rcopt.core.ssa.*;

import java.util.HashSet;
import java.util.Set;

/**
 * Compute the {@link CommonExts#USED_AT uses} of every {@link Var} in a function.
 * <p>
 * Every variable assigned or used in the function gets a (possibly empty) set.
 */
public class ComputeUses implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeUses INSTANCE = new ComputeUses();

    @Override
    public void runInPlace(Function func) {
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                for (Var var : effect.getAssignsTo()) {
                    var.attachExt(CommonExts.USED_AT, new HashSet<>());
                }
            }
        }
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                addUses(effect.insn());
            }
            addUses(block.getControl().insn());
        }

        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.validate(MetadataState.USES);
    }

    private static void addUses(Insn insn) {
        for (Var arg : insn.args()) {
            Set<Insn> uses = arg.getNullable(CommonExts.USED_AT);
            if (uses == null) {
                // not assigned in this function
                uses = new HashSet<>();
                arg.attachExt(CommonExts.USED_AT, uses);
            }
            uses.add(insn);
        }
    }
}
