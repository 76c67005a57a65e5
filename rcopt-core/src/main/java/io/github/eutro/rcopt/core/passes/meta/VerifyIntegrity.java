package io.github.eutro.rcopt.core.passes.meta;

import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.ext.MetadataState;
import io.github.eutro.rcopt.core.passes.InPlaceIRPass;
import io.github.eutro.rcopt.core.ssa.*;

import java.util.HashSet;
import java.util.Set;

/**
 * A debugging pass which checks that a function is well-formed, throwing
 * an {@link IllegalStateException} describing the first problem found.
 */
public class VerifyIntegrity implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final VerifyIntegrity INSTANCE = new VerifyIntegrity();

    @Override
    public void runInPlace(Function function) {
        Set<BasicBlock> blockSet = new HashSet<>(function.blocks);
        if (blockSet.size() != function.blocks.size()) {
            throw new IllegalStateException("function contains duplicate blocks");
        }

        MetadataState ms = function.getExtOrThrow(CommonExts.METADATA_STATE);
        boolean checkUses = ms.isValid(MetadataState.USES);
        for (BasicBlock block : function.blocks) {
            if (block.getControl() == null) {
                throw new IllegalStateException(String.format(
                        "block has no control instruction\n  block: %s",
                        block.toTargetString()));
            }

            for (Effect effect : block.getEffects()) {
                if (effect.getNullable(CommonExts.OWNING_BLOCK) != block) {
                    throw new IllegalStateException(String.format(
                            "effect not owned by block\n  effect: %s\n  block: %s",
                            effect,
                            block));
                }
                checkArgs(blockSet, block, effect.insn(), checkUses);
            }
            Control control = block.getControl();
            if (control.getNullable(CommonExts.OWNING_BLOCK) != block) {
                throw new IllegalStateException(String.format(
                        "control not owned by block\n  control: %s\n  block: %s",
                        control,
                        block));
            }
            checkArgs(blockSet, block, control.insn(), checkUses);

            for (BasicBlock target : control.targets) {
                if (!blockSet.contains(target)) {
                    throw new IllegalStateException(String.format(
                            "instruction references block not in function" +
                                    "\n  referenced: %s" +
                                    "\n  instruction: %s" +
                                    "\n  in block: %s",
                            target.toTargetString(),
                            control,
                            block));
                }
            }
        }
    }

    private static void checkArgs(Set<BasicBlock> blockSet, BasicBlock block, Insn insn, boolean checkUses) {
        for (Var arg : insn.args()) {
            Effect def = arg.getNullable(CommonExts.ASSIGNED_AT);
            if (def == null || !blockSet.contains(def.getNullable(CommonExts.OWNING_BLOCK))) {
                throw new IllegalStateException(String.format(
                        "instruction uses variable not assigned in function" +
                                "\n  variable: %s" +
                                "\n  instruction: %s" +
                                "\n  in block: %s",
                        arg,
                        insn,
                        block));
            }
            if (checkUses) {
                Set<Insn> uses = arg.getNullable(CommonExts.USED_AT);
                if (uses == null || !uses.contains(insn)) {
                    throw new IllegalStateException(String.format(
                            "use not recorded" +
                                    "\n  variable: %s" +
                                    "\n  instruction: %s" +
                                    "\n  in block: %s",
                            arg,
                            insn,
                            block));
                }
            }
        }
    }
}
