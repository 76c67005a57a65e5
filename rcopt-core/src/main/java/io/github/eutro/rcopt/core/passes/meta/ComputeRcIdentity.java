package io.github.eutro.rcopt.core.passes.meta;

import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.ext.MetadataState;
import io.github.eutro.rcopt.core.ext.RcExts;
import io.github.eutro.rcopt.core.ops.RcKind;
import io.github.eutro.rcopt.core.ops.RcOps;
import io.github.eutro.rcopt.core.passes.InPlaceIRPass;
import io.github.eutro.rcopt.core.ssa.*;

import java.util.List;

/**
 * Compute the {@link RcExts#RC_ROOT reference identity root} of every {@link Var} assigned in a function.
 * <p>
 * A variable has the root of the variable it was derived from if it is:
 * <ul>
 *     <li>the result of a single-argument {@link RcExts#IS_RC_IDENTITY_PRESERVING identity preserving}
 *     operation, such as a cast;</li>
 *     <li>the value result of {@link RcOps#GUARANTEED_BEGIN}, either directly or
 *     {@link RcOps#EXTRACT extracted} from its tuple result.</li>
 * </ul>
 * Any other variable is its own root.
 */
public class ComputeRcIdentity implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeRcIdentity INSTANCE = new ComputeRcIdentity();

    @Override
    public void runInPlace(Function func) {
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                for (Var var : effect.getAssignsTo()) {
                    var.removeExt(RcExts.RC_ROOT);
                }
            }
        }
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                for (Var var : effect.getAssignsTo()) {
                    rootOf(var);
                }
            }
        }

        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.validate(MetadataState.RC_IDENTITY);
    }

    private static Var rootOf(Var var) {
        Var root = var.getNullable(RcExts.RC_ROOT);
        if (root != null) return root;
        // placeholder, in case of malformed cyclic definitions
        var.attachExt(RcExts.RC_ROOT, var);
        Var source = derivedFrom(var);
        root = source == null ? var : rootOf(source);
        var.attachExt(RcExts.RC_ROOT, root);
        return root;
    }

    private static Var derivedFrom(Var var) {
        Effect def = var.getNullable(CommonExts.ASSIGNED_AT);
        if (def == null) return null;
        Insn insn = def.insn();
        List<Var> results = def.getAssignsTo();
        if (insn.args().size() != 1) return null;
        Var arg = insn.args().get(0);

        if (results.size() == 1 && insn.getExt(RcExts.IS_RC_IDENTITY_PRESERVING).orElse(false)) {
            return arg;
        }
        switch (RcKind.of(insn)) {
            case GUARANTEED_BEGIN:
                return results.size() == 2 && results.get(0) == var ? arg : null;
            case EXTRACT:
                if (RcOps.EXTRACT.cast(insn.op).arg != 0) return null;
                Effect tupleDef = arg.getNullable(CommonExts.ASSIGNED_AT);
                if (tupleDef != null
                        && RcKind.GUARANTEED_BEGIN.is(tupleDef.insn())
                        && tupleDef.getAssignsTo().size() == 1
                        && tupleDef.insn().args().size() == 1) {
                    return tupleDef.insn().args().get(0);
                }
                return null;
            default:
                return null;
        }
    }
}
