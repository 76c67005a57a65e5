package io.github.eutro.rcopt.core.passes.opts;

import io.github.eutro.rcopt.core.analysis.RcIdentityInfo;
import io.github.eutro.rcopt.core.ops.RcKind;
import io.github.eutro.rcopt.core.util.RcUtils;
import io.github.eutro.rcopt.core.ssa.Effect;
import io.github.eutro.rcopt.core.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The most recent retain of each reference identity root, within one block.
 */
final class RetainTracker {
    private final RcIdentityInfo rcIdentity;
    private final Map<Var, Effect> lastRetain = new HashMap<>();

    RetainTracker(RcIdentityInfo rcIdentity) {
        this.rcIdentity = rcIdentity;
    }

    /**
     * Record an effect if it is a retain.
     *
     * @param fx The effect.
     * @return Whether it was a retain.
     */
    boolean record(Effect fx) {
        if (RcKind.of(fx.insn()) != RcKind.RETAIN) return false;
        lastRetain.put(RcUtils.operandRoot(fx, rcIdentity), fx);
        return true;
    }

    @Nullable
    Effect lookup(Var root) {
        return lastRetain.get(root);
    }

    /**
     * Forget everything, and record the given effects instead.
     *
     * @param effects The effects, in order.
     */
    void rebuild(List<Effect> effects) {
        lastRetain.clear();
        for (Effect fx : effects) {
            record(fx);
        }
    }
}
