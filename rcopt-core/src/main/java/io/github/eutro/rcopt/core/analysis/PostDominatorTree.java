package io.github.eutro.rcopt.core.analysis;

import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.passes.meta.ComputePostDoms;
import io.github.eutro.rcopt.core.ssa.BasicBlock;
import io.github.eutro.rcopt.core.ssa.Effect;

import java.util.List;

/**
 * Post-dominance read off the {@link CommonExts#IPDOM immediate post-dominators}
 * that {@link ComputePostDoms} attached to each block.
 */
public class PostDominatorTree implements PostDominanceInfo {
    @Override
    public boolean properlyPostDominates(Effect a, Effect b) {
        if (a == b) return false;
        BasicBlock aBlock = a.getExtOrThrow(CommonExts.OWNING_BLOCK);
        BasicBlock bBlock = b.getExtOrThrow(CommonExts.OWNING_BLOCK);
        if (aBlock == bBlock) {
            List<Effect> effects = aBlock.getEffects();
            return effects.indexOf(a) > effects.indexOf(b);
        }
        return properlyPostDominates(aBlock, bBlock);
    }

    /**
     * Check whether {@code a} is a strict ancestor of {@code b} in the post-dominator tree.
     *
     * @param a The post-dominating candidate.
     * @param b The post-dominated candidate.
     * @return Whether {@code a} properly post-dominates {@code b}.
     */
    public boolean properlyPostDominates(BasicBlock a, BasicBlock b) {
        BasicBlock cursor = b.getNullable(CommonExts.IPDOM);
        while (cursor != null) {
            if (cursor == a) return true;
            cursor = cursor.getNullable(CommonExts.IPDOM);
        }
        return false;
    }
}
