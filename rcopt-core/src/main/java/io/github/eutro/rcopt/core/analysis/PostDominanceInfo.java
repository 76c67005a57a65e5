package io.github.eutro.rcopt.core.analysis;

import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.ext.MetadataState;
import io.github.eutro.rcopt.core.ssa.Effect;
import io.github.eutro.rcopt.core.ssa.Function;

/**
 * Answers whether every path from one instruction to a function exit passes through another.
 */
@FunctionalInterface
public interface PostDominanceInfo {
    /**
     * Check whether {@code a} properly post-dominates {@code b}: {@code a} is not {@code b},
     * and every path from {@code b} to an exit passes through {@code a}.
     *
     * @param a The post-dominating candidate.
     * @param b The post-dominated candidate.
     * @return Whether {@code a} properly post-dominates {@code b}.
     */
    boolean properlyPostDominates(Effect a, Effect b);

    /**
     * Get the default post-dominance of a function, computing its post-dominator tree if needed.
     *
     * @param func The function.
     * @return The post-dominance info, valid until the function's control flow graph changes.
     */
    static PostDominanceInfo compute(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.POST_DOMS);
        return new PostDominatorTree();
    }
}
