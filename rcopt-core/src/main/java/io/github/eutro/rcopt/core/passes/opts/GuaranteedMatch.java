package io.github.eutro.rcopt.core.passes.opts;

import io.github.eutro.rcopt.core.util.RcUtils;
import io.github.eutro.rcopt.core.ssa.Effect;
import io.github.eutro.rcopt.core.ssa.Var;

/**
 * A guaranteed scope proven safe to remove, with everything that will be erased along with it.
 */
final class GuaranteedMatch {
    final Effect retain;
    final Effect begin;
    final Var operand;
    final Var root;
    final RcUtils.GuaranteedResults results;
    final Effect end;
    final Effect release;

    GuaranteedMatch(
            Effect retain,
            Effect begin,
            Var operand,
            Var root,
            RcUtils.GuaranteedResults results,
            Effect end,
            Effect release
    ) {
        this.retain = retain;
        this.begin = begin;
        this.operand = operand;
        this.root = root;
        this.results = results;
        this.end = end;
        this.release = release;
    }
}
