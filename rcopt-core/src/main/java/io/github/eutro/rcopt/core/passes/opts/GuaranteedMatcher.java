package io.github.eutro.rcopt.core.passes.opts;

import com.google.common.flogger.FluentLogger;
import io.github.eutro.rcopt.core.analysis.PostDominanceInfo;
import io.github.eutro.rcopt.core.analysis.RcIdentityInfo;
import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.ops.RcKind;
import io.github.eutro.rcopt.core.ssa.Effect;
import io.github.eutro.rcopt.core.ssa.Insn;
import io.github.eutro.rcopt.core.ssa.Var;
import io.github.eutro.rcopt.core.util.IRUtils;
import io.github.eutro.rcopt.core.util.RcUtils;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.Supplier;

/**
 * Decides whether a guaranteed scope, and the retain and release around it, can be removed.
 */
final class GuaranteedMatcher {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final RcIdentityInfo rcIdentity;
    private final Supplier<PostDominanceInfo> postDoms;

    GuaranteedMatcher(RcIdentityInfo rcIdentity, Supplier<PostDominanceInfo> postDoms) {
        this.rcIdentity = rcIdentity;
        this.postDoms = postDoms;
    }

    @Nullable
    GuaranteedMatch match(Effect begin, RetainTracker retains) {
        Insn beginInsn = begin.insn();
        if (beginInsn.args().size() != 1) return null;
        Var operand = beginInsn.args().get(0);
        Var root = rcIdentity.getRoot(operand);

        Effect retain = retains.lookup(root);
        if (retain == null) {
            logger.atFine().log("no retain of %s before %s", root, begin);
            return null;
        }
        if (!onlyFillerBetween(retain, begin)) {
            logger.atFine().log("%s is not right before %s", retain, begin);
            return null;
        }

        RcUtils.GuaranteedResults results = RcUtils.getGuaranteedResults(begin);
        if (results == null) {
            logger.atFine().log("no single value and token result of %s", begin);
            return null;
        }

        Effect end = RcUtils.getGuaranteedEndUser(results.token);
        if (end == null) {
            logger.atFine().log("no single end of scope using %s", results.token);
            return null;
        }

        if (!postDoms.get().properlyPostDominates(end, begin)) {
            logger.atFine().log("%s does not post-dominate %s", end, begin);
            return null;
        }

        Effect release = RcUtils.findReleaseToMatch(end, root, rcIdentity);
        if (release == null) {
            logger.atFine().log("no release of %s around %s", root, end);
            return null;
        }

        return new GuaranteedMatch(retain, begin, operand, root, results, end, release);
    }

    private static boolean onlyFillerBetween(Effect retain, Effect begin) {
        List<Effect> effects = begin.getExtOrThrow(CommonExts.OWNING_BLOCK).getEffects();
        int i = effects.indexOf(retain) + 1;
        while (i < effects.size()) {
            Effect fx = effects.get(i);
            if (fx == begin) return true;
            Insn insn = fx.insn();
            RcKind kind = RcKind.of(insn);
            if (kind != RcKind.RETAIN
                    && kind != RcKind.DEBUG
                    && IRUtils.mayHaveSideEffects(insn)) {
                return false;
            }
            i++;
        }
        return false;
    }
}
