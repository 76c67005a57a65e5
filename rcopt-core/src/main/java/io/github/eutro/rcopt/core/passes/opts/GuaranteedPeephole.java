package io.github.eutro.rcopt.core.passes.opts;

import com.google.common.flogger.FluentLogger;
import io.github.eutro.rcopt.core.analysis.PostDominanceInfo;
import io.github.eutro.rcopt.core.analysis.RcIdentityInfo;
import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.ext.MetadataState;
import io.github.eutro.rcopt.core.ops.RcKind;
import io.github.eutro.rcopt.core.ops.RcOps;
import io.github.eutro.rcopt.core.passes.InPlaceIRPass;
import io.github.eutro.rcopt.core.ssa.BasicBlock;
import io.github.eutro.rcopt.core.ssa.Effect;
import io.github.eutro.rcopt.core.ssa.Function;
import io.github.eutro.rcopt.core.ssa.Insn;
import io.github.eutro.rcopt.core.ssa.Var;
import io.github.eutro.rcopt.core.util.F;
import io.github.eutro.rcopt.core.util.IRUtils;
import io.github.eutro.rcopt.core.util.Lazy;
import io.github.eutro.rcopt.core.util.RcUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes retain/release pairs around {@link RcOps#GUARANTEED_BEGIN guaranteed scopes}.
 * <p>
 * A guaranteed scope asserts that something else keeps its operand alive until the scope ends.
 * So in
 * <pre>
 *   strong_retain %x
 *   %v, %t = unsafe_guaranteed %x
 *   ...
 *   unsafe_guaranteed_end %t
 *   strong_release %v
 * </pre>
 * the retain and release are redundant, provided the end of the scope is reached on every path to
 * an exit. All four instructions are erased, and {@code %v} is replaced by {@code %x}.
 * Retain/release pairs of the same object nested within the scope are removed as well.
 * <p>
 * The retain must be followed only by other retains, pure instructions and debug instructions
 * up to the start of the scope. The release must be in the same block as the end of the scope,
 * with nothing that may have side effects in between.
 */
public class GuaranteedPeephole implements InPlaceIRPass<Function> {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    /**
     * An instance of this pass using the default analyses.
     */
    public static final GuaranteedPeephole INSTANCE = new GuaranteedPeephole(
            RcIdentityInfo::compute,
            PostDominanceInfo::compute
    );

    private final F<Function, RcIdentityInfo> rcIdentityFactory;
    private final F<Function, PostDominanceInfo> postDomsFactory;

    /**
     * Construct the pass with the given analyses.
     *
     * @param rcIdentityFactory Computes the reference identity of a function.
     * @param postDomsFactory   Computes the post-dominance of a function; only called when
     *                          a scope gets that far.
     */
    public GuaranteedPeephole(
            F<Function, RcIdentityInfo> rcIdentityFactory,
            F<Function, PostDominanceInfo> postDomsFactory
    ) {
        this.rcIdentityFactory = rcIdentityFactory;
        this.postDomsFactory = postDomsFactory;
    }

    @Override
    public void runInPlace(Function func) {
        if (removeGuaranteedPairs(func)) {
            func.getExtOrThrow(CommonExts.METADATA_STATE).instructionsChanged();
        }
    }

    /**
     * Remove every removable guaranteed scope in a function.
     * <p>
     * Sweeps the function until a sweep removes nothing, since removing one scope can
     * unblock the release search of an earlier one.
     *
     * @param func The function.
     * @return Whether anything was removed.
     */
    public boolean removeGuaranteedPairs(Function func) {
        logger.atFine().log("running on function %s", func.name);
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.USES);

        RcIdentityInfo rcIdentity = rcIdentityFactory.apply(func);
        Lazy<PostDominanceInfo> postDoms = Lazy.lazy(() -> postDomsFactory.apply(func));
        GuaranteedMatcher matcher = new GuaranteedMatcher(rcIdentity, postDoms);

        boolean changed = false;
        while (sweep(func, rcIdentity, matcher)) {
            changed = true;
        }
        return changed;
    }

    private static boolean sweep(Function func, RcIdentityInfo rcIdentity, GuaranteedMatcher matcher) {
        boolean changed = false;
        for (BasicBlock block : func.blocks) {
            List<Effect> effects = block.getEffects();
            RetainTracker retains = new RetainTracker(rcIdentity);
            int cursor = 0;
            while (cursor < effects.size()) {
                Effect fx = effects.get(cursor++);
                if (retains.record(fx)) continue;
                if (RcKind.of(fx.insn()) != RcKind.GUARANTEED_BEGIN) continue;

                GuaranteedMatch match = matcher.match(fx, retains);
                if (match == null) continue;

                int retainIdx = effects.indexOf(match.retain);
                cursor = retainIdx == 0 ? 0 : retainIdx - 1;
                removeScope(match, rcIdentity);
                retains.rebuild(effects.subList(0, cursor));
                changed = true;
            }
        }
        return changed;
    }

    private static void removeScope(GuaranteedMatch match, RcIdentityInfo rcIdentity) {
        logger.atFine().log("removing %s, %s and %s around %s", match.retain, match.release, match.end, match.begin);

        for (Effect nested : findNestedPairs(match, rcIdentity)) {
            IRUtils.erase(nested);
        }
        IRUtils.erase(match.retain);
        IRUtils.erase(match.release);
        IRUtils.erase(match.end);

        RcUtils.GuaranteedResults results = match.results;
        IRUtils.deleteAllDebugUses(results.value);
        IRUtils.deleteAllDebugUses(results.token);
        for (Var var : match.begin.getAssignsTo()) {
            IRUtils.deleteAllDebugUses(var);
        }

        IRUtils.replaceAllUsesWith(results.value, match.operand);
        if (results.valueExtract != null) IRUtils.erase(results.valueExtract);
        if (results.tokenExtract != null) IRUtils.erase(results.tokenExtract);
        // the tuple may still be retained or released
        for (Var var : match.begin.getAssignsTo()) {
            IRUtils.replaceAllUsesWith(var, match.operand);
        }
        IRUtils.erase(match.begin);
    }

    /**
     * Find retain/release pairs of the scope's root strictly inside the scope, with nothing but
     * calls and instructions without side effects in between.
     * Only looks when the whole scope, with its retain and release, is in one block.
     */
    private static List<Effect> findNestedPairs(GuaranteedMatch match, RcIdentityInfo rcIdentity) {
        List<Effect> pairs = new ArrayList<>();
        BasicBlock block = match.begin.getExtOrThrow(CommonExts.OWNING_BLOCK);
        if (match.retain.getNullable(CommonExts.OWNING_BLOCK) != block
                || match.end.getNullable(CommonExts.OWNING_BLOCK) != block
                || match.release.getNullable(CommonExts.OWNING_BLOCK) != block) {
            return pairs;
        }

        List<Effect> effects = block.getEffects();
        Effect candidate = null;
        for (int i = effects.indexOf(match.begin); i < effects.size(); i++) {
            Effect fx = effects.get(i);
            if (fx == match.release || fx == match.end) break;
            Insn insn = fx.insn();
            if (fx != match.retain && RcUtils.isRetainOf(fx, match.root, rcIdentity)) {
                candidate = fx;
                continue;
            }
            RcKind kind = RcKind.of(insn);
            if (!IRUtils.mayHaveSideEffects(insn) || kind == RcKind.DEBUG || kind == RcKind.CALL) {
                continue;
            }
            if (candidate != null && RcUtils.isReleaseOf(fx, match.root, rcIdentity)) {
                logger.atFine().log("removing nested %s and %s", candidate, fx);
                pairs.add(candidate);
                pairs.add(fx);
            }
            candidate = null;
        }
        return pairs;
    }
}
