package io.github.eutro.rcopt.core.util;

import io.github.eutro.rcopt.core.analysis.RcIdentityInfo;
import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.ops.RcKind;
import io.github.eutro.rcopt.core.ops.RcOps;
import io.github.eutro.rcopt.core.ssa.BasicBlock;
import io.github.eutro.rcopt.core.ssa.Effect;
import io.github.eutro.rcopt.core.ssa.Insn;
import io.github.eutro.rcopt.core.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Queries about reference counting instructions, over IR with {@link CommonExts#USED_AT uses} computed.
 */
public class RcUtils {
    /**
     * The two results of a {@link RcOps#GUARANTEED_BEGIN} instruction.
     */
    public static final class GuaranteedResults {
        /**
         * The guaranteed value, usable in place of the operand.
         */
        public final Var value;
        /**
         * The token the end of the scope consumes.
         */
        public final Var token;
        /**
         * The extraction of the value from the tuple result, if the results are not direct.
         */
        public final @Nullable Effect valueExtract;
        /**
         * The extraction of the token from the tuple result, if the results are not direct.
         */
        public final @Nullable Effect tokenExtract;

        GuaranteedResults(Var value, Var token, @Nullable Effect valueExtract, @Nullable Effect tokenExtract) {
            this.value = value;
            this.token = token;
            this.valueExtract = valueExtract;
            this.tokenExtract = tokenExtract;
        }
    }

    /**
     * Resolve the value and token results of a {@link RcOps#GUARANTEED_BEGIN} effect.
     * <p>
     * If the effect assigns two variables, they are the value and token. If it assigns one tuple,
     * every non-debug use of the tuple must be a {@link RcOps#RETAIN_VALUE} or {@link RcOps#RELEASE_VALUE},
     * which are ignored, or one of exactly one {@link RcOps#EXTRACT extraction} of each element.
     *
     * @param begin The effect.
     * @return The results, or null if they cannot be resolved unambiguously.
     */
    public static @Nullable GuaranteedResults getGuaranteedResults(Effect begin) {
        List<Var> results = begin.getAssignsTo();
        if (results.size() == 2) {
            return new GuaranteedResults(results.get(0), results.get(1), null, null);
        }
        if (results.size() != 1) return null;

        Effect valueExtract = null;
        Effect tokenExtract = null;
        for (Insn use : IRUtils.getNonDebugUses(results.get(0))) {
            if (use.op == RcOps.RETAIN_VALUE || use.op == RcOps.RELEASE_VALUE) continue;
            Effect useFx = IRUtils.owningEffect(use);
            if (useFx == null
                    || RcKind.of(use) != RcKind.EXTRACT
                    || useFx.getAssignsTo().size() != 1) {
                return null;
            }
            int index = RcOps.EXTRACT.cast(use.op).arg;
            if (index == 0 && valueExtract == null) {
                valueExtract = useFx;
            } else if (index == 1 && tokenExtract == null) {
                tokenExtract = useFx;
            } else {
                return null;
            }
        }
        if (valueExtract == null || tokenExtract == null) return null;
        return new GuaranteedResults(
                valueExtract.getAssignsTo().get(0),
                tokenExtract.getAssignsTo().get(0),
                valueExtract,
                tokenExtract
        );
    }

    /**
     * Find the {@link RcOps#GUARANTEED_END} closing the scope of a token.
     *
     * @param token The token.
     * @return The end effect, or null unless it is the one non-debug use of the token.
     */
    public static @Nullable Effect getGuaranteedEndUser(Var token) {
        List<Insn> uses = IRUtils.getNonDebugUses(token);
        if (uses.size() != 1) return null;
        Insn use = uses.get(0);
        if (RcKind.of(use) != RcKind.GUARANTEED_END) return null;
        return IRUtils.owningEffect(use);
    }

    /**
     * Find a release of {@code root} in the block of {@code end}, searching first forwards from
     * {@code end} to the end of the block, then backwards from {@code end} to the start.
     * <p>
     * Each search skips releases of other roots and {@link RcKind#DEBUG debug} instructions,
     * and gives up at any other instruction that may have side effects.
     *
     * @param end        The end of the guaranteed scope.
     * @param root       The reference identity root to release.
     * @param rcIdentity The reference identity analysis.
     * @return The release, or null if none was found.
     */
    public static @Nullable Effect findReleaseToMatch(Effect end, Var root, RcIdentityInfo rcIdentity) {
        BasicBlock block = end.getExtOrThrow(CommonExts.OWNING_BLOCK);
        List<Effect> effects = block.getEffects();
        int endIdx = effects.indexOf(end);
        for (int i = endIdx + 1; i < effects.size(); i++) {
            Effect fx = effects.get(i);
            if (isReleaseOf(fx, root, rcIdentity)) return fx;
            if (isSearchBarrier(fx)) break;
        }
        for (int i = endIdx - 1; i >= 0; i--) {
            Effect fx = effects.get(i);
            if (isReleaseOf(fx, root, rcIdentity)) return fx;
            if (isSearchBarrier(fx)) break;
        }
        return null;
    }

    /**
     * Check whether an effect retains a value with the given root.
     *
     * @param fx         The effect.
     * @param root       The root.
     * @param rcIdentity The reference identity analysis.
     * @return Whether it does.
     */
    public static boolean isRetainOf(Effect fx, Var root, RcIdentityInfo rcIdentity) {
        return RcKind.of(fx.insn()) == RcKind.RETAIN && operandRoot(fx, rcIdentity) == root;
    }

    /**
     * Check whether an effect releases a value with the given root.
     *
     * @param fx         The effect.
     * @param root       The root.
     * @param rcIdentity The reference identity analysis.
     * @return Whether it does.
     */
    public static boolean isReleaseOf(Effect fx, Var root, RcIdentityInfo rcIdentity) {
        return RcKind.of(fx.insn()) == RcKind.RELEASE && operandRoot(fx, rcIdentity) == root;
    }

    /**
     * Get the root of the first operand of an effect.
     *
     * @param fx         The effect.
     * @param rcIdentity The reference identity analysis.
     * @return The root.
     */
    public static Var operandRoot(Effect fx, RcIdentityInfo rcIdentity) {
        return rcIdentity.getRoot(fx.insn().args().get(0));
    }

    private static boolean isSearchBarrier(Effect fx) {
        Insn insn = fx.insn();
        RcKind kind = RcKind.of(insn);
        return kind != RcKind.RELEASE
                && kind != RcKind.DEBUG
                && IRUtils.mayHaveSideEffects(insn);
    }
}
