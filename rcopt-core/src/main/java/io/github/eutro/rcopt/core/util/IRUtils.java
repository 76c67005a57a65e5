package io.github.eutro.rcopt.core.util;

import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.ops.RcKind;
import io.github.eutro.rcopt.core.passes.meta.ComputeUses;
import io.github.eutro.rcopt.core.ssa.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.ListIterator;
import java.util.Set;

/**
 * Queries and mutations of the IR which keep {@link CommonExts#USED_AT uses} up to date.
 * <p>
 * All of these assume uses were {@link ComputeUses computed} beforehand.
 */
public class IRUtils {
    /**
     * Remove an effect from its block, and forget its uses of its arguments.
     * <p>
     * Any uses of the variables it assigns should have been rewritten or erased already.
     *
     * @param fx The effect.
     */
    public static void erase(Effect fx) {
        BasicBlock block = fx.getExtOrThrow(CommonExts.OWNING_BLOCK);
        ListIterator<Effect> it = block.getEffects().listIterator();
        while (it.hasNext()) {
            if (it.next() == fx) {
                it.remove();
                break;
            }
        }
        Insn insn = fx.insn();
        for (Var arg : insn.args()) {
            Set<Insn> uses = arg.getNullable(CommonExts.USED_AT);
            if (uses != null) uses.remove(insn);
        }
    }

    /**
     * Make every instruction using {@code from} use {@code to} instead.
     *
     * @param from The variable to replace.
     * @param to   The replacement.
     */
    public static void replaceAllUsesWith(Var from, Var to) {
        if (from == to) return;
        Set<Insn> fromUses = getUses(from);
        Set<Insn> toUses = getUses(to);
        for (Insn user : fromUses) {
            List<Var> args = user.args();
            for (int i = 0; i < args.size(); i++) {
                if (args.get(i) == from) {
                    args.set(i, to);
                }
            }
            toUses.add(user);
        }
        fromUses.clear();
    }

    /**
     * Get the instructions using a variable.
     *
     * @param var The variable.
     * @return The live set of uses.
     */
    public static Set<Insn> getUses(Var var) {
        Set<Insn> uses = var.getNullable(CommonExts.USED_AT);
        if (uses == null) {
            // arguments of erased effects, or variables created since uses were computed
            uses = new HashSet<>();
            var.attachExt(CommonExts.USED_AT, uses);
        }
        return uses;
    }

    /**
     * Get the instructions using a variable, other than {@link RcKind#DEBUG debug} instructions.
     *
     * @param var The variable.
     * @return A snapshot of the uses.
     */
    public static List<Insn> getNonDebugUses(Var var) {
        List<Insn> ret = new ArrayList<>();
        for (Insn use : getUses(var)) {
            if (!isDebug(use)) ret.add(use);
        }
        return ret;
    }

    /**
     * Erase every {@link RcKind#DEBUG debug} instruction using a variable.
     *
     * @param var The variable.
     */
    public static void deleteAllDebugUses(Var var) {
        for (Insn use : new ArrayList<>(getUses(var))) {
            if (isDebug(use)) {
                Effect fx = owningEffect(use);
                if (fx != null) erase(fx);
            }
        }
    }

    /**
     * Check whether an instruction only records values for debuggers.
     *
     * @param insn The instruction.
     * @return Whether it does.
     */
    public static boolean isDebug(Insn insn) {
        return RcKind.of(insn) == RcKind.DEBUG;
    }

    /**
     * Check whether executing an instruction could be observed other than through its results.
     *
     * @param insn The instruction.
     * @return Whether it is not known to be pure.
     */
    public static boolean mayHaveSideEffects(Insn insn) {
        return !insn.getExt(CommonExts.IS_PURE).orElse(false);
    }

    /**
     * Get the effect an instruction is placed in.
     *
     * @param insn The instruction.
     * @return The effect, or null if it is a control instruction or not placed.
     */
    public static @Nullable Effect owningEffect(Insn insn) {
        return insn.getNullable(CommonExts.OWNING_EFFECT);
    }
}
