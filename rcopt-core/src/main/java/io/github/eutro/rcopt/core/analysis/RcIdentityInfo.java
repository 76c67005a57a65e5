package io.github.eutro.rcopt.core.analysis;

import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.ext.MetadataState;
import io.github.eutro.rcopt.core.ext.RcExts;
import io.github.eutro.rcopt.core.passes.meta.ComputeRcIdentity;
import io.github.eutro.rcopt.core.ssa.Function;
import io.github.eutro.rcopt.core.ssa.Var;

/**
 * Answers which value's reference count governs the lifetime of another value's referent.
 * <p>
 * Two values with the same root refer to the same object, so retaining one and
 * releasing the other cancels out.
 */
@FunctionalInterface
public interface RcIdentityInfo {
    /**
     * Get the reference identity root of a value.
     *
     * @param value The value.
     * @return The root, which may be {@code value} itself.
     */
    Var getRoot(Var value);

    /**
     * Get the default reference identity of a function, as computed by {@link ComputeRcIdentity}.
     *
     * @param func The function.
     * @return The identity info, valid until the function's instructions change.
     */
    static RcIdentityInfo compute(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.RC_IDENTITY);
        return value -> value.getExt(RcExts.RC_ROOT).orElse(value);
    }
}
