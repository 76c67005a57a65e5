package io.github.eutro.rcopt.core.ext;

import io.github.eutro.rcopt.core.ops.RcKind;
import io.github.eutro.rcopt.core.passes.meta.ComputeRcIdentity;
import io.github.eutro.rcopt.core.ssa.Var;

/**
 * {@link Ext}s concerning reference counting.
 */
public class RcExts {
    /**
     * Attached to an operation key. What role the operation plays for reference counting.
     *
     * @see RcKind#of
     */
    public static final Ext<RcKind> RC_KIND = Ext.create(RcKind.class, "RC_KIND");

    /**
     * Attached to an operation key. Whether the single result of the operation refers to the
     * same object, with the same reference count, as its single argument.
     */
    public static final Ext<Boolean> IS_RC_IDENTITY_PRESERVING = Ext.create(Boolean.class, "IS_RC_IDENTITY_PRESERVING");

    /**
     * Attached to a {@link Var}, computed by {@link ComputeRcIdentity}.
     * The value whose reference count governs the lifetime of the variable's referent.
     */
    public static final Ext<Var> RC_ROOT = Ext.create(Var.class, "RC_ROOT");
}
