/**
 * Exts associate arbitrary, typed data with IR objects without the IR classes
 * having to know about it.
 *
 * <pre>{@code
 * public static final Ext<Var> RC_ROOT = Ext.create(Var.class, "RC_ROOT");
 *
 * var.attachExt(RC_ROOT, root);
 * var.getExtOrThrow(RC_ROOT); // => root
 * }</pre>
 * <p>
 * Analyses store their results as exts on the IR ({@link io.github.eutro.rcopt.core.ext.CommonExts#USED_AT},
 * {@link io.github.eutro.rcopt.core.ext.CommonExts#IPDOM}, {@link io.github.eutro.rcopt.core.ext.RcExts#RC_ROOT}),
 * and the validity of those results is tracked per function by
 * {@link io.github.eutro.rcopt.core.ext.MetadataState}.
 * Operation properties ({@link io.github.eutro.rcopt.core.ext.CommonExts#IS_PURE},
 * {@link io.github.eutro.rcopt.core.ext.RcExts#RC_KIND}) are attached once to operation keys,
 * and instructions see them through {@link io.github.eutro.rcopt.core.ext.DelegatingExtHolder}.
 */
package io.github.eutro.rcopt.core.ext;
