/**
 * The intermediate representation the reference-counting optimisations run on.
 * <p>
 * A {@link io.github.eutro.rcopt.core.ssa.Function} is a list of
 * {@link io.github.eutro.rcopt.core.ssa.BasicBlock}s. Each block holds
 * {@link io.github.eutro.rcopt.core.ssa.Effect} instructions followed by one
 * {@link io.github.eutro.rcopt.core.ssa.Control} instruction; both wrap a raw
 * {@link io.github.eutro.rcopt.core.ssa.Insn}, an operation applied to argument variables.
 * <p>
 * The IR is in static single assignment form: each {@link io.github.eutro.rcopt.core.ssa.Var}
 * is assigned by exactly one effect, which dominates all of its uses.
 * Passes may assume this and must preserve it.
 */
package io.github.eutro.rcopt.core.ssa;
