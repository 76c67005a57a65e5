/**
 * Passes over the IR, and the means to compose them.
 * <p>
 * Sub-packages hold passes that compute metadata ({@code meta}), passes that optimise ({@code opts}),
 * and combinators ({@code misc}).
 */
package io.github.eutro.rcopt.core.passes;
