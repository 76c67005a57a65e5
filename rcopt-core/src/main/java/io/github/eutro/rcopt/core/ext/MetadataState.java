package io.github.eutro.rcopt.core.ext;

import io.github.eutro.rcopt.core.passes.IRPass;
import io.github.eutro.rcopt.core.passes.meta.ComputePostDoms;
import io.github.eutro.rcopt.core.passes.meta.ComputeRcIdentity;
import io.github.eutro.rcopt.core.passes.meta.ComputeUses;
import io.github.eutro.rcopt.core.ssa.Function;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks which analysis results attached to a {@link Function} are still valid.
 * <p>
 * Passes that mutate a function report what they changed, and analyses are recomputed
 * lazily the next time someone {@link #ensureValid ensures} they are valid.
 */
public class MetadataState {
    /**
     * A kind of metadata whose validity is tracked.
     */
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        final int id = COUNTER.getAndIncrement();
        final String name;

        MetaKind(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of metadata which also knows the passes that compute it.
     *
     * @param <T> The IR the passes run on.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T>[] passes;

        @SafeVarargs
        ComputableMetaKind(String name, IRPass<T, T>... passes) {
            super(name);
            this.passes = passes;
        }

        void computeFor(T t) {
            for (IRPass<T, T> pass : passes) {
                if (!pass.isInPlace()) throw new IllegalArgumentException("not an in-place pass: " + pass);
                pass.run(t);
            }
        }
    }

    /**
     * Metadata that can be computed for functions.
     */
    public static final ComputableMetaKind<Function>
            USES = new ComputableMetaKind<>("USES", ComputeUses.INSTANCE),
            POST_DOMS = new ComputableMetaKind<>("POST_DOMS", ComputePostDoms.INSTANCE),
            RC_IDENTITY = new ComputableMetaKind<>("RC_IDENTITY", ComputeRcIdentity.INSTANCE);

    private final BitSet validSet = new BitSet();

    /**
     * Check whether the given metadata is valid.
     *
     * @param kind The kind of metadata.
     * @return Whether it is valid.
     */
    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    /**
     * Compute each of the given metadata that is not currently valid.
     *
     * @param t     The IR to compute it for.
     * @param first The first metadata kind.
     * @param kinds The other metadata kinds.
     * @param <T>   The type of {@code t}.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T> first, ComputableMetaKind<T>... kinds) {
        ensureValid0(t, first);
        for (ComputableMetaKind<T> kind : kinds) {
            ensureValid0(t, kind);
        }
    }

    private <T> void ensureValid0(T t, ComputableMetaKind<T> kind) {
        if (!isValid(kind)) {
            kind.computeFor(t);
            validate(kind);
        }
    }

    /**
     * Mark the given metadata as valid.
     *
     * @param kinds The metadata kinds.
     */
    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id);
        }
    }

    /**
     * Mark the given metadata as invalid.
     *
     * @param kinds The metadata kinds.
     */
    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.clear(kind.id);
        }
    }

    /**
     * Invalidate everything that depends on the control flow graph.
     */
    public void graphChanged() {
        invalidate(POST_DOMS);
        varsChanged();
    }

    /**
     * Invalidate everything that depends on which variables exist and where they are used.
     */
    public void varsChanged() {
        invalidate(USES, RC_IDENTITY);
    }

    /**
     * Invalidate everything that depends on individual instructions, after instructions were
     * erased or had their arguments rewritten without changing the control flow graph.
     */
    public void instructionsChanged() {
        varsChanged();
    }
}
