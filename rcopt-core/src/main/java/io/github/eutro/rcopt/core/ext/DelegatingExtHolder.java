package io.github.eutro.rcopt.core.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} which looks in another {@link ExtContainer} for exts it does not have itself.
 * <p>
 * This is how an instruction inherits, for example, {@link CommonExts#IS_PURE} from its operation.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    /**
     * Get the container to fall back to.
     *
     * @return The delegate, or null.
     */
    protected abstract ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T own = super.getNullable(ext);
        if (own != null) return own;
        ExtContainer delegate = getDelegate();
        return delegate == null ? null : delegate.getNullable(ext);
    }
}
