package io.github.eutro.rcopt.core.ext;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.TreeMap;

/**
 * An {@link ExtContainer} backed by a sorted map.
 * <p>
 * Subclasses put frequently used exts in fields, and only fall back to the map for the rest.
 */
public class ExtHolder implements ExtContainer {
    // most IR objects never get a map-stored ext, so allocate on demand
    @Nullable
    private Map<Ext<?>, Object> exts = null;

    @NotNull
    private Map<Ext<?>, Object> exts() {
        if (exts == null) {
            exts = new TreeMap<>();
        }
        return exts;
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        exts().put(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (exts == null) return;
        exts.remove(ext);
        if (exts.isEmpty()) {
            exts = null;
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (exts == null) return null;
        return (T) exts.get(ext);
    }
}
