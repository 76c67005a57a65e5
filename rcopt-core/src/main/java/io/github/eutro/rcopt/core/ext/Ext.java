package io.github.eutro.rcopt.core.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key under which a value of type {@code T} can be stored
 * in an {@link ExtContainer}.
 * <p>
 * Exts are ordered by creation, which is what {@link ExtHolder} sorts its storage by.
 * That order is not stable across runs.
 *
 * @param <T> The type of the value stored under this key.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final int id = NEXT_ID.getAndIncrement();
    private final Class<T> type;
    private final String name;

    private Ext(Class<T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * {@code type} only needs to be a superclass of the real value type, since classes
     * cannot express generic types such as {@code Set<Insn>}. It is kept for debugging.
     *
     * @param type The most specific class of the ext's values.
     * @param name The name, for debugging.
     * @param <T>  The class type.
     * @param <R>  The actual type of the ext's values.
     * @return The new ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    /**
     * Get the class this ext was created with.
     *
     * @return The class.
     */
    public Class<T> getType() {
        return type;
    }

    /**
     * Look up this ext in a container.
     *
     * @param ec The container.
     * @return The value, if present.
     * @see ExtContainer#getExt(Ext)
     */
    public Optional<T> getIn(ExtContainer ec) {
        return ec.getExt(this);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
