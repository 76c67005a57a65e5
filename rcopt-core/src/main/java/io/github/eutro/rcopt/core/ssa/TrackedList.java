package io.github.eutro.rcopt.core.ssa;

import java.util.*;

/**
 * A list view that is notified whenever an element enters or leaves it,
 * so the IR can keep owner links up to date.
 * <p>
 * Every mutation goes through {@link #add(int, Object)}, {@link #set(int, Object)}
 * or {@link #remove(int)}, including those made through iterators.
 *
 * @param <E> The element type.
 */
abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> backing;

    TrackedList(List<E> backing) {
        this.backing = backing;
    }

    protected abstract void onAdded(E elt);

    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return backing.get(index);
    }

    @Override
    public int size() {
        return backing.size();
    }

    @Override
    public void add(int index, E element) {
        backing.add(index, element);
        onAdded(element);
        modCount++;
    }

    @Override
    public E set(int index, E element) {
        E old = backing.set(index, element);
        onRemoved(old);
        onAdded(element);
        return old;
    }

    @Override
    public E remove(int index) {
        E old = backing.remove(index);
        onRemoved(old);
        modCount++;
        return old;
    }
}
