package io.github.eutro.lowerj.ext;

import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * A list view which is notified of every element that enters or leaves it.
 * <p>
 * The IR uses these to keep ownership links and use lists consistent
 * with the lists that hold operations, blocks and operands.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    /**
     * Construct a tracked list over a backing list, which should be empty.
     *
     * @param viewed The backing list.
     */
    protected TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    /**
     * Called before an element is added.
     *
     * @param elt The element.
     */
    protected abstract void onAdded(E elt);

    /**
     * Called after an element is removed.
     *
     * @param elt The element.
     */
    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return viewed.get(index);
    }

    @Override
    public int size() {
        return viewed.size();
    }

    @Override
    public boolean add(E e) {
        onAdded(e);
        return viewed.add(e);
    }

    @Override
    public E set(int index, E element) {
        E removed = viewed.set(index, element);
        onRemoved(removed);
        onAdded(element);
        return removed;
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        viewed.add(index, element);
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        return removed;
    }

    @Override
    public void clear() {
        List<E> old = new ArrayList<>(viewed);
        viewed.clear();
        for (E e : old) {
            onRemoved(e);
        }
    }

    @Override
    public boolean addAll(int index, Collection<? extends E> c) {
        for (E e : c) {
            onAdded(e);
        }
        return viewed.addAll(index, c);
    }

    @Override
    public @NotNull ListIterator<E> listIterator(int index) {
        ListIterator<E> li = viewed.listIterator(index);
        return new ListIterator<E>() {
            E last;

            @Override
            public boolean hasNext() {
                return li.hasNext();
            }

            @Override
            public E next() {
                return last = li.next();
            }

            @Override
            public boolean hasPrevious() {
                return li.hasPrevious();
            }

            @Override
            public E previous() {
                return last = li.previous();
            }

            @Override
            public int nextIndex() {
                return li.nextIndex();
            }

            @Override
            public int previousIndex() {
                return li.previousIndex();
            }

            @Override
            public void remove() {
                li.remove();
                onRemoved(last);
                last = null;
            }

            @Override
            public void set(E e) {
                onAdded(e);
                li.set(e);
                onRemoved(last);
                last = e;
            }

            @Override
            public void add(E e) {
                onAdded(e);
                li.add(e);
            }
        };
    }

    @Override
    public @NotNull Iterator<E> iterator() {
        return listIterator();
    }
}
