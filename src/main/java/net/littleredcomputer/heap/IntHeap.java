// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.heap;

import gnu.trove.list.array.TIntArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.OptionalInt;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@link Heap} specialized to int keys, backed by a Trove list so that no
 * values are boxed. Sifting and tie-breaking follow {@link Heap} exactly, so
 * the two produce identical layouts from identical inputs.
 */
public class IntHeap {
    private static final Logger log = LogManager.getFormatterLogger(IntHeap.class);

    /** A strict weak ordering: true when {@code a} belongs above {@code b}. */
    @FunctionalInterface
    public interface Order {
        boolean before(int a, int b);
    }

    private final TIntArrayList a;
    private final Order order;

    public IntHeap(Order order) {
        this(new TIntArrayList(), order);
    }

    private IntHeap(TIntArrayList a, Order order) {
        this.a = a;
        this.order = checkNotNull(order, "order");
    }

    public static IntHeap max() { return new IntHeap((x, y) -> x > y); }
    public static IntHeap min() { return new IntHeap((x, y) -> x < y); }

    /** Copies the values and heapifies them in linear time. */
    public static IntHeap from(int[] values, Order order) {
        IntHeap h = new IntHeap(new TIntArrayList(values), order);
        h.heapify();
        return h;
    }

    private void heapify() {
        final int n = a.size();
        for (int start = n / 2 - 1; start >= 0; --start) siftDown(start, n);
        if (log.isTraceEnabled()) log.trace("heapified %d ints; root %s", n, peek());
    }

    public boolean isEmpty() { return a.isEmpty(); }

    public int size() { return a.size(); }

    public OptionalInt peek() {
        return a.isEmpty() ? OptionalInt.empty() : OptionalInt.of(a.get(0));
    }

    /** The layout, in index order. */
    public int[] toArray() {
        return a.toArray();
    }

    public void insert(int value) {
        a.add(value);
        siftUp(a.size() - 1);
    }

    public void insertAll(int... values) {
        for (int v : values) insert(v);
    }

    public OptionalInt removeRoot() {
        if (a.isEmpty()) return OptionalInt.empty();
        int top = a.get(0);
        if (a.size() > 1) {
            a.set(0, a.removeAt(a.size() - 1));
            siftDown(0, a.size());
        }
        else a.resetQuick();
        return OptionalInt.of(top);
    }

    public OptionalInt removeAt(int index) {
        if (index < 0 || index >= a.size()) return OptionalInt.empty();
        final int last = a.size() - 1;
        if (index != last) {
            swap(index, last);
            siftDown(index, last);
            siftUp(index);
        }
        return OptionalInt.of(a.removeAt(last));
    }

    /** {@code removeAt(index)} then {@code insert(value)}; false if index is out of range. */
    public boolean replace(int index, int value) {
        if (index < 0 || index >= a.size()) return false;
        removeAt(index);
        insert(value);
        return true;
    }

    public OptionalInt indexOf(int value) {
        int i = a.indexOf(value);
        return i < 0 ? OptionalInt.empty() : OptionalInt.of(i);
    }

    public OptionalInt remove(int value) {
        OptionalInt i = indexOf(value);
        return i.isPresent() ? removeAt(i.getAsInt()) : OptionalInt.empty();
    }

    private void siftUp(int child) {
        final int node = a.get(child);
        int parent = Heap.parentIndex(child);
        while (child > 0 && order.before(node, a.get(parent))) {
            a.set(child, a.get(parent));
            child = parent;
            parent = Heap.parentIndex(child);
        }
        a.set(child, node);
    }

    private void siftDown(int start, int end) {
        int root = start, child;
        while ((child = Heap.leftChildIndex(root)) < end) {
            int first = root;
            if (order.before(a.get(child), a.get(first))) first = child;
            if (child+1 < end && order.before(a.get(child+1), a.get(first))) first = child+1;
            if (first == root) return;
            swap(root, first);
            root = first;
        }
    }

    private void swap(int i, int j) {
        int tmp = a.get(i);
        a.set(i, a.get(j));
        a.set(j, tmp);
    }

    @Override
    public String toString() {
        return a.toString();
    }
}
