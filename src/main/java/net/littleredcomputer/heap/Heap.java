// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.heap;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.BiPredicate;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A binary heap stored in a dense, zero-indexed list. The ordering predicate
 * {@code order(a, b)} answers "should a sit above b?": supplying {@code >} over
 * a naturally ordered type makes a max-heap, {@code <} a min-heap.
 * <p>
 * The predicate must be a strict weak ordering. If it is not, the shape of the
 * heap is unspecified (but no operation will fail).
 * <p>
 * Empty heaps and out-of-range indices are reported through empty
 * {@link Optional} results rather than exceptions, so that callers can poll
 * until the heap is drained. Instances are not thread-safe.
 *
 * @param <T> element type; {@code null} elements are rejected
 */
public class Heap<T> {
    private static final Logger log = LogManager.getFormatterLogger(Heap.class);

    private final List<T> nodes = new ArrayList<>();
    private final BiPredicate<? super T, ? super T> order;

    /**
     * Creates an empty heap.
     * @param order returns true when its first argument belongs above its second
     */
    public Heap(BiPredicate<? super T, ? super T> order) {
        this.order = checkNotNull(order, "order");
    }

    public static <T extends Comparable<? super T>> Heap<T> maxHeap() {
        return new Heap<>((a, b) -> a.compareTo(b) > 0);
    }

    public static <T extends Comparable<? super T>> Heap<T> minHeap() {
        return new Heap<>((a, b) -> a.compareTo(b) < 0);
    }

    /** An empty heap whose root is the least element according to {@code comparator}. */
    public static <T> Heap<T> ordered(Comparator<? super T> comparator) {
        return new Heap<>(before(comparator));
    }

    /**
     * Builds a heap from the elements in bulk. The elements are copied in
     * iteration order and then heapified bottom-up, which takes linear time.
     */
    public static <T> Heap<T> from(Iterable<? extends T> elements, BiPredicate<? super T, ? super T> order) {
        Heap<T> h = new Heap<>(order);
        for (T e : elements) h.nodes.add(checkNotNull(e, "element"));
        h.heapify();
        return h;
    }

    /**
     * Adapts a comparator to an ordering predicate under which lesser elements
     * rise to the root.
     */
    public static <T> BiPredicate<T, T> before(Comparator<? super T> comparator) {
        checkNotNull(comparator, "comparator");
        return (a, b) -> comparator.compare(a, b) < 0;
    }

    private void heapify() {
        for (int i = nodes.size() / 2 - 1; i >= 0; --i) siftDown(i, nodes.size());
        if (log.isTraceEnabled()) log.trace("heapified %d nodes; root %s", nodes.size(), peek().orElse(null));
    }

    static int parentIndex(int i) { return (i - 1) / 2; }
    static int leftChildIndex(int i) { return 2 * i + 1; }
    static int rightChildIndex(int i) { return 2 * i + 2; }

    public boolean isEmpty() { return nodes.isEmpty(); }

    public int size() { return nodes.size(); }

    /** The root: the maximum of a max-heap, the minimum of a min-heap. */
    public Optional<T> peek() {
        return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(0));
    }

    /** A snapshot of the backing list, in index order. */
    public List<T> nodes() {
        return ImmutableList.copyOf(nodes);
    }

    public void insert(T value) {
        nodes.add(checkNotNull(value, "value"));
        siftUp(nodes.size() - 1);
    }

    /**
     * Inserts the values one at a time. Unlike {@link #from}, this costs
     * O(n log n) for n values.
     */
    public void insertAll(Iterable<? extends T> values) {
        for (T v : values) insert(v);
    }

    /** Removes the root. Empty if the heap is. */
    public Optional<T> removeRoot() {
        if (nodes.isEmpty()) return Optional.empty();
        final int last = nodes.size() - 1;
        if (last == 0) return Optional.of(nodes.remove(0));
        T top = nodes.get(0);
        nodes.set(0, nodes.remove(last));
        siftDown(0, nodes.size());
        return Optional.of(top);
    }

    /**
     * Removes the element at the given position. Positions are only meaningful
     * until the next mutation.
     * @return the removed element, or empty if {@code index} is out of range
     */
    public Optional<T> removeAt(int index) {
        if (index < 0 || index >= nodes.size()) return Optional.empty();
        final int last = nodes.size() - 1;
        if (index != last) {
            Collections.swap(nodes, index, last);
            siftDown(index, last);
            siftUp(index);
        }
        return Optional.of(nodes.remove(last));
    }

    /**
     * Replaces the element at {@code index} with {@code value}. This is exactly
     * {@code removeAt(index)} followed by {@code insert(value)}, and the
     * resulting layout is the one those two calls produce.
     * @return false (and no change) if {@code index} is out of range
     */
    public boolean replace(int index, T value) {
        checkNotNull(value, "value");
        if (index < 0 || index >= nodes.size()) return false;
        removeAt(index);
        insert(value);
        return true;
    }

    /** Linear search by {@link Object#equals}; the first match wins. */
    public OptionalInt indexOf(T node) {
        int i = nodes.indexOf(node);
        return i < 0 ? OptionalInt.empty() : OptionalInt.of(i);
    }

    /** Removes the first element equal to {@code value}. O(n). */
    public Optional<T> remove(T value) {
        OptionalInt i = indexOf(value);
        return i.isPresent() ? removeAt(i.getAsInt()) : Optional.empty();
    }

    private void siftUp(int index) {
        int child = index;
        final T node = nodes.get(child);
        int parent = parentIndex(child);
        while (child > 0 && order.test(node, nodes.get(parent))) {
            nodes.set(child, nodes.get(parent));
            child = parent;
            parent = parentIndex(child);
        }
        nodes.set(child, node);
    }

    // end is exclusive.
    private void siftDown(int start, int end) {
        int root = start;
        while (true) {
            int left = leftChildIndex(root), right = left + 1;
            int first = root;
            if (left < end && order.test(nodes.get(left), nodes.get(first))) first = left;
            if (right < end && order.test(nodes.get(right), nodes.get(first))) first = right;
            if (first == root) return;
            Collections.swap(nodes, root, first);
            root = first;
        }
    }

    @Override
    public String toString() {
        return nodes.toString();
    }
}
