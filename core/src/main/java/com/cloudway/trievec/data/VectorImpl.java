/**
 * Cloudway Trievec
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trievec.data;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.ObjIntConsumer;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.primitives.Ints;

import com.cloudway.trievec.common.Config;

// @formatter:off

final class VectorImpl {
    private VectorImpl() {}

    private static final Logger logger = Logger.getLogger(VectorImpl.class.getName());

    static final String BITS_KEY = "trievec.vector.bits";
    static final int DEFAULT_BITS = 5;
    static final int MAX_BITS = 8;

    /**
     * Number of index bits consumed per tree level.
     */
    static final int BITS;

    /**
     * Number of slots in every node.
     */
    static final int WIDTH;

    /**
     * Extracts the slot of an index within one level.
     */
    static final int MASK;

    static {
        BITS  = bitsFrom(Config.getDefault());
        WIDTH = 1 << BITS;
        MASK  = WIDTH - 1;
        logger.config("Vector branching factor: " + WIDTH);
    }

    /**
     * Reads the number of bits per level from the given configuration. A
     * missing, malformed or out of range value yields {@link #DEFAULT_BITS}.
     */
    static int bitsFrom(Config config) {
        String value = config.get(BITS_KEY, null);
        if (value == null)
            return DEFAULT_BITS;

        Integer bits = Ints.tryParse(value.trim());
        if (bits == null || bits < 1 || bits > MAX_BITS) {
            logger.warning("Invalid " + BITS_KEY + " value " + value + ", using " + DEFAULT_BITS);
            return DEFAULT_BITS;
        }
        return bits;
    }

    // Internal Interfaces

    /**
     * Per-level step of a root-to-leaf walk. Receives the state produced by
     * the previous level, the level being visited (leaves are level 0, so the
     * walk visits {@code depth..1}) and the slot selected at that level.
     */
    @FunctionalInterface
    interface LevelVisitor<S> {
        S visit(S state, int level, int slot);
    }

    /**
     * A fixed-width tree node. Slots of a leaf hold elements, slots of an
     * internal node hold child nodes. A node carries the token of the
     * transient that created it, or {@code null} if it was created by a
     * persistent operation.
     */
    static final class Node {
        final Object edit;
        final Object[] slots;

        Node(Object edit) {
            this(edit, new Object[WIDTH]);
        }

        private Node(Object edit, Object[] slots) {
            this.edit = edit;
            this.slots = slots;
        }

        Node child(int slot) {
            return (Node)slots[slot];
        }

        Node copy(Object edit) {
            return new Node(edit, slots.clone());
        }

        boolean ownedBy(Object edit) {
            return edit != null && this.edit == edit;
        }
    }

    /**
     * The most recently visited leaf together with the index of its first slot.
     */
    static final class LeafCache {
        final int base;
        final Node leaf;

        LeafCache(int base, Node leaf) {
            this.base = base;
            this.leaf = leaf;
        }

        boolean covers(int index) {
            return (index & ~MASK) == base;
        }
    }

    // Utility Methods

    static final Node EMPTY_NODE = new Node(null);

    private static final PersistentVector<?> EMPTY = new PersistentVector<>(EMPTY_NODE, 0);

    @SuppressWarnings("unchecked")
    static <A> Vector<A> empty() {
        return (Vector<A>)EMPTY;
    }

    static <A> Vector<A> vector(Node root, int size) {
        return size == 0 ? empty() : new PersistentVector<>(root, size);
    }

    /**
     * Returns the number of internal levels above the leaves needed to
     * address the last element of a vector with the given size.
     */
    static int depthOf(int size) {
        if (size <= WIDTH)
            return 0;

        int depth = 0;
        for (int n = (size - 1) >>> BITS; n != 0; n >>>= BITS)
            depth++;
        return depth;
    }

    /**
     * Returns true if {@code n} is {@code WIDTH^k} for some {@code k >= 1}.
     */
    static boolean isPowerOfWidth(int n) {
        return n >= WIDTH
            && Integer.bitCount(n) == 1
            && Integer.numberOfTrailingZeros(n) % BITS == 0;
    }

    /**
     * Walks from the top level down to level 1 along the path of the given
     * index. The leaf slot ({@code index & MASK}) is left to the caller.
     */
    static <S> S walk(int index, int depth, S init, LevelVisitor<S> visitor) {
        S state = init;
        for (int level = depth; level > 0; level--) {
            state = visitor.visit(state, level, (index >>> (level * BITS)) & MASK);
        }
        return state;
    }

    static Node leafFor(Node root, int index, int depth) {
        return walk(index, depth, root, (node, level, slot) -> node.child(slot));
    }

    static Node editable(Node node, Object edit) {
        return node.ownedBy(edit) ? node : node.copy(edit);
    }

    /**
     * Appends a value after the last element of the tree, returning the new
     * root. Nodes owned by {@code edit} are written in place, every other
     * node on the path is copied first.
     */
    static Node pushLast(Node root, int size, Object value, Object edit) {
        Node top;
        if (isPowerOfWidth(size)) {
            top = new Node(edit);
            top.slots[0] = root;
        } else {
            top = editable(root, edit);
        }

        Node leaf = walk(size, depthOf(size + 1), top, (node, level, slot) -> {
            Node child = node.child(slot);
            child = (child == null) ? new Node(edit) : editable(child, edit);
            node.slots[slot] = child;
            return child;
        });

        leaf.slots[size & MASK] = value;
        return top;
    }

    /**
     * Removes the last element of a non-empty tree, returning the new root.
     */
    static Node popLast(Node root, int size, Object edit) {
        int index = size - 1;
        if (index == 0)
            return EMPTY_NODE;

        int depth = depthOf(size);
        if (depthOf(index) < depth) {
            // the right branch of the root held only the popped element
            return root.child(0);
        }

        Node top = editable(root, edit);
        Node leaf = walk(index, depth, top, (node, level, slot) -> {
            if (node == null)
                return null;
            if ((index & ((1 << (level * BITS)) - 1)) == 0) {
                node.slots[slot] = null;
                return null;
            }
            Node child = editable(node.child(slot), edit);
            node.slots[slot] = child;
            return child;
        });

        if (leaf != null)
            leaf.slots[index & MASK] = null;
        return top;
    }

    static void rangeCheck(int index, int size) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException(outOfBoundsMsg(index, size));
        }
    }

    static String outOfBoundsMsg(int index, int size) {
        return "Index: "+index+", Size: "+size;
    }

    static void capacityCheck(int size) {
        if (size == Integer.MAX_VALUE) {
            throw new IllegalStateException("Vector size limit reached: " + size);
        }
    }

    static int normalizeEnd(int end, int size) {
        return end < 0 ? size + end : end;
    }

    static void checkRange(int start, int end, int size) {
        if (start < 0 || end < start || end > size) {
            throw new InvalidRangeException(start, end, size);
        }
    }

    // ------------------------------------------------------------------------

    static final class PersistentVector<A> implements Vector<A> {
        private final Node root;
        private final int size;

        // the holder is immutable, so racy publication only costs a re-walk
        private LeafCache cache;

        PersistentVector(Node root, int size) {
            this.root = root;
            this.size = size;
        }

        Node root() {
            return root;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public boolean isEmpty() {
            return size == 0;
        }

        @Override
        public int depth() {
            return depthOf(size);
        }

        Node leafAt(int index) {
            LeafCache c = cache;
            if (c != null && c.covers(index)) {
                return c.leaf;
            }

            Node leaf = leafFor(root, index, depthOf(size));
            cache = new LeafCache(index & ~MASK, leaf);
            return leaf;
        }

        @Override
        @SuppressWarnings("unchecked")
        public A at(int i) {
            rangeCheck(i, size);
            return (A)leafAt(i).slots[i & MASK];
        }

        @Override
        public A last() {
            if (size == 0)
                throw new VectorUnderflowException();
            return at(size - 1);
        }

        @Override
        public Vector<A> append(A a) {
            capacityCheck(size);
            return new PersistentVector<>(pushLast(root, size, a, null), size + 1);
        }

        @Override
        public Vector<A> pop() {
            if (size == 0)
                throw new VectorUnderflowException("pop from empty vector");
            return vector(popLast(root, size, null), size - 1);
        }

        @Override
        public Vector<A> copy() {
            return append(null).pop();
        }

        @Override
        public Vector<A> concat(Vector<? extends A> other) {
            return concatAll(ImmutableList.of(other));
        }

        @Override
        public Vector<A> concatAll(Iterable<? extends Vector<? extends A>> others) {
            requireNonNull(others);
            TransientVector<A> t = asTransient();
            for (Vector<? extends A> v : others) {
                t.appendAll(v);
            }
            return t.freeze();
        }

        @Override
        public Vector<A> splice(int start, Iterable<? extends A> values) {
            requireNonNull(values);
            checkRange(start, size, size);

            TransientVector<A> t = VectorImpl.<A>empty().asTransient();
            forEachWithIndex((x, i) -> t.append(x), 0, start);
            t.appendAll(values);
            forEachWithIndex((x, i) -> t.append(x), start, size);
            return t.freeze();
        }

        @Override
        public Vector<A> slice() {
            return copy();
        }

        @Override
        public Vector<A> slice(int start, int end) {
            end = normalizeEnd(end, size);
            checkRange(start, end, size);

            TransientVector<A> t = VectorImpl.<A>empty().asTransient();
            forEachWithIndex((x, i) -> t.append(x), start, end);
            return t.freeze();
        }

        @Override
        @SuppressWarnings("unchecked")
        public void forEachWithIndex(ObjIntConsumer<? super A> action, int start, int end) {
            requireNonNull(action);
            end = normalizeEnd(end, size);
            checkRange(start, end, size);

            Node leaf = null;
            for (int i = start; i < end; i++) {
                if (leaf == null || (i & MASK) == 0)
                    leaf = leafAt(i);
                action.accept((A)leaf.slots[i & MASK], i);
            }
        }

        @Override
        public <R> R reduce(R init, BiFunction<R, ? super A, R> f) {
            requireNonNull(f);
            Ref<R> acc = new Ref<>(init);
            forEachWithIndex((x, i) -> acc.update(r -> f.apply(r, x)));
            return acc.get();
        }

        @Override
        public A reduce(BinaryOperator<A> f) {
            requireNonNull(f);
            if (size == 0)
                throw new VectorUnderflowException("reduce of empty vector with no initial value");

            Ref<A> acc = new Ref<>(at(0));
            forEachWithIndex((x, i) -> acc.update(r -> f.apply(r, x)), 1);
            return acc.get();
        }

        @Override
        public TransientVector<A> asTransient() {
            return new TransientVector<>(root, size);
        }

        @Override
        public Iterator<A> iterator() {
            return new VectorIterator<>(this);
        }

        @Override
        public Object[] toArray() {
            Object[] result = new Object[size];
            forEachWithIndex((x, i) -> result[i] = x);
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Vector))
                return false;
            Vector<?> other = (Vector<?>)obj;
            return size == other.size() && Iterators.elementsEqual(iterator(), other.iterator());
        }

        @Override
        public int hashCode() {
            return reduce(1, (h, x) -> 31 * h + Objects.hashCode(x));
        }

        @Override
        public String toString() {
            return reduce(new StringJoiner(", ", "[", "]"), (sj, x) -> sj.add(String.valueOf(x))).toString();
        }
    }

    /**
     * Iterates over a vector one leaf at a time.
     */
    static final class VectorIterator<A> implements Iterator<A> {
        private final PersistentVector<A> vec;
        private Node leaf;
        private int next;

        VectorIterator(PersistentVector<A> vec) {
            this.vec = vec;
        }

        @Override
        public boolean hasNext() {
            return next < vec.size();
        }

        @Override
        @SuppressWarnings("unchecked")
        public A next() {
            if (next >= vec.size())
                throw new NoSuchElementException();
            if (leaf == null || (next & MASK) == 0)
                leaf = vec.leafAt(next);
            return (A)leaf.slots[next++ & MASK];
        }
    }
}
