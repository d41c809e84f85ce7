/**
 * Cloudway Trievec
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trievec.data;

import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;

import com.cloudway.trievec.data.VectorImpl.LeafCache;
import com.cloudway.trievec.data.VectorImpl.Node;
import static com.cloudway.trievec.data.VectorImpl.MASK;
import static com.cloudway.trievec.data.VectorImpl.capacityCheck;
import static com.cloudway.trievec.data.VectorImpl.depthOf;
import static com.cloudway.trievec.data.VectorImpl.leafFor;
import static com.cloudway.trievec.data.VectorImpl.popLast;
import static com.cloudway.trievec.data.VectorImpl.pushLast;
import static com.cloudway.trievec.data.VectorImpl.rangeCheck;

/**
 * A mutable handle over a vector trie that owns the nodes it creates and
 * updates them in place. Nodes shared with persistent vectors are copied
 * before the first write, so the vector this transient was created from is
 * never affected.
 *
 * <p>A transient has a single owner: it must not be shared between threads
 * and no reference into its state may be kept across mutations. This is
 * not checked. Calling {@link #freeze()} gives up the mutation rights and
 * publishes the contents as a persistent {@link Vector}; any later use of
 * the transient throws {@link TransientOwnershipException}.</p>
 *
 * @param <A> the type of vector elements
 */
public final class TransientVector<A> {
    private Object edit = new Object();
    private Node root;
    private int size;
    private LeafCache cache;

    TransientVector(Node root, int size) {
        this.root = root;
        this.size = size;
    }

    private Object ensureEditable() {
        if (edit == null)
            throw new TransientOwnershipException("Transient vector used after freeze()");
        return edit;
    }

    /**
     * Returns the number of elements.
     */
    public int size() {
        ensureEditable();
        return size;
    }

    /**
     * Returns the number of internal tree levels above the leaves.
     */
    public int depth() {
        ensureEditable();
        return depthOf(size);
    }

    /**
     * Returns the element at the given index.
     *
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    @SuppressWarnings("unchecked")
    public A at(int i) {
        ensureEditable();
        rangeCheck(i, size);

        LeafCache c = cache;
        if (c == null || !c.covers(i)) {
            c = cache = new LeafCache(i & ~MASK, leafFor(root, i, depthOf(size)));
        }
        return (A)c.leaf.slots[i & MASK];
    }

    /**
     * Adds an element at the end.
     *
     * @return this transient
     */
    public TransientVector<A> append(A a) {
        Object e = ensureEditable();
        capacityCheck(size);
        root = pushLast(root, size, a, e);
        size++;
        cache = null;
        return this;
    }

    /**
     * Adds all elements of the given source at the end, in order.
     *
     * @return this transient
     */
    public TransientVector<A> appendAll(Iterable<? extends A> elements) {
        requireNonNull(elements);
        for (A a : elements) {
            append(a);
        }
        return this;
    }

    /**
     * Removes the last element.
     *
     * @return this transient
     * @throws VectorUnderflowException if the transient is empty
     */
    public TransientVector<A> pop() {
        Object e = ensureEditable();
        if (size == 0)
            throw new VectorUnderflowException("pop from empty vector");
        root = popLast(root, size, e);
        size--;
        cache = null;
        return this;
    }

    /**
     * Gives up the mutation rights of this transient and returns its
     * contents as a persistent vector.
     *
     * @throws TransientOwnershipException if already frozen
     */
    public Vector<A> freeze() {
        ensureEditable();
        edit = null;
        cache = null;
        return VectorImpl.vector(root, size);
    }

    Node root() {
        return root;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("size", size)
                          .add("frozen", edit == null)
                          .toString();
    }
}
