/**
 * Cloudway Trievec
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trievec.data;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.IntFunction;
import java.util.function.ObjIntConsumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.Lists;

/**
 * A persistent indexed sequence backed by a bitmapped vector trie.
 *
 * <p>Every node has a fixed number of slots ({@code 2^bits}, configured once
 * through the {@code trievec.vector.bits} property). Indexed access, append
 * and removal from the end walk one root-to-leaf path and take
 * O(log<sub>W</sub> n) time. Operations that change the vector return a new
 * vector which shares all untouched subtrees with the original; the original
 * is never modified.</p>
 *
 * <p>A vector is immutable and may be read from any number of threads
 * without synchronization. For batch construction use {@link #asTransient()}
 * and {@link TransientVector#freeze()}.</p>
 *
 * <p>Ranges are half-open: {@code [start, end)}. An omitted {@code end}
 * defaults to {@link #size()}, a negative {@code end} counts back from
 * {@code size()}.</p>
 *
 * @param <A> the type of vector elements
 */
public interface Vector<A> extends Iterable<A> {
    /**
     * Returns an empty vector.
     */
    static <A> Vector<A> empty() {
        return VectorImpl.empty();
    }

    /**
     * Construct a vector with given elements.
     */
    @SafeVarargs
    static <A> Vector<A> of(A... elements) {
        return fromList(Arrays.asList(elements));
    }

    /**
     * Construct a vector from the elements of an ordered source.
     */
    static <A> Vector<A> fromList(Iterable<? extends A> elements) {
        requireNonNull(elements);
        return VectorImpl.<A>empty().asTransient().appendAll(elements).freeze();
    }

    /**
     * Construct a vector of length {@code n} whose elements are
     * {@code f(0), f(1), ..., f(n-1)}.
     *
     * @throws IllegalArgumentException if {@code n} is negative
     */
    static <A> Vector<A> iterate(int n, IntFunction<? extends A> f) {
        requireNonNull(f);
        if (n < 0)
            throw new IllegalArgumentException("iterate called with negative length");

        TransientVector<A> t = VectorImpl.<A>empty().asTransient();
        for (int i = 0; i < n; i++) {
            t.append(f.apply(i));
        }
        return t.freeze();
    }

    /**
     * Concatenates vectors in order.
     */
    @SafeVarargs
    static <A> Vector<A> join(Vector<A> first, Vector<? extends A>... rest) {
        return first.concatAll(Arrays.asList(rest));
    }

    /**
     * Returns the number of elements in this vector.
     */
    int size();

    /**
     * Returns true if this vector contains no elements.
     */
    boolean isEmpty();

    /**
     * Returns the number of internal tree levels above the leaves.
     */
    int depth();

    /**
     * Returns the element at the given index.
     *
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    A at(int i);

    /**
     * Returns the last element.
     *
     * @throws VectorUnderflowException if this vector is empty
     */
    A last();

    /**
     * Returns a vector with the given element added at the end.
     */
    Vector<A> append(A a);

    /**
     * Returns a vector without the last element.
     *
     * @throws VectorUnderflowException if this vector is empty
     */
    Vector<A> pop();

    /**
     * Returns a snapshot of this vector that shares all but the rightmost
     * path with this vector.
     */
    Vector<A> copy();

    /**
     * Returns a vector with the elements of {@code other} appended.
     */
    Vector<A> concat(Vector<? extends A> other);

    /**
     * Returns a vector with the elements of every given vector appended,
     * in order.
     */
    Vector<A> concatAll(Iterable<? extends Vector<? extends A>> others);

    /**
     * Returns a new vector holding the elements before {@code start}, then
     * all of {@code values}, then the elements from {@code start} on. The
     * result is rebuilt from scratch and shares nothing with this vector.
     *
     * @throws InvalidRangeException if {@code start} is not in {@code [0, size]}
     */
    Vector<A> splice(int start, Iterable<? extends A> values);

    /**
     * Returns a snapshot copy of the whole vector.
     */
    Vector<A> slice();

    /**
     * Returns the elements from {@code start} to the end.
     *
     * @throws InvalidRangeException if {@code start} is not in {@code [0, size]}
     */
    default Vector<A> slice(int start) {
        return slice(start, size());
    }

    /**
     * Returns the elements in {@code [start, end)}. A negative {@code end}
     * is interpreted as {@code size + end}.
     *
     * @throws InvalidRangeException if the normalized range is not within
     * {@code [0, size]} or {@code end < start}
     */
    Vector<A> slice(int start, int end);

    /**
     * Performs the given action for each element with its index.
     */
    default void forEachWithIndex(ObjIntConsumer<? super A> action) {
        forEachWithIndex(action, 0, size());
    }

    /**
     * Performs the given action for each element with its index, starting
     * at {@code start}.
     */
    default void forEachWithIndex(ObjIntConsumer<? super A> action, int start) {
        forEachWithIndex(action, start, size());
    }

    /**
     * Performs the given action for each element in {@code [start, end)}
     * with its index. A negative {@code end} is interpreted as
     * {@code size + end}.
     *
     * @throws InvalidRangeException if the normalized range is invalid
     */
    void forEachWithIndex(ObjIntConsumer<? super A> action, int start, int end);

    /**
     * Reduce the vector from left to right, starting from the given value.
     */
    <R> R reduce(R init, BiFunction<R, ? super A, R> f);

    /**
     * Reduce the vector from left to right, using the first element as the
     * initial value.
     *
     * @throws VectorUnderflowException if this vector is empty
     */
    A reduce(BinaryOperator<A> f);

    /**
     * Returns a transient vector initialized with the elements of this vector.
     * This vector is not affected by mutations of the transient.
     */
    TransientVector<A> asTransient();

    /**
     * Returns the elements in an array.
     */
    Object[] toArray();

    /**
     * Returns the elements in an unmodifiable list.
     */
    default List<A> toList() {
        return Collections.unmodifiableList(Lists.newArrayList(this));
    }

    /**
     * Returns a sequential stream over the elements.
     */
    default Stream<A> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    @Override
    default Spliterator<A> spliterator() {
        return Spliterators.spliterator(iterator(), size(), Spliterator.ORDERED);
    }

    @Override
    Iterator<A> iterator();
}
