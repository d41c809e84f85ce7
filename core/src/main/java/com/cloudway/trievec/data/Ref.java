/**
 * Cloudway Trievec
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trievec.data;

import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * A mutable cell that lambdas can capture to carry an accumulator across
 * callback invocations.
 */
final class Ref<V> implements Supplier<V> {
    private V value;

    Ref(V initialValue) {
        this.value = initialValue;
    }

    @Override
    public V get() {
        return value;
    }

    /**
     * Replaces the current value with the result of the given function.
     *
     * @return the updated value
     */
    V update(UnaryOperator<V> updater) {
        return value = updater.apply(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
