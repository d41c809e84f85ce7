/**
 * Cloudway Trievec
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trievec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import com.cloudway.trievec.data.InvalidRangeException;
import com.cloudway.trievec.data.Vector;
import com.cloudway.trievec.data.VectorUnderflowException;

public class VectorTest {
    private static final int N = 100;
    private Vector<Integer> vec;

    @Before
    public void init() {
        vec = Vector.iterate(N, i -> i);
    }

    private static List<Integer> range(int from, int to) {
        List<Integer> xs = new ArrayList<>();
        for (int i = from; i < to; i++) {
            xs.add(i);
        }
        return xs;
    }

    @Test
    public void at() {
        assertEquals(N, vec.size());
        for (int i = 0; i < N; i++) {
            assertEquals(i, (int)vec.at(i));
        }
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void at_negative() {
        vec.at(-1);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void at_past_end() {
        vec.at(N);
    }

    @Test
    public void empty() {
        Vector<String> xs = Vector.empty();
        assertTrue(xs.isEmpty());
        assertEquals(0, xs.size());
        assertEquals(0, xs.depth());
        assertFalse(xs.iterator().hasNext());
    }

    @Test
    public void six_elements_fit_in_two_levels() {
        Vector<Integer> xs = Vector.of(0, 1, 2, 3, 4, 5);
        assertEquals(4, (int)xs.at(4));
        assertEquals(1, xs.depth());
    }

    @Test
    public void append() {
        Vector<Integer> xs = vec.append(9999);
        assertEquals(N + 1, xs.size());
        for (int i = 0; i < N; i++) {
            assertEquals("append " + i, i, (int)xs.at(i));
        }
        assertEquals(9999, (int)xs.at(N));
        assertEquals(N, vec.size());
    }

    @Test
    public void append_one_by_one() {
        Vector<Integer> xs = Vector.empty();
        for (int i = 0; i < N; i++) {
            xs = xs.append(i);
            assertEquals(i + 1, xs.size());
            assertEquals(i, (int)xs.last());
        }
        assertEquals(vec, xs);
    }

    @Test
    public void pop_after_append() {
        for (int n = 1; n <= N; n++) {
            Vector<Integer> xs = Vector.iterate(n, i -> i);
            Vector<Integer> ys = xs.append(-1).pop();
            assertEquals("pop " + n, n, ys.size());
            for (int i = 0; i < n; i++) {
                assertEquals("pop " + n, i, (int)ys.at(i));
            }
        }
    }

    @Test
    public void pop_to_empty() {
        Vector<Integer> xs = vec;
        for (int n = N; n > 0; n--) {
            xs = xs.pop();
            assertEquals(n - 1, xs.size());
            assertEquals(range(0, n - 1), xs.toList());
        }
        assertTrue(xs.isEmpty());
        assertEquals(range(0, N), vec.toList());
    }

    @Test(expected = VectorUnderflowException.class)
    public void pop_empty() {
        Vector.empty().pop();
    }

    @Test(expected = VectorUnderflowException.class)
    public void last_empty() {
        Vector.empty().last();
    }

    @Test
    public void versions_are_independent() {
        Vector<Integer> v1 = vec.append(100);
        Vector<Integer> v2 = vec.pop().append(-1);
        Vector<Integer> v3 = v1.append(101);

        assertEquals(range(0, N), vec.toList());
        assertEquals(range(0, N + 1), v1.toList());
        assertEquals(-1, (int)v2.at(N - 1));
        assertEquals(N, v2.size());
        assertEquals(range(0, N + 2), v3.toList());
    }

    @Test
    public void depth_grows_at_powers_of_width() {
        assertEquals(0, Vector.iterate(4, i -> i).depth());
        assertEquals(1, Vector.iterate(5, i -> i).depth());
        assertEquals(1, Vector.iterate(16, i -> i).depth());
        assertEquals(2, Vector.iterate(17, i -> i).depth());
        assertEquals(1, Vector.iterate(17, i -> i).pop().depth());
    }

    @Test
    public void copy() {
        Vector<Integer> xs = vec.copy();
        assertNotSame(vec, xs);
        assertEquals(vec, xs);
        assertTrue(Vector.empty().copy().isEmpty());
    }

    @Test
    public void concat() {
        Vector<Integer> xs = Vector.join(Vector.of(0, 1), Vector.of(2, 3), Vector.of(4, 5));
        assertEquals(6, xs.size());
        assertEquals(Arrays.asList(0, 1, 2, 3, 4, 5), xs.toList());
    }

    @Test
    public void concat_leaves_receiver_unchanged() {
        Vector<Integer> other = Vector.iterate(N, i -> N + i);
        Vector<Integer> xs = vec.concat(other);
        assertEquals(range(0, 2 * N), xs.toList());
        assertEquals(range(0, N), vec.toList());
        assertEquals(N, other.size());
    }

    @Test
    public void concat_all() {
        Vector<Integer> xs = Vector.<Integer>empty().concatAll(
            Arrays.asList(Vector.of(0), Vector.<Integer>empty(), vec.slice(1)));
        assertEquals(vec, xs);
        assertEquals(vec, vec.concatAll(Collections.emptyList()));
    }

    @Test
    public void splice() {
        Vector<Integer> xs = Vector.of(0, 1, 2, 3, 4, 5).splice(1, Collections.singletonList(99));
        assertEquals(Arrays.asList(0, 99, 1, 2, 3, 4, 5), xs.toList());
        assertEquals(114, (int)xs.reduce(0, Integer::sum));
        assertEquals(114, (int)xs.reduce(Integer::sum));
    }

    @Test
    public void splice_every_position() {
        List<Integer> values = Arrays.asList(-1, -2, -3);
        for (int i = 0; i <= N; i++) {
            Vector<Integer> xs = vec.splice(i, values);
            List<Integer> expected = range(0, i);
            expected.addAll(values);
            expected.addAll(range(i, N));
            assertEquals("splice " + i, expected, xs.toList());
        }
    }

    @Test(expected = InvalidRangeException.class)
    public void splice_past_end() {
        vec.splice(N + 1, Collections.singletonList(0));
    }

    @Test(expected = InvalidRangeException.class)
    public void splice_negative() {
        vec.splice(-1, Collections.singletonList(0));
    }

    @Test
    public void slice() {
        Vector<Integer> xs = Vector.of(0, 1, 2, 3, 4, 5);
        assertEquals(Arrays.asList(2, 3, 4), xs.slice(2, -1).toList());
        assertEquals(Arrays.asList(2, 3, 4, 5), xs.slice(2).toList());
        assertEquals(Arrays.asList(2, 3, 4, 5), xs.slice(2, 6).toList());
        assertEquals(xs, xs.slice());
        assertTrue(xs.slice(3, 3).isEmpty());
        assertTrue(xs.slice(6).isEmpty());
    }

    @Test
    public void slice_every_range() {
        for (int i = 0; i <= N; i += 7) {
            for (int j = i; j <= N; j += 5) {
                assertEquals("slice " + i + ", " + j, range(i, j), vec.slice(i, j).toList());
            }
        }
    }

    @Test
    public void slice_invalid() {
        int[][] ranges = { {4, 2}, {0, N + 1}, {-1, 3}, {0, -N - 1}, {N + 1, N + 1} };
        for (int[] r : ranges) {
            try {
                vec.slice(r[0], r[1]);
                fail("slice " + r[0] + ", " + r[1]);
            } catch (InvalidRangeException ex) {
                assertEquals(N, ex.getSize());
            }
        }
    }

    @Test
    public void for_each_with_index() {
        List<Integer> values = new ArrayList<>();
        List<Integer> indices = new ArrayList<>();
        vec.forEachWithIndex((x, i) -> { values.add(x); indices.add(i); });
        assertEquals(range(0, N), values);
        assertEquals(range(0, N), indices);
    }

    @Test
    public void for_each_with_index_range() {
        List<Integer> indices = new ArrayList<>();
        vec.forEachWithIndex((x, i) -> {
            assertEquals(i, (int)x);
            indices.add(i);
        }, 3, -2);
        assertEquals(range(3, N - 2), indices);

        indices.clear();
        vec.forEachWithIndex((x, i) -> indices.add(i), N - 5);
        assertEquals(range(N - 5, N), indices);
    }

    @Test(expected = InvalidRangeException.class)
    public void for_each_with_index_past_end() {
        vec.forEachWithIndex((x, i) -> {}, 0, N + 1);
    }

    @Test
    public void reduce() {
        assertEquals(N * (N - 1) / 2, (int)vec.reduce(0, Integer::sum));
        assertEquals(N * (N - 1) / 2, (int)vec.reduce(Integer::sum));
        assertEquals("init", Vector.<String>empty().reduce("init", String::concat));
        assertEquals("abc", Vector.of("a", "b", "c").reduce(String::concat));
        assertEquals(7, (int)Vector.of(7).reduce(Integer::sum));
    }

    @Test(expected = VectorUnderflowException.class)
    public void reduce_empty() {
        Vector.<Integer>empty().reduce(Integer::sum);
    }

    @Test
    public void iterator() {
        List<Integer> xs = new ArrayList<>();
        for (Integer x : vec) {
            xs.add(x);
        }
        assertEquals(range(0, N), xs);
        assertEquals(N * (N - 1) / 2, vec.stream().mapToInt(Integer::intValue).sum());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void to_list_is_unmodifiable() {
        vec.toList().add(0);
    }

    @Test
    public void to_array() {
        assertArrayEquals(range(0, N).toArray(), vec.toArray());
    }

    @Test
    public void null_elements() {
        Vector<String> xs = Vector.of("a", null, "c");
        assertNull(xs.at(1));
        assertEquals(Arrays.asList("a", null, "c"), xs.toList());
        assertEquals("[a, null, c]", xs.toString());
    }

    @Test
    public void equality() {
        assertEquals(Vector.iterate(N, i -> i), vec);
        assertEquals(range(0, N).hashCode(), vec.hashCode());
        assertThat(vec.append(0), is(not(vec)));
        assertThat(vec.pop(), is(not(vec)));
        assertThat(Vector.fromList(range(0, N)), is(vec));
        assertEquals("[0, 1, 2]", Vector.of(0, 1, 2).toString());
        assertEquals("[]", Vector.empty().toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void iterate_negative() {
        Vector.iterate(-1, i -> i);
    }

    @Test(expected = NullPointerException.class)
    public void from_null_list() {
        Vector.fromList(null);
    }

    @Test(expected = NullPointerException.class)
    public void splice_null_values() {
        vec.splice(0, null);
    }

    @Test(expected = NullPointerException.class)
    public void for_each_with_null_action() {
        vec.forEachWithIndex(null);
    }

    @Test(expected = NullPointerException.class)
    public void concat_all_null() {
        vec.concatAll(null);
    }
}
