/**
 * Cloudway Trievec
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trievec.data;

/**
 * Thrown when a slice or splice range falls outside of a vector, or the
 * normalized end of a range precedes its start.
 */
public class InvalidRangeException extends IllegalArgumentException
{
    private static final long serialVersionUID = -2358167720349183716L;

    private final int start;
    private final int end;
    private final int size;

    public InvalidRangeException(int start, int end, int size) {
        super("Range: [" + start + ", " + end + "), Size: " + size);
        this.start = start;
        this.end = end;
        this.size = size;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getSize() {
        return size;
    }
}
