/**
 * Cloudway Trievec
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trievec.data;

import java.util.NoSuchElementException;

/**
 * Thrown when an element is removed or requested from an empty vector.
 */
public class VectorUnderflowException extends NoSuchElementException
{
    private static final long serialVersionUID = 7725137491560438392L;

    public VectorUnderflowException() {
        super("vector is empty");
    }

    public VectorUnderflowException(String message) {
        super(message);
    }
}
