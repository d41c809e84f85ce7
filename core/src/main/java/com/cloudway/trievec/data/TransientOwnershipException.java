/**
 * Cloudway Trievec
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trievec.data;

/**
 * Thrown when a {@link TransientVector} is used after its mutation rights
 * were given up by {@link TransientVector#freeze()}.
 */
public class TransientOwnershipException extends IllegalStateException
{
    private static final long serialVersionUID = 3140870462351857720L;

    public TransientOwnershipException(String message) {
        super(message);
    }
}
