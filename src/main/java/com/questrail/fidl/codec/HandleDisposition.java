package com.questrail.fidl.codec;

/**
 * One handle to transfer with an outbound message: the operation (move or
 * duplicate), the raw handle, the expected object type and rights, and the
 * per-handle result slot filled in by the transport.
 */
public record HandleDisposition(
        int operation,
        long handle,
        int type,
        int rights,
        int result
) {
    public static final int OPERATION_MOVE = 0;
    public static final int OPERATION_DUPLICATE = 1;
}
