package com.questrail.fidl.codec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

/**
 * MessageHeader
 * -----------------------------------------------------------------------------
 * The fixed 16-byte transactional header that starts every FIDL message.
 *
 * <pre>
 *   offset 0   uint32  txid
 *   offset 4   uint8[2] at-rest flags
 *   offset 6   uint8   dynamic flags
 *   offset 7   uint8   magic number
 *   offset 8   uint64  ordinal
 * </pre>
 *
 * All fields are little-endian.
 */
public record MessageHeader(
        long txid,
        int atRestFlags,
        int dynamicFlags,
        int magic,
        long ordinal
) {
    public static final int SIZE = 16;
    public static final int MAGIC_INITIAL = 0x01;

    /** At-rest flag: payload uses the V2 wire format. */
    public static final int AT_REST_FLAG_V2 = 0x0002;

    /** Dynamic flag: the method is flexible. */
    public static final int DYNAMIC_FLAG_FLEXIBLE = 0x80;

    public static MessageHeader of(long txid, long ordinal) {
        return new MessageHeader(txid, AT_REST_FLAG_V2, 0, MAGIC_INITIAL, ordinal);
    }

    /**
     * Parses the header at the start of a message.
     *
     * @throws IllegalArgumentException if the message is shorter than a header
     */
    public static MessageHeader parse(byte[] message) {
        if (message.length < SIZE) {
            throw new IllegalArgumentException("Message of " + message.length
                    + " bytes is shorter than the " + SIZE + "-byte header");
        }
        ByteBuf buf = Unpooled.wrappedBuffer(message);
        return new MessageHeader(
                buf.getUnsignedIntLE(0),
                buf.getUnsignedShortLE(4),
                buf.getUnsignedByte(6),
                buf.getUnsignedByte(7),
                buf.getLongLE(8));
    }

    public static long parseTxid(byte[] message) {
        return parse(message).txid();
    }

    public static long parseOrdinal(byte[] message) {
        return parse(message).ordinal();
    }

    public byte[] encode() {
        ByteBuf buf = Unpooled.buffer(SIZE, SIZE);
        buf.writeIntLE((int) txid);
        buf.writeShortLE(atRestFlags);
        buf.writeByte(dynamicFlags);
        buf.writeByte(magic);
        buf.writeLongLE(ordinal);
        return buf.array();
    }

    public boolean isFlexible() {
        return (dynamicFlags & DYNAMIC_FLAG_FLEXIBLE) != 0;
    }
}
