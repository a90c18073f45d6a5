package com.questrail.fidl.codec;

import java.util.List;

/**
 * FidlCodec
 * -----------------------------------------------------------------------------
 * Port to the native FIDL encoder/decoder.
 *
 * <p>Decoded payloads are returned in <em>plain</em> form: structs and tables
 * as {@code Map<String, Object>} keyed by member name (absent table members
 * map to {@code null}), unions as a single-entry map, vectors and arrays as
 * {@link List}, enums and bits as integers, handles as their raw value.
 * {@link ValueConstructor} turns that into typed values.</p>
 *
 * <p>Objects handed to the encoder are typed runtime values
 * ({@code RecordValue}, {@code UnionValue}, ...) or {@code null} for an empty
 * payload; {@link ValueConstructor#toPlain(Object)} gives implementations the
 * inverse of the decoded form.</p>
 */
public interface FidlCodec
{
    /**
     * Decodes the payload of an inbound message (header included in {@code bytes}).
     *
     * @param bytes   the complete message bytes
     * @param handles raw handle values transferred with the message
     * @return the payload in plain form, or {@code null} for an empty payload
     */
    Object decodeMessage(byte[] bytes, List<Long> handles);

    /**
     * Encodes a complete message, header included.
     *
     * @param ordinal  method ordinal
     * @param object   payload, or {@code null} for an empty payload
     * @param library  library that declares the method
     * @param txid     transaction id ({@code 0} for one-way messages and events)
     * @param typeName raw fully-qualified payload type name, or {@code null}
     */
    EncodedMessage encodeMessage(long ordinal, Object object, String library, long txid, String typeName);

    /**
     * Encodes a standalone value (no message header).
     *
     * @param object   the value to encode
     * @param library  library that declares the value's type
     * @param typeName raw fully-qualified type name
     */
    EncodedMessage encodeObject(Object object, String library, String typeName);
}
