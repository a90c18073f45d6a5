/**
 * Codec Port
 * =============================================================================
 *
 * <p>This package defines the boundary between the binding runtime and the
 * native FIDL wire codec. The codec owns every byte-level rule (inline and
 * out-of-line layout, envelopes, handle tables); the runtime never encodes a
 * payload itself.</p>
 *
 * <h2>Architectural Placement</h2>
 *
 * <pre>
 *   ChannelReadResult.Message (bytes + handles)
 *        → MessageHeader          (txid, ordinal; parsed here)
 *            → FidlCodec.decodeMessage   (payload as maps / lists / scalars)
 *                → ValueConstructor       (typed RecordValue / UnionValue / ...)
 *                    → user handler
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>{@link com.questrail.fidl.codec.FidlCodec} is implemented outside this
 *       project; tests use a JSON stand-in.</li>
 *   <li>{@link com.questrail.fidl.codec.MessageHeader} is the only wire
 *       structure the runtime reads, because dispatch needs the ordinal and
 *       transaction id before the payload can be decoded.</li>
 * </ul>
 */
package com.questrail.fidl.codec;
