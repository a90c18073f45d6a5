/**
 * Protocol Compiler
 * =============================================================================
 *
 * <p>Turns a protocol declaration into a {@link com.questrail.fidl.protocol.ProtocolType}
 * holding three {@link com.questrail.fidl.protocol.ProtocolRole}s (client,
 * server, event handler), each with the methods it sends, the methods it
 * receives and an ordinal-keyed dispatch map.</p>
 *
 * <p>Ordinals must be non-zero and unique within a protocol.</p>
 */
package com.questrail.fidl.protocol;
