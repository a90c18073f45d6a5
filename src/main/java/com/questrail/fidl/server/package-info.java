/**
 * Server Dispatch Engine
 * =============================================================================
 *
 * <p>Drives the server side of a protocol over one channel: read a request,
 * route it by ordinal to the implementing method, check the handler's result
 * against the method's contract, write the response.</p>
 *
 * <h2>Architectural Placement</h2>
 *
 * <pre>
 *   Channel.read
 *     → MessageHeader (ordinal, txid)
 *       → ProtocolRole.methodMap     (MethodInfo)
 *         → ValueConstructor          (typed request)
 *           → HandlerTable / handler
 *             → result wrapping       (response / err / framework_err)
 *               → FidlCodec.encodeMessage → Channel.write
 * </pre>
 *
 * <h2>Failure model</h2>
 * <ul>
 *   <li>clean end: peer closed or {@link com.questrail.fidl.server.StopServer}</li>
 *   <li>fatal: {@link com.questrail.fidl.server.ServerException}, an
 *       unimplemented method, a transport failure or any handler error</li>
 * </ul>
 * Either way the channel is closed before the loop reports.
 *
 * <p>{@link com.questrail.fidl.server.DispatchLoop} and
 * {@link com.questrail.fidl.server.HandlerTable} are shared with the
 * client-side event handler.</p>
 */
package com.questrail.fidl.server;
