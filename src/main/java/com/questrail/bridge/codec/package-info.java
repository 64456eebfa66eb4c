/**
 * Bridge Codec: Line-Delimited JSON
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> between raw text
 * lines on the child's standard streams and the structured messages in
 * {@link com.questrail.bridge.model}.</p>
 *
 * <h2>Wire rules</h2>
 * <ul>
 *   <li>One UTF-8 JSON object per line, newline-terminated.</li>
 *   <li>Requests (app to child): {@code id}, {@code method}, {@code params}.</li>
 *   <li>Responses (child to app): {@code id}, optional {@code result},
 *       optional string {@code error}.</li>
 *   <li>Events (child to app): {@code event}, {@code data}.</li>
 * </ul>
 *
 * <h2>Architectural placement</h2>
 * <pre>
 *   String line
 *        → BridgeMessageDecoder   (shape classification here)
 *            → BridgeResponse | BridgeEvent
 *                → StdoutDemultiplexer (routing)
 * </pre>
 *
 * <p>Nothing in this package performs I/O, correlation or logging.</p>
 */
package com.questrail.bridge.codec;
