/**
 * Bridge Transport Port
 * =============================================================================
 *
 * This package defines the <em>process-agnostic transport boundary</em> between
 * a concrete child process (a spawned {@code node} service, or a test double
 * backed by in-memory pipes) and the request/response client.
 *
 * <p>Everything above the port sees only:</p>
 * <ul>
 *   <li>the child's stdin as an {@link java.io.OutputStream}</li>
 *   <li>the child's stdout and stderr as {@link java.io.InputStream}s</li>
 *   <li>a forcible, blocking teardown</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of the port MUST:
 * <ul>
 *   <li>Perform process I/O only (no framing or message interpretation)</li>
 *   <li>Not correlate requests or responses</li>
 *   <li>Not restart a dead process</li>
 * </ul>
 *
 * <p>Locating and spawning the real service lives in
 * {@link com.questrail.bridge.transport.process}.</p>
 */
package com.questrail.bridge.transport;
