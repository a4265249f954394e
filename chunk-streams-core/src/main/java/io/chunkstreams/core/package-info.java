/**
 * Protocol-centric core for chunk streams.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>The stream key and chunk value types</li>
 *   <li>Wire constants and the SSE record model</li>
 *   <li>The shared exception hierarchy</li>
 * </ul>
 *
 * <p>Server and client bindings live in other modules.
 */
package io.chunkstreams.core;
