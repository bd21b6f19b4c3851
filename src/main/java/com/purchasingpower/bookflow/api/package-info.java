/**
 * REST API layer: the chat endpoint and read access to the audit log.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code ChatController} - one message in, one reply out</li>
 *   <li>{@code LogController} - recent execution logs</li>
 * </ul>
 */
package com.purchasingpower.bookflow.api;
