/**
 * Chat vocabulary shared by server and client.
 *
 * <p>This module has no HTTP, storage or JSON library dependencies. It models the event union carried by the
 * distribution bus, the persisted and viewer-facing records, the error taxonomy and the SSE framing.
 */
package io.chatbox.core;
