package dev.tmcp.server.session;

/**
 * Behaviour when a peer opens a new SSE stream while an earlier one is still live.
 */
public enum ReconnectPolicy {

	/** The new stream becomes the peer's session; the earlier one stays open until it ends. */
	REPLACE,

	/** The new stream is refused with {@link SessionConflictException}. */
	REJECT

}
