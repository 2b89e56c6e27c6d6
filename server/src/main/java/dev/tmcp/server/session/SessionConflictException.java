package dev.tmcp.server.session;

import dev.tmcp.TmcpException;

public class SessionConflictException extends TmcpException {

	public SessionConflictException(String peerDid) {
		super("A session is already open for " + peerDid);
	}

}
