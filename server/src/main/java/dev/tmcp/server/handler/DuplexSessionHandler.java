package dev.tmcp.server.handler;

import dev.tmcp.transport.DuplexStreams;

/**
 * Application side of a secure session. Invoked once per opened session on a transport thread; the
 * session ends when this method returns or the streams close.
 */
@FunctionalInterface
public interface DuplexSessionHandler {

	void handle(DuplexStreams streams) throws Exception;

}
