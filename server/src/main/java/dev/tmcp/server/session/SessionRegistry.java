package dev.tmcp.server.session;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live SSE sessions keyed by peer DID. Each peer maps to an immutable list of handles ordered by
 * registration; every mutation replaces that list atomically, so a lookup never sees a half
 * registered or half removed session.
 */
public class SessionRegistry {

	private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

	private final ConcurrentHashMap<String, List<SessionHandle>> sessions = new ConcurrentHashMap<>();

	private final ReconnectPolicy reconnectPolicy;

	public SessionRegistry(ReconnectPolicy reconnectPolicy) {
		this.reconnectPolicy = reconnectPolicy;
	}

	/**
	 * Make {@code handle} the peer's current session.
	 * @throws SessionConflictException under {@link ReconnectPolicy#REJECT} while another session of
	 * the peer is open
	 */
	public void register(SessionHandle handle) {
		this.sessions.compute(handle.peerDid(), (peerDid, current) -> {
			List<SessionHandle> next = new ArrayList<>();
			if (current != null) {
				current.stream().filter(SessionHandle::isOpen).forEach(next::add);
			}
			if (this.reconnectPolicy == ReconnectPolicy.REJECT && !next.isEmpty()) {
				throw new SessionConflictException(peerDid);
			}
			if (!next.isEmpty()) {
				logger.info("Replacing session of {}", peerDid);
			}
			next.add(handle);
			return List.copyOf(next);
		});
		logger.debug("Registered {}", handle);
	}

	/**
	 * Remove exactly this handle; sessions registered later for the same peer are kept.
	 */
	public void remove(SessionHandle handle) {
		this.sessions.computeIfPresent(handle.peerDid(), (peerDid, current) -> {
			List<SessionHandle> next = new ArrayList<>(current.size());
			for (SessionHandle candidate : current) {
				if (candidate != handle) {
					next.add(candidate);
				}
			}
			return next.isEmpty() ? null : List.copyOf(next);
		});
		logger.debug("Removed {}", handle);
	}

	/**
	 * @return the most recently registered session of the peer that is still open
	 */
	public Optional<SessionHandle> lookup(String peerDid) {
		List<SessionHandle> current = this.sessions.get(peerDid);
		if (current == null) {
			return Optional.empty();
		}
		for (int i = current.size() - 1; i >= 0; i--) {
			if (current.get(i).isOpen()) {
				return Optional.of(current.get(i));
			}
		}
		return Optional.empty();
	}

	public int size() {
		return this.sessions.size();
	}

}
