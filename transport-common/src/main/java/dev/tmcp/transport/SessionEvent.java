package dev.tmcp.transport;

/**
 * Plaintext of a sealed SSE event. The event kind travels inside the envelope so that it is
 * authenticated together with its data.
 * @param type kind of event
 * @param data event payload: the escaped callback path or a serialized JSON-RPC message
 */
public record SessionEvent(SessionEventType type, String data) {

    public static SessionEvent endpoint(String path) {
        return new SessionEvent(SessionEventType.ENDPOINT, path);
    }

    public static SessionEvent message(String json) {
        return new SessionEvent(SessionEventType.MESSAGE, json);
    }

}
