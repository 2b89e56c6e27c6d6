package dev.tmcp.transport;

/**
 * Kinds of events carried on an SSE stream.
 */
public enum SessionEventType {

    /** First event of a stream; carries the path the client must POST to. */
    ENDPOINT("endpoint"),

    /** A sealed JSON-RPC message for the client. */
    MESSAGE("message");

    private final String wireName;

    SessionEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return this.wireName;
    }

    public static SessionEventType fromWireName(String wireName) {
        for (SessionEventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown SSE event: " + wireName);
    }
}
