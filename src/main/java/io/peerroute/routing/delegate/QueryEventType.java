package io.peerroute.routing.delegate;

/**
 * Event kinds streamed by the delegate's DHT endpoints, by wire code.
 */
public enum QueryEventType {
    SENDING_QUERY(0),
    PEER_RESPONSE(1),
    FINAL_PEER(2),
    QUERY_ERROR(3),
    PROVIDER(4),
    VALUE(5),
    ADDING_PEER(6),
    DIALING_PEER(7),
    UNKNOWN(-1);

    private static final QueryEventType[] BY_CODE = {
            SENDING_QUERY, PEER_RESPONSE, FINAL_PEER, QUERY_ERROR, PROVIDER, VALUE, ADDING_PEER, DIALING_PEER
    };

    private final int code;

    QueryEventType(final int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static QueryEventType fromCode(final int code) {
        return code >= 0 && code < BY_CODE.length ? BY_CODE[code] : UNKNOWN;
    }
}
