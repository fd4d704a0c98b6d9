package com.kaddht.core;

/**
 * State of the local node's network connectivity towards a given peer.
 *
 * <p>The values mirror the {@code ConnectionType} carried on wire peers, so a
 * peer descriptor placed in a response tells the requester how reachable that
 * peer looked from here.
 *
 * <pre>
 *     NOT_CONNECTED ──(dial succeeds)──► CONNECTED
 *           ▲                               │
 *           │                        (connection closed)
 *           │                               ▼
 *           └───(address expires)─── CAN_CONNECT
 * </pre>
 *
 * @see com.kaddht.routing.ConnectivityOracle
 */
public enum Connectedness {

    /**
     * No connection and no recent evidence that one could be made.
     */
    NOT_CONNECTED,

    /**
     * A live connection to the peer currently exists.
     */
    CONNECTED,

    /**
     * Not connected right now, but the peer was recently reachable at a known address.
     */
    CAN_CONNECT,

    /**
     * A recent attempt to connect to the peer failed.
     */
    CANNOT_CONNECT;

    /**
     * Returns true when a FIND_NODE answer may include the peer on the strength of
     * this state alone, i.e. the peer is connected or connectable.
     */
    public boolean isReachable() {
        return this == CONNECTED || this == CAN_CONNECT;
    }
}
