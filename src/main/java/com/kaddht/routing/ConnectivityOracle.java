package com.kaddht.routing;

import com.kaddht.core.Connectedness;
import com.kaddht.core.PeerId;

/**
 * Answers how reachable a peer currently is from this node.
 *
 * <p>Implemented by the transports, which are the only components that know
 * about live connections.
 */
@FunctionalInterface
public interface ConnectivityOracle {

    Connectedness connectedness(PeerId peer);
}
