package com.kaddht.routing;

import com.google.common.hash.Hashing;
import com.kaddht.core.PeerId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Flat routing table ordering peers by XOR distance in the sha2-256 keyspace.
 *
 * <p>Both peer identifiers and lookup keys are hashed with sha2-256 before the
 * distance is computed, so every key maps into the same 256-bit space. The table
 * holds at most {@code capacity} peers; once full, adding a peer evicts the one
 * seen least recently. The local node is never added.
 */
public class XorRoutingTable implements RoutingTable {

    private static final Logger logger = LoggerFactory.getLogger(XorRoutingTable.class);

    public static final int DEFAULT_CAPACITY = 1024;

    private final PeerId self;
    private final int capacity;

    // peer -> its position in the keyspace, least recently seen first
    private final LinkedHashMap<PeerId, byte[]> peers = new LinkedHashMap<>(16, 0.75f, true);

    public XorRoutingTable(PeerId self) {
        this(self, DEFAULT_CAPACITY);
    }

    public XorRoutingTable(PeerId self, int capacity) {
        this.self = self;
        this.capacity = capacity;
    }

    @Override
    public List<PeerId> closerPeers(byte[] target, PeerId exclude, int count) {
        byte[] targetId = keyspaceId(target);
        List<Map.Entry<PeerId, byte[]>> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(peers.entrySet());
        }
        return snapshot.stream()
                .filter(e -> !e.getKey().equals(exclude))
                .sorted(Comparator.comparing(Map.Entry::getValue, (a, b) -> compareDistance(a, b, targetId)))
                .limit(count)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean update(PeerId peer) {
        if (peer.equals(self)) {
            return false;
        }
        if (peers.get(peer) != null) {
            // access order moves it to the most recently seen end
            return true;
        }
        if (peers.size() >= capacity) {
            Iterator<PeerId> eldest = peers.keySet().iterator();
            PeerId evicted = eldest.next();
            eldest.remove();
            logger.debug("Routing table full, evicted {} for {}", evicted, peer);
        }
        peers.put(peer, keyspaceId(peer.toByteArray()));
        logger.debug("Added {} to routing table (size={})", peer, peers.size());
        return true;
    }

    @Override
    public synchronized void remove(PeerId peer) {
        if (peers.remove(peer) != null) {
            logger.debug("Removed {} from routing table", peer);
        }
    }

    public synchronized boolean contains(PeerId peer) {
        return peers.containsKey(peer);
    }

    public synchronized int size() {
        return peers.size();
    }

    static byte[] keyspaceId(byte[] key) {
        return Hashing.sha256().hashBytes(key).asBytes();
    }

    /**
     * Compares the XOR distances of {@code a} and {@code b} to {@code target}.
     */
    static int compareDistance(byte[] a, byte[] b, byte[] target) {
        for (int i = 0; i < target.length; i++) {
            int da = (a[i] ^ target[i]) & 0xff;
            int db = (b[i] ^ target[i]) & 0xff;
            if (da != db) {
                return Integer.compare(da, db);
            }
        }
        return 0;
    }
}
