package com.kaddht.handler;

import com.kaddht.core.ContentId;
import com.kaddht.core.InvalidRequestException;
import com.kaddht.core.PeerId;
import com.kaddht.core.PeerInfo;
import com.kaddht.core.RequestCancelledException;
import com.kaddht.datastore.DatastoreException;
import com.kaddht.datastore.DatastoreKey;
import com.kaddht.rpc.MessageCodec;
import com.kaddht.rpc.proto.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles GET_PROVIDERS and ADD_PROVIDER on top of the provider index.
 *
 * <p>Keys are parsed as content identifiers; a key that does not parse is a
 * malformed request. A peer may only announce itself as a provider.
 */
public class ProviderHandler {

    private static final Logger logger = LoggerFactory.getLogger(ProviderHandler.class);

    private final DhtContext context;
    private final CloserPeers closerPeers;

    public ProviderHandler(DhtContext context, CloserPeers closerPeers) {
        this.context = context;
        this.closerPeers = closerPeers;
    }

    // ==================== GET_PROVIDERS ====================

    /**
     * Answers with the known providers of a content identifier, this node included
     * when it holds the content, and with closer peers.
     *
     * @throws InvalidRequestException if the key is not a content identifier
     */
    public Message handleGetProviders(PeerId from, Message request) {
        ContentId cid = ContentId.cast(request.getKey().toByteArray());
        logger.debug("{} handleGetProviders for {} from {}", context.getSelf(), cid, from);

        Message.Builder response = MessageCodec.newResponse(request);

        boolean hasLocally = hasLocally(cid);

        RequestCancelledException.checkNotCancelled("before reading providers of " + cid);
        List<PeerId> providers = new ArrayList<>(context.getProviders().getProviders(cid));
        if (hasLocally && !providers.contains(context.getSelf())) {
            providers.add(context.getSelf());
        }

        if (!providers.isEmpty()) {
            List<PeerInfo> infos = context.getAddressBook().peerInfos(providers);
            response.addAllProviderPeers(MessageCodec.toWirePeers(infos, context.getConnectivity()));
        }

        // Also send closer peers so the lookup can continue.
        List<PeerId> closer = closerPeers.select(request.getKey().toByteArray(), from);
        if (!closer.isEmpty()) {
            List<PeerInfo> infos = context.getAddressBook().peerInfos(closer);
            response.addAllCloserPeers(MessageCodec.toWirePeers(infos, context.getConnectivity()));
        }

        return response.build();
    }

    private boolean hasLocally(ContentId cid) {
        String dsKey = DatastoreKey.encode(cid.toBytes());
        try {
            return context.getDatastore().has(dsKey);
        } catch (DatastoreException e) {
            logger.debug("Local possession check for {} failed, treating as absent: {}", cid, e.getMessage());
            return false;
        }
    }

    // ==================== ADD_PROVIDER ====================

    /**
     * Records the requesting peer as a provider of a content identifier.
     *
     * <p>Provider entries naming a different peer, or carrying no addresses, are ignored.
     *
     * @return always null; ADD_PROVIDER has no response payload
     * @throws InvalidRequestException if the key is not a content identifier
     */
    public Message handleAddProvider(PeerId from, Message request) {
        ContentId cid = ContentId.cast(request.getKey().toByteArray());
        logger.debug("{} adding provider of {} from {}", context.getSelf(), cid, from);

        // add provider should use the address given in the message
        for (PeerInfo provider : MessageCodec.fromWirePeers(request.getProviderPeersList())) {
            if (!provider.id().equals(from)) {
                // We should ignore this provider record! not from originator.
                logger.debug("handleAddProvider received provider {} from {}. Ignore.", provider.id(), from);
                continue;
            }
            if (!provider.hasAddresses()) {
                logger.debug("no valid addresses for provider {}", provider.id());
                continue;
            }

            RequestCancelledException.checkNotCancelled("before adding provider of " + cid);

            if (!provider.id().equals(context.getSelf())) {
                context.getAddressBook().addAddresses(provider.id(), provider.addresses(),
                        context.getSettings().getProviderAddrTtl());
            }
            context.getProviders().addProvider(cid, from);
        }

        return null;
    }
}
