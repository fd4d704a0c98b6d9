package com.kaddht.handler;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.kaddht.core.DhtStorageException;
import com.kaddht.core.InvalidRequestException;
import com.kaddht.core.OldRecordException;
import com.kaddht.core.PeerId;
import com.kaddht.core.PeerInfo;
import com.kaddht.core.RecordRejectedException;
import com.kaddht.core.RequestCancelledException;
import com.kaddht.datastore.Datastore;
import com.kaddht.datastore.DatastoreException;
import com.kaddht.datastore.DatastoreKey;
import com.kaddht.datastore.KeyNotFoundException;
import com.kaddht.record.FreshnessPolicy;
import com.kaddht.record.RecordCodec;
import com.kaddht.record.ValidationException;
import com.kaddht.record.Validator;
import com.kaddht.rpc.MessageCodec;
import com.kaddht.rpc.proto.Message;
import com.kaddht.rpc.proto.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * Handles GET_VALUE and PUT_VALUE.
 *
 * <h2>Reads</h2>
 * <p>A stored record is returned only while it is fresh. A record that is too old,
 * or has no usable receipt time, is deleted on the spot and the response carries
 * no record. Records are not validated on read; that is left to the requester.
 * Closer peers are attached whether or not a record was found.
 *
 * <h2>Writes</h2>
 * <p>An incoming record must carry the message key, pass the validator, and win
 * the validator's selection against any valid record already stored under the
 * key. The receipt time is always assigned here, never taken from the wire.
 * Writes hold the key's stripe of {@link StripedLocks} from the existing-record
 * lookup until the record is persisted.
 *
 * <h2>Thread Safety</h2>
 * <p>All methods may be called concurrently. Reads do not take the stripe lock;
 * they rely on the datastore's read-after-write visibility.
 */
public class ValueStoreHandler {

    private static final Logger logger = LoggerFactory.getLogger(ValueStoreHandler.class);

    private final PeerId self;
    private final Datastore datastore;
    private final Validator validator;
    private final FreshnessPolicy freshness;
    private final CloserPeers closerPeers;
    private final DhtContext context;
    private final StripedLocks putLocks = new StripedLocks();

    public ValueStoreHandler(DhtContext context, CloserPeers closerPeers) {
        this.context = context;
        this.self = context.getSelf();
        this.datastore = context.getDatastore();
        this.validator = context.getValidator();
        this.freshness = new FreshnessPolicy(context.getClock(), context.getSettings().getMaxRecordAge());
        this.closerPeers = closerPeers;
    }

    // ==================== GET_VALUE ====================

    /**
     * Answers a GET_VALUE request with the locally stored record, if fresh, and closer peers.
     *
     * @throws InvalidRequestException if the request has no key
     * @throws DhtStorageException if the datastore fails or holds undecodable bytes
     */
    public Message handleGetValue(PeerId from, Message request) {
        ByteString key = request.getKey();
        if (key.isEmpty()) {
            throw new InvalidRequestException("handleGetValue but no key was provided");
        }
        logger.debug("{} handleGetValue for key {} from {}", self, DatastoreKey.encode(key.toByteArray()), from);

        Message.Builder response = MessageCodec.newResponse(request);

        checkLocalDatastore(key.toByteArray()).ifPresent(response::setRecord);

        // Find closest peers to the desired key and reply with that info
        List<PeerId> closer = closerPeers.select(key.toByteArray(), from);
        if (!closer.isEmpty()) {
            List<PeerInfo> infos = context.getAddressBook().peerInfos(closer);
            for (PeerInfo info : infos) {
                logger.debug("handleGetValue returning closer peer: '{}'", info.id());
                if (!info.hasAddresses()) {
                    logger.warn("No addresses on peer being sent! [local:{}] [sending:{}] [remote:{}]",
                            self, info.id(), from);
                }
            }
            response.addAllCloserPeers(MessageCodec.toWirePeers(infos, context.getConnectivity()));
        }

        return response.build();
    }

    /**
     * Returns the fresh record stored under the key, deleting it if it has gone stale.
     */
    Optional<Record> checkLocalDatastore(byte[] key) {
        String dsKey = DatastoreKey.encode(key);
        RequestCancelledException.checkNotCancelled("before reading " + dsKey);

        byte[] buf;
        try {
            buf = datastore.get(dsKey);
        } catch (KeyNotFoundException e) {
            return Optional.empty();
        } catch (DatastoreException e) {
            throw new DhtStorageException("Failed to read " + dsKey + " from datastore", e);
        }

        Record record;
        try {
            record = RecordCodec.decode(buf);
        } catch (InvalidProtocolBufferException e) {
            logger.debug("Failed to unmarshal DHT record from datastore: {}", dsKey);
            throw new DhtStorageException("Stored record under " + dsKey + " is corrupt", e);
        }

        // Only timestamps are checked here; verifying the record is up to the requester.
        if (freshness.isStale(record)) {
            try {
                datastore.delete(dsKey);
            } catch (DatastoreException e) {
                logger.error("Failed to delete bad record {} from datastore", dsKey, e);
            }
            return Optional.empty();
        }

        return Optional.of(record);
    }

    // ==================== PUT_VALUE ====================

    /**
     * Stores the record carried by a PUT_VALUE request.
     *
     * @return the request itself, as acknowledgement
     * @throws InvalidRequestException if the record is missing or its key differs from the message key
     * @throws RecordRejectedException if the validator rejects the record
     * @throws OldRecordException if the record already stored is preferred
     * @throws DhtStorageException if the datastore fails
     * @throws RequestCancelledException if the request is cancelled before the record is persisted
     */
    public Message handlePutValue(PeerId from, Message request) {
        if (!request.hasRecord()) {
            logger.info("Got nil record from: {}", from);
            throw new InvalidRequestException("nil record");
        }
        if (!request.getKey().equals(request.getRecord().getKey())) {
            throw new InvalidRequestException("put key doesn't match record key");
        }

        Record record = RecordCodec.clean(request.getRecord());
        byte[] key = record.getKey().toByteArray();
        byte[] value = record.getValue().toByteArray();

        // Make sure the record is valid (not expired, valid signature etc)
        try {
            validator.validate(key, value);
        } catch (ValidationException e) {
            logger.warn("Bad dht record in PUT from: {}. {}", from, e.getMessage());
            throw new RecordRejectedException(e.getMessage(), e);
        }

        String dsKey = DatastoreKey.encode(key);

        Lock lock = putLocks.lockFor(key);
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException("Request cancelled while waiting to store " + dsKey, e);
        }
        try {
            // A lower-ranked record must never replace a higher-ranked one.
            Optional<Record> existing = getRecordFromDatastore(dsKey);
            if (existing.isPresent()) {
                int preferred;
                try {
                    preferred = validator.select(key, List.of(value, existing.get().getValue().toByteArray()));
                } catch (ValidationException e) {
                    logger.warn("Bad dht record in PUT from {}: {}", from, e.getMessage());
                    throw new RecordRejectedException(e.getMessage(), e);
                }
                if (preferred != 0) {
                    logger.info("DHT record in PUT from {} is older than existing record. Ignoring", from);
                    throw new OldRecordException();
                }
            }

            RequestCancelledException.checkNotCancelled("before storing " + dsKey);

            Record stamped = freshness.stamp(record);
            try {
                datastore.put(dsKey, RecordCodec.encode(stamped));
            } catch (DatastoreException e) {
                throw new DhtStorageException("Failed to store " + dsKey, e);
            }
            logger.debug("{} handlePutValue {}", self, dsKey);
            return request;

        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the valid record stored under a datastore key.
     *
     * <p>Missing, undecodable and no-longer-valid records all come back empty, so the
     * incoming write simply replaces them. Only a datastore failure is raised.
     */
    Optional<Record> getRecordFromDatastore(String dsKey) {
        byte[] buf;
        try {
            buf = datastore.get(dsKey);
        } catch (KeyNotFoundException e) {
            return Optional.empty();
        } catch (DatastoreException e) {
            logger.error("Got error retrieving record with key {} from datastore", dsKey, e);
            throw new DhtStorageException("Failed to read " + dsKey + " from datastore", e);
        }

        Record record;
        try {
            record = RecordCodec.decode(buf);
        } catch (InvalidProtocolBufferException e) {
            logger.error("Bad record data stored in datastore with key {}: could not unmarshal record", dsKey);
            return Optional.empty();
        }

        try {
            validator.validate(record.getKey().toByteArray(), record.getValue().toByteArray());
        } catch (ValidationException e) {
            logger.debug("Local record verify failed: {} (discarded)", e.getMessage());
            return Optional.empty();
        }

        return Optional.of(record);
    }
}
