package com.kaddht.record;

import com.kaddht.rpc.proto.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Decides when a stored record has outlived its welcome.
 *
 * <p>A record is stale when it has no parseable receipt time, or when more than
 * the maximum record age has passed since it was received. Staleness is only
 * evaluated lazily, when the record is read.
 */
public class FreshnessPolicy {

    private static final Logger logger = LoggerFactory.getLogger(FreshnessPolicy.class);

    private final Clock clock;
    private final Duration maxRecordAge;

    public FreshnessPolicy(Clock clock, Duration maxRecordAge) {
        this.clock = clock;
        this.maxRecordAge = maxRecordAge;
    }

    /**
     * Returns the record stamped with the current time as its receipt time.
     */
    public Record stamp(Record record) {
        return RecordCodec.stamp(record, clock.instant());
    }

    public boolean isStale(Record record) {
        Optional<Instant> received = RecordCodec.timeReceived(record);
        if (received.isEmpty()) {
            logger.info("Either no receive time set on record, or it was invalid: '{}'", record.getTimeReceived());
            return true;
        }
        Duration age = Duration.between(received.get(), clock.instant());
        if (age.compareTo(maxRecordAge) > 0) {
            logger.debug("Old record found (age {}), tossing", age);
            return true;
        }
        return false;
    }
}
