package com.kaddht.record;

import com.google.protobuf.InvalidProtocolBufferException;
import com.kaddht.rpc.proto.Record;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Serialization of value records as stored in the datastore.
 *
 * <p>Records are stored in their protobuf wire form. The receipt time is an
 * RFC 3339 timestamp in UTC with up to nanosecond precision, for example
 * {@code 2024-03-01T12:00:00.123456789Z}.
 *
 * <p>Only the storing node sets the receipt time: incoming records pass through
 * {@link #clean(Record)} before validation and {@link #stamp(Record, Instant)}
 * just before being persisted.
 */
public final class RecordCodec {

    private RecordCodec() {
    }

    public static byte[] encode(Record record) {
        return record.toByteArray();
    }

    public static Record decode(byte[] data) throws InvalidProtocolBufferException {
        return Record.parseFrom(data);
    }

    /**
     * Returns the record without any peer-supplied receipt time.
     */
    public static Record clean(Record record) {
        return record.toBuilder().clearTimeReceived().build();
    }

    /**
     * Returns the record with its receipt time set to {@code receivedAt}.
     */
    public static Record stamp(Record record, Instant receivedAt) {
        return record.toBuilder().setTimeReceived(formatTime(receivedAt)).build();
    }

    public static String formatTime(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }

    /**
     * Parses the receipt time of a record.
     *
     * @return the receipt time, or empty if it is missing or not valid RFC 3339
     */
    public static Optional<Instant> timeReceived(Record record) {
        String text = record.getTimeReceived();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
