package app.semble.core.firehose.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One record operation delivered by the firehose.
 *
 * @param cid    revision of the record, {@code null} for deletes
 * @param record record body, absent for deletes
 */
public record FirehoseEvent(String atUri, String cid, FirehoseEventType eventType, JsonNode record) {

    public FirehoseEvent {
        Objects.requireNonNull(eventType, "eventType");
    }

    public static FirehoseEvent create(String atUri, String cid, JsonNode record) {
        return new FirehoseEvent(atUri, cid, FirehoseEventType.CREATE, record);
    }

    public static FirehoseEvent update(String atUri, String cid, JsonNode record) {
        return new FirehoseEvent(atUri, cid, FirehoseEventType.UPDATE, record);
    }

    public static FirehoseEvent delete(String atUri) {
        return new FirehoseEvent(atUri, null, FirehoseEventType.DELETE, null);
    }

    public boolean hasRecord() {
        return record != null && !record.isNull() && !record.isMissingNode();
    }
}
