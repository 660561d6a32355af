package app.semble.core.card.domain.value;

import app.semble.core.common.error.ValidationException;

/**
 * Local handle of an externally published record. The {@code uri} is the join key
 * used to resolve firehose events back to local entities; the {@code cid} identifies
 * one revision of that record.
 */
public record PublishedRecordId(String uri, String cid) {

    public PublishedRecordId {
        if (uri == null || uri.isBlank()) {
            throw new ValidationException("Published record uri is required");
        }
        if (cid == null || cid.isBlank()) {
            throw new ValidationException("Published record cid is required");
        }
    }

    public static PublishedRecordId of(String uri, String cid) {
        return new PublishedRecordId(uri, cid);
    }

    public boolean sameRecordAs(PublishedRecordId other) {
        return other != null && uri.equals(other.uri);
    }
}
