package app.semble.core.card.domain.model;

import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.common.error.ValidationException;

import java.time.Instant;
import java.util.Objects;

/**
 * A curator having a card in their library. Owned by {@link Card}.
 */
public final class LibraryMembership {

    private final CuratorId curatorId;
    private final Instant addedAt;
    private PublishedRecordId publishedRecordId;

    public LibraryMembership(CuratorId curatorId, Instant addedAt, PublishedRecordId publishedRecordId) {
        this.curatorId = Objects.requireNonNull(curatorId, "curatorId");
        this.addedAt = Objects.requireNonNull(addedAt, "addedAt");
        this.publishedRecordId = publishedRecordId;
    }

    public CuratorId getCuratorId() {
        return curatorId;
    }

    public Instant getAddedAt() {
        return addedAt;
    }

    public PublishedRecordId getPublishedRecordId() {
        return publishedRecordId;
    }

    public boolean isPublished() {
        return publishedRecordId != null;
    }

    // a new cid for the same uri is a revision; a different uri is another record
    void markPublished(PublishedRecordId recordId) {
        Objects.requireNonNull(recordId, "recordId");
        if (publishedRecordId != null && !publishedRecordId.sameRecordAs(recordId)) {
            throw new ValidationException("Library membership of " + curatorId
                    + " is already published as " + publishedRecordId.uri());
        }
        this.publishedRecordId = recordId;
    }
}
