package app.semble.core.card.domain.model;

import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.common.error.ValidationException;

import java.time.Instant;
import java.util.Objects;

/**
 * Membership of a card in a collection. A link may exist before it has been published.
 */
public final class CardLink {

    private final CardId cardId;
    private final CuratorId addedBy;
    private final Instant addedAt;
    private PublishedRecordId publishedRecordId;

    public CardLink(CardId cardId, CuratorId addedBy, Instant addedAt, PublishedRecordId publishedRecordId) {
        this.cardId = Objects.requireNonNull(cardId, "cardId");
        this.addedBy = Objects.requireNonNull(addedBy, "addedBy");
        this.addedAt = Objects.requireNonNull(addedAt, "addedAt");
        this.publishedRecordId = publishedRecordId;
    }

    public CardId getCardId() {
        return cardId;
    }

    public CuratorId getAddedBy() {
        return addedBy;
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

    void markPublished(PublishedRecordId recordId) {
        Objects.requireNonNull(recordId, "recordId");
        if (publishedRecordId != null && !publishedRecordId.sameRecordAs(recordId)) {
            throw new ValidationException("Link for card " + cardId + " is already published as "
                    + publishedRecordId.uri());
        }
        this.publishedRecordId = recordId;
    }
}
