package app.semble.core.card.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.time.Instant;
import java.util.UUID;

@Embeddable
public class CardLinkEmbeddable {

    @Column(name = "card_id", nullable = false)
    private UUID cardId;

    @Column(name = "added_by", nullable = false)
    private String addedBy;

    @Column(name = "added_at", nullable = false)
    private Instant addedAt;

    @Column(name = "published_record_uri")
    private String publishedRecordUri;

    @Column(name = "published_record_cid")
    private String publishedRecordCid;

    public CardLinkEmbeddable() {
    }

    public CardLinkEmbeddable(UUID cardId, String addedBy, Instant addedAt, String publishedRecordUri, String publishedRecordCid) {
        this.cardId = cardId;
        this.addedBy = addedBy;
        this.addedAt = addedAt;
        this.publishedRecordUri = publishedRecordUri;
        this.publishedRecordCid = publishedRecordCid;
    }

    public UUID getCardId() {
        return cardId;
    }

    public String getAddedBy() {
        return addedBy;
    }

    public Instant getAddedAt() {
        return addedAt;
    }

    public String getPublishedRecordUri() {
        return publishedRecordUri;
    }

    public String getPublishedRecordCid() {
        return publishedRecordCid;
    }
}
