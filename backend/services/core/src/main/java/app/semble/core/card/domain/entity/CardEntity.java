package app.semble.core.card.domain.entity;

import app.semble.core.card.domain.type.CardType;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "cards", schema = "app_core")
public class CardEntity {

    @Id
    @Column(name = "card_id", nullable = false)
    private UUID cardId;

    @Column(name = "curator_id", nullable = false)
    private String curatorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "card_type", nullable = false)
    private CardType cardType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "content", columnDefinition = "jsonb", nullable = false)
    private JsonNode content;

    @Column(name = "url")
    private String url;

    @Column(name = "parent_card_id")
    private UUID parentCardId;

    @Column(name = "library_count", nullable = false)
    private int libraryCount;

    @Column(name = "published_record_uri")
    private String publishedRecordUri;

    @Column(name = "published_record_cid")
    private String publishedRecordCid;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
            name = "card_library_memberships",
            schema = "app_core",
            joinColumns = @JoinColumn(name = "card_id")
    )
    private List<LibraryMembershipEmbeddable> libraryMemberships = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public CardEntity() {
    }

    public UUID getCardId() {
        return cardId;
    }

    public void setCardId(UUID cardId) {
        this.cardId = cardId;
    }

    public String getCuratorId() {
        return curatorId;
    }

    public void setCuratorId(String curatorId) {
        this.curatorId = curatorId;
    }

    public CardType getCardType() {
        return cardType;
    }

    public void setCardType(CardType cardType) {
        this.cardType = cardType;
    }

    public JsonNode getContent() {
        return content;
    }

    public void setContent(JsonNode content) {
        this.content = content;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public UUID getParentCardId() {
        return parentCardId;
    }

    public void setParentCardId(UUID parentCardId) {
        this.parentCardId = parentCardId;
    }

    public int getLibraryCount() {
        return libraryCount;
    }

    public void setLibraryCount(int libraryCount) {
        this.libraryCount = libraryCount;
    }

    public String getPublishedRecordUri() {
        return publishedRecordUri;
    }

    public void setPublishedRecordUri(String publishedRecordUri) {
        this.publishedRecordUri = publishedRecordUri;
    }

    public String getPublishedRecordCid() {
        return publishedRecordCid;
    }

    public void setPublishedRecordCid(String publishedRecordCid) {
        this.publishedRecordCid = publishedRecordCid;
    }

    public List<LibraryMembershipEmbeddable> getLibraryMemberships() {
        return libraryMemberships;
    }

    public void setLibraryMemberships(List<LibraryMembershipEmbeddable> libraryMemberships) {
        this.libraryMemberships = libraryMemberships;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }
}
