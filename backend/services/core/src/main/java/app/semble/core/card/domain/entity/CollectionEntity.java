package app.semble.core.card.domain.entity;

import app.semble.core.card.domain.type.CollectionAccessType;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "collections", schema = "app_core")
public class CollectionEntity {

    @Id
    @Column(name = "collection_id", nullable = false)
    private UUID collectionId;

    @Column(name = "author_id", nullable = false)
    private String authorId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "access_type", nullable = false)
    private CollectionAccessType accessType;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
            name = "collection_collaborators",
            schema = "app_core",
            joinColumns = @JoinColumn(name = "collection_id")
    )
    @Column(name = "curator_id", nullable = false)
    private Set<String> collaborators = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
            name = "collection_card_links",
            schema = "app_core",
            joinColumns = @JoinColumn(name = "collection_id")
    )
    private List<CardLinkEmbeddable> cardLinks = new ArrayList<>();

    @Column(name = "published_record_uri")
    private String publishedRecordUri;

    @Column(name = "published_record_cid")
    private String publishedRecordCid;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public CollectionEntity() {
    }

    public UUID getCollectionId() {
        return collectionId;
    }

    public void setCollectionId(UUID collectionId) {
        this.collectionId = collectionId;
    }

    public String getAuthorId() {
        return authorId;
    }

    public void setAuthorId(String authorId) {
        this.authorId = authorId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public CollectionAccessType getAccessType() {
        return accessType;
    }

    public void setAccessType(CollectionAccessType accessType) {
        this.accessType = accessType;
    }

    public Set<String> getCollaborators() {
        return collaborators;
    }

    public void setCollaborators(Set<String> collaborators) {
        this.collaborators = collaborators;
    }

    public List<CardLinkEmbeddable> getCardLinks() {
        return cardLinks;
    }

    public void setCardLinks(List<CardLinkEmbeddable> cardLinks) {
        this.cardLinks = cardLinks;
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
