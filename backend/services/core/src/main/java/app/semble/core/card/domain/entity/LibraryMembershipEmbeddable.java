package app.semble.core.card.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.time.Instant;

@Embeddable
public class LibraryMembershipEmbeddable {

    @Column(name = "curator_id", nullable = false)
    private String curatorId;

    @Column(name = "added_at", nullable = false)
    private Instant addedAt;

    @Column(name = "published_record_uri")
    private String publishedRecordUri;

    @Column(name = "published_record_cid")
    private String publishedRecordCid;

    public LibraryMembershipEmbeddable() {
    }

    public LibraryMembershipEmbeddable(String curatorId, Instant addedAt, String publishedRecordUri, String publishedRecordCid) {
        this.curatorId = curatorId;
        this.addedAt = addedAt;
        this.publishedRecordUri = publishedRecordUri;
        this.publishedRecordCid = publishedRecordCid;
    }

    public String getCuratorId() {
        return curatorId;
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
