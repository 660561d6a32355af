package app.semble.core.card.domain.model;

import app.semble.core.card.domain.content.CardContent;
import app.semble.core.card.domain.content.NoteCardContent;
import app.semble.core.card.domain.content.UrlCardContent;
import app.semble.core.card.domain.event.CardAddedToLibraryEvent;
import app.semble.core.card.domain.type.CardType;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.card.domain.value.Url;
import app.semble.core.common.error.ValidationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A unit of curated content (a URL, a note or a highlight) together with the set of
 * curators that keep it in their library.
 * <p>
 * The aggregate-level {@link #getPublishedRecordId()} is the first external record ever
 * written for the card; each membership additionally carries the record written for
 * that curator's library.
 */
public class Card {

    private final CardId id;
    private final CuratorId curatorId;
    private final CardType type;
    private CardContent content;
    private final CardId parentCardId;
    private final Url url;
    private final Map<CuratorId, LibraryMembership> memberships = new LinkedHashMap<>();
    private int libraryCount;
    private PublishedRecordId publishedRecordId;
    private final Instant createdAt;
    private Instant updatedAt;
    private final Long version;
    private final List<Object> domainEvents = new ArrayList<>();

    Card(CardId id,
         CuratorId curatorId,
         CardContent content,
         CardId parentCardId,
         Url url,
         List<LibraryMembership> memberships,
         PublishedRecordId publishedRecordId,
         Instant createdAt,
         Instant updatedAt,
         Long version) {
        this.id = Objects.requireNonNull(id, "id");
        this.curatorId = Objects.requireNonNull(curatorId, "curatorId");
        if (content == null) {
            throw new ValidationException("Card content is required");
        }
        this.type = content.type();
        this.content = content;
        this.parentCardId = parentCardId;
        this.url = resolveUrl(content, url);
        validateParent(type, parentCardId);
        for (LibraryMembership membership : memberships) {
            if (this.memberships.putIfAbsent(membership.getCuratorId(), membership) != null) {
                throw new ValidationException("Duplicate library membership for " + membership.getCuratorId());
            }
        }
        this.libraryCount = this.memberships.size();
        this.publishedRecordId = publishedRecordId;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = updatedAt == null ? createdAt : updatedAt;
        this.version = version;
    }

    /**
     * Rebuilds a card from persisted state. The stored library count has to agree with
     * the stored memberships.
     */
    public static Card restore(CardId id,
                               CuratorId curatorId,
                               CardContent content,
                               CardId parentCardId,
                               Url url,
                               List<LibraryMembership> memberships,
                               int libraryCount,
                               PublishedRecordId publishedRecordId,
                               Instant createdAt,
                               Instant updatedAt,
                               Long version) {
        Card card = new Card(id, curatorId, content, parentCardId, url, memberships,
                publishedRecordId, createdAt, updatedAt, version);
        if (card.libraryCount != libraryCount) {
            throw new ValidationException("Card " + id + " has library count " + libraryCount
                    + " but " + card.libraryCount + " memberships");
        }
        return card;
    }

    private static Url resolveUrl(CardContent content, Url url) {
        if (content instanceof UrlCardContent urlContent) {
            if (url != null && !url.equals(urlContent.url())) {
                throw new ValidationException("URL card url must match its content url");
            }
            return urlContent.url();
        }
        return url;
    }

    private static void validateParent(CardType type, CardId parentCardId) {
        switch (type) {
            case URL -> {
                if (parentCardId != null) {
                    throw new ValidationException("URL cards cannot have a parent card");
                }
            }
            case HIGHLIGHT -> {
                if (parentCardId == null) {
                    throw new ValidationException("Highlight cards require a parent card");
                }
            }
            case NOTE -> {
                // parent is optional
            }
        }
    }

    public boolean isInLibrary(CuratorId curator) {
        return memberships.containsKey(curator);
    }

    public Optional<LibraryMembership> findMembership(CuratorId curator) {
        return Optional.ofNullable(memberships.get(curator));
    }

    public void addToLibrary(CuratorId curator) {
        Objects.requireNonNull(curator, "curator");
        if (memberships.containsKey(curator)) {
            throw new ValidationException("Card " + id + " is already in the library of " + curator);
        }
        Instant now = Instant.now();
        memberships.put(curator, new LibraryMembership(curator, now, null));
        libraryCount = memberships.size();
        updatedAt = now;
        domainEvents.add(new CardAddedToLibraryEvent(id, curator, now));
    }

    public void removeFromLibrary(CuratorId curator) {
        if (memberships.remove(curator) == null) {
            throw new ValidationException("Card " + id + " is not in the library of " + curator);
        }
        libraryCount = memberships.size();
        updatedAt = Instant.now();
    }

    public void markCardInLibraryAsPublished(CuratorId curator, PublishedRecordId recordId) {
        LibraryMembership membership = memberships.get(curator);
        if (membership == null) {
            throw new ValidationException("Card " + id + " is not in the library of " + curator);
        }
        membership.markPublished(recordId);
        if (publishedRecordId == null) {
            publishedRecordId = recordId;
        } else if (publishedRecordId.sameRecordAs(recordId)) {
            publishedRecordId = recordId;
        }
        updatedAt = Instant.now();
    }

    public void updateContent(CardContent newContent) {
        if (newContent == null) {
            throw new ValidationException("Card content is required");
        }
        if (newContent.type() != type) {
            throw new ValidationException("Cannot change " + type + " card content to " + newContent.type());
        }
        if (newContent instanceof UrlCardContent urlContent && !urlContent.url().equals(url)) {
            throw new ValidationException("URL card url cannot change");
        }
        this.content = newContent;
        this.updatedAt = Instant.now();
    }

    public void updateNoteText(String text) {
        if (!(content instanceof NoteCardContent note)) {
            throw new ValidationException("Card " + id + " is not a note card");
        }
        updateContent(note.withText(text));
    }

    public List<Object> pullDomainEvents() {
        List<Object> events = List.copyOf(domainEvents);
        domainEvents.clear();
        return events;
    }

    public boolean isUrlCard() {
        return type == CardType.URL;
    }

    public boolean isNoteCard() {
        return type == CardType.NOTE;
    }

    public boolean isAuthoredBy(CuratorId curator) {
        return curatorId.equals(curator);
    }

    public CardId getId() {
        return id;
    }

    public CuratorId getCuratorId() {
        return curatorId;
    }

    public CardType getType() {
        return type;
    }

    public CardContent getContent() {
        return content;
    }

    public CardId getParentCardId() {
        return parentCardId;
    }

    public Url getUrl() {
        return url;
    }

    public List<LibraryMembership> getLibraryMemberships() {
        return List.copyOf(memberships.values());
    }

    public int getLibraryCount() {
        return libraryCount;
    }

    public PublishedRecordId getPublishedRecordId() {
        return publishedRecordId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Long getVersion() {
        return version;
    }
}
