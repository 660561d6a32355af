package app.semble.core.card.domain.model;

import app.semble.core.card.domain.event.CardAddedToCollectionEvent;
import app.semble.core.card.domain.type.CollectionAccessType;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CollectionDescription;
import app.semble.core.card.domain.value.CollectionId;
import app.semble.core.card.domain.value.CollectionName;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.common.error.CollectionAccessException;
import app.semble.core.common.error.ValidationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A named set of card links curated by an author.
 * <p>
 * Access rules: the author may always add or remove cards. An {@link CollectionAccessType#OPEN}
 * collection accepts changes from anyone, a {@link CollectionAccessType#CLOSED} one only from
 * the author and collaborators. Access type, collaborators, name and description can only be
 * changed by the author.
 */
public class Collection {

    private final CollectionId id;
    private final CuratorId authorId;
    private CollectionName name;
    private CollectionDescription description;
    private CollectionAccessType accessType;
    private final Set<CuratorId> collaborators = new LinkedHashSet<>();
    private final Map<CardId, CardLink> cardLinks = new LinkedHashMap<>();
    private PublishedRecordId publishedRecordId;
    private final Instant createdAt;
    private Instant updatedAt;
    private final Long version;
    private final List<Object> domainEvents = new ArrayList<>();

    private Collection(CollectionId id,
                       CuratorId authorId,
                       CollectionName name,
                       CollectionDescription description,
                       CollectionAccessType accessType,
                       List<CuratorId> collaborators,
                       List<CardLink> cardLinks,
                       PublishedRecordId publishedRecordId,
                       Instant createdAt,
                       Instant updatedAt,
                       Long version) {
        this.id = Objects.requireNonNull(id, "id");
        this.authorId = Objects.requireNonNull(authorId, "authorId");
        this.name = Objects.requireNonNull(name, "name");
        this.description = description;
        this.accessType = accessType == null ? CollectionAccessType.CLOSED : accessType;
        for (CuratorId collaborator : collaborators) {
            if (this.authorId.equals(collaborator)) {
                throw new ValidationException("The author of collection " + id + " cannot be a collaborator");
            }
            this.collaborators.add(collaborator);
        }
        for (CardLink link : cardLinks) {
            if (this.cardLinks.putIfAbsent(link.getCardId(), link) != null) {
                throw new ValidationException("Duplicate link for card " + link.getCardId() + " in collection " + id);
            }
        }
        this.publishedRecordId = publishedRecordId;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = updatedAt == null ? createdAt : updatedAt;
        this.version = version;
    }

    public static Collection create(CuratorId authorId,
                                    CollectionName name,
                                    CollectionDescription description,
                                    CollectionAccessType accessType,
                                    List<CuratorId> collaborators) {
        return new Collection(CollectionId.generate(), authorId, name, description, accessType,
                collaborators == null ? List.of() : collaborators, List.of(), null, Instant.now(), null, null);
    }

    public static Collection restore(CollectionId id,
                                     CuratorId authorId,
                                     CollectionName name,
                                     CollectionDescription description,
                                     CollectionAccessType accessType,
                                     List<CuratorId> collaborators,
                                     List<CardLink> cardLinks,
                                     PublishedRecordId publishedRecordId,
                                     Instant createdAt,
                                     Instant updatedAt,
                                     Long version) {
        return new Collection(id, authorId, name, description, accessType, collaborators, cardLinks,
                publishedRecordId, createdAt, updatedAt, version);
    }

    public boolean isAuthor(CuratorId actor) {
        return authorId.equals(actor);
    }

    public boolean isCollaborator(CuratorId actor) {
        return collaborators.contains(actor);
    }

    public boolean canAddCard(CuratorId actor) {
        if (isAuthor(actor)) {
            return true;
        }
        return switch (accessType) {
            case OPEN -> true;
            case CLOSED -> isCollaborator(actor);
        };
    }

    public boolean canRemoveCard(CuratorId actor) {
        return canAddCard(actor);
    }

    /**
     * Links the card to this collection. Adding a card that is already linked returns the
     * existing link and changes nothing.
     */
    public CardLink addCard(CardId cardId, CuratorId actor) {
        if (!canAddCard(actor)) {
            throw new CollectionAccessException(id, actor,
                    "Curator " + actor + " cannot add cards to collection " + id);
        }
        CardLink existing = cardLinks.get(cardId);
        if (existing != null) {
            return existing;
        }
        Instant now = Instant.now();
        CardLink link = new CardLink(cardId, actor, now, null);
        cardLinks.put(cardId, link);
        updatedAt = now;
        domainEvents.add(new CardAddedToCollectionEvent(cardId, id, actor, now));
        return link;
    }

    public void ensureCanRemoveCard(CuratorId actor) {
        if (!canRemoveCard(actor)) {
            throw new CollectionAccessException(id, actor,
                    "Curator " + actor + " cannot remove cards from collection " + id);
        }
    }

    public void removeCard(CardId cardId, CuratorId actor) {
        ensureCanRemoveCard(actor);
        if (cardLinks.remove(cardId) != null) {
            updatedAt = Instant.now();
        }
    }

    public boolean hasCard(CardId cardId) {
        return cardLinks.containsKey(cardId);
    }

    public Optional<CardLink> findCardLink(CardId cardId) {
        return Optional.ofNullable(cardLinks.get(cardId));
    }

    public void markCardLinkAsPublished(CardId cardId, PublishedRecordId recordId) {
        CardLink link = cardLinks.get(cardId);
        if (link == null) {
            throw new ValidationException("Card " + cardId + " is not in collection " + id);
        }
        link.markPublished(recordId);
        updatedAt = Instant.now();
    }

    public void markAsPublished(PublishedRecordId recordId) {
        Objects.requireNonNull(recordId, "recordId");
        if (publishedRecordId != null && !publishedRecordId.sameRecordAs(recordId)) {
            throw new ValidationException("Collection " + id + " is already published as " + publishedRecordId.uri());
        }
        publishedRecordId = recordId;
        updatedAt = Instant.now();
    }

    public void changeAccessType(CollectionAccessType newAccessType, CuratorId actor) {
        requireAuthor(actor, "change the access type of");
        this.accessType = Objects.requireNonNull(newAccessType, "newAccessType");
        updatedAt = Instant.now();
    }

    public void addCollaborator(CuratorId collaborator, CuratorId actor) {
        requireAuthor(actor, "add collaborators to");
        if (isAuthor(collaborator)) {
            throw new ValidationException("The author of collection " + id + " cannot be a collaborator");
        }
        if (collaborators.add(collaborator)) {
            updatedAt = Instant.now();
        }
    }

    public void removeCollaborator(CuratorId collaborator, CuratorId actor) {
        requireAuthor(actor, "remove collaborators from");
        if (collaborators.remove(collaborator)) {
            updatedAt = Instant.now();
        }
    }

    public void updateDetails(CollectionName newName, CollectionDescription newDescription, CuratorId actor) {
        requireAuthor(actor, "update");
        this.name = Objects.requireNonNull(newName, "newName");
        this.description = newDescription;
        updatedAt = Instant.now();
    }

    public void ensureCanDelete(CuratorId actor) {
        requireAuthor(actor, "delete");
    }

    private void requireAuthor(CuratorId actor, String action) {
        if (!isAuthor(actor)) {
            throw new CollectionAccessException(id, actor,
                    "Only the author can " + action + " collection " + id);
        }
    }

    public List<Object> pullDomainEvents() {
        List<Object> events = List.copyOf(domainEvents);
        domainEvents.clear();
        return events;
    }

    public CollectionId getId() {
        return id;
    }

    public CuratorId getAuthorId() {
        return authorId;
    }

    public CollectionName getName() {
        return name;
    }

    public CollectionDescription getDescription() {
        return description;
    }

    public CollectionAccessType getAccessType() {
        return accessType;
    }

    public Set<CuratorId> getCollaborators() {
        return Set.copyOf(collaborators);
    }

    public List<CardLink> getCardLinks() {
        return List.copyOf(cardLinks.values());
    }

    public int getCardCount() {
        return cardLinks.size();
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
