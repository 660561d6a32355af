package app.semble.core.card.service;

import app.semble.core.card.api.CollectionPublisher;
import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.model.CardLink;
import app.semble.core.card.domain.model.Collection;
import app.semble.core.card.domain.request.CollectionPublishOptions;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CollectionId;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.card.repository.CollectionRepository;
import app.semble.core.common.error.ValidationException;
import app.semble.core.common.event.DomainEventDispatcher;
import app.semble.core.common.lock.AggregateLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class CardCollectionService {

    private static final Logger log = LoggerFactory.getLogger(CardCollectionService.class);

    private final CollectionRepository collectionRepository;
    private final CollectionPublisher collectionPublisher;
    private final AggregateLocks locks;
    private final DomainEventDispatcher eventDispatcher;

    public CardCollectionService(CollectionRepository collectionRepository,
                                 CollectionPublisher collectionPublisher,
                                 AggregateLocks locks,
                                 DomainEventDispatcher eventDispatcher) {
        this.collectionRepository = collectionRepository;
        this.collectionPublisher = collectionPublisher;
        this.locks = locks;
        this.eventDispatcher = eventDispatcher;
    }

    public Collection addCardToCollection(Card card, CollectionId collectionId, CuratorId curatorId) {
        return addCardToCollection(card, collectionId, curatorId, CollectionPublishOptions.publish());
    }

    public Collection addCardToCollection(Card card,
                                          CollectionId collectionId,
                                          CuratorId curatorId,
                                          CollectionPublishOptions options) {
        CollectionPublishOptions opts = CollectionPublishOptions.orDefault(options);
        return locks.withLock(collectionId, () -> {
            Collection collection = load(collectionId);
            boolean alreadyLinked = collection.hasCard(card.getId());
            CardLink link = collection.addCard(card.getId(), curatorId);
            PublishedRecordId provided = opts.recordIdFor(collectionId);

            if (alreadyLinked) {
                if (opts.skipPublishing() && provided != null && !link.isPublished()) {
                    collection.markCardLinkAsPublished(card.getId(), provided);
                    return persist(collection);
                }
                return collection;
            }

            PublishedRecordId recordId = opts.skipPublishing()
                    ? provided
                    : collectionPublisher.publishCardAddedToCollection(card, collection, curatorId);
            if (recordId != null) {
                collection.markCardLinkAsPublished(card.getId(), recordId);
            }
            log.debug("Card {} linked into collection {} by {}", card.getId(), collectionId, curatorId);
            return persist(collection);
        });
    }

    public List<Collection> addCardToCollections(Card card,
                                                 List<CollectionId> collectionIds,
                                                 CuratorId curatorId,
                                                 CollectionPublishOptions options) {
        List<Collection> updated = new ArrayList<>();
        for (CollectionId collectionId : collectionIds) {
            updated.add(addCardToCollection(card, collectionId, curatorId, options));
        }
        return updated;
    }

    public Collection removeCardFromCollection(Card card, CollectionId collectionId, CuratorId curatorId) {
        return removeCardFromCollection(card.getId(), collectionId, curatorId, CollectionPublishOptions.publish());
    }

    public Collection removeCardFromCollection(Card card,
                                               CollectionId collectionId,
                                               CuratorId curatorId,
                                               CollectionPublishOptions options) {
        return removeCardFromCollection(card.getId(), collectionId, curatorId, options);
    }

    public Collection removeCardFromCollection(CardId cardId,
                                               CollectionId collectionId,
                                               CuratorId curatorId,
                                               CollectionPublishOptions options) {
        CollectionPublishOptions opts = CollectionPublishOptions.orDefault(options);
        return locks.withLock(collectionId, () -> {
            Collection collection = load(collectionId);
            Optional<CardLink> link = collection.findCardLink(cardId);
            if (link.isEmpty()) {
                return null;
            }
            collection.ensureCanRemoveCard(curatorId);
            if (link.get().isPublished() && !opts.skipPublishing()) {
                collectionPublisher.unpublishCardAddedToCollection(link.get().getPublishedRecordId());
            }
            collection.removeCard(cardId, curatorId);
            log.debug("Card {} unlinked from collection {} by {}", cardId, collectionId, curatorId);
            return persist(collection);
        });
    }

    public List<Collection> removeCardFromCollections(Card card,
                                                      List<CollectionId> collectionIds,
                                                      CuratorId curatorId,
                                                      CollectionPublishOptions options) {
        List<Collection> updated = new ArrayList<>();
        for (CollectionId collectionId : collectionIds) {
            Collection collection = removeCardFromCollection(card.getId(), collectionId, curatorId, options);
            if (collection != null) {
                updated.add(collection);
            }
        }
        return updated;
    }

    private Collection load(CollectionId collectionId) {
        return collectionRepository.findById(collectionId)
                .orElseThrow(() -> new ValidationException("Collection not found: " + collectionId));
    }

    private Collection persist(Collection collection) {
        List<Object> events = collection.pullDomainEvents();
        Collection saved = collectionRepository.save(collection);
        eventDispatcher.dispatch(events);
        return saved;
    }
}
