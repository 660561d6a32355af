package app.semble.core.card.service;

import app.semble.core.card.api.CardPublisher;
import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.model.Collection;
import app.semble.core.card.domain.model.LibraryMembership;
import app.semble.core.card.domain.request.CollectionPublishOptions;
import app.semble.core.card.domain.request.LibraryPublishOptions;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.card.repository.CardRepository;
import app.semble.core.card.repository.CollectionRepository;
import app.semble.core.common.error.ValidationException;
import app.semble.core.common.event.DomainEventDispatcher;
import app.semble.core.common.lock.AggregateLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class CardLibraryService {

    private static final Logger log = LoggerFactory.getLogger(CardLibraryService.class);

    private final CardRepository cardRepository;
    private final CollectionRepository collectionRepository;
    private final CardPublisher cardPublisher;
    private final CardCollectionService cardCollectionService;
    private final AggregateLocks locks;
    private final DomainEventDispatcher eventDispatcher;

    public CardLibraryService(CardRepository cardRepository,
                              CollectionRepository collectionRepository,
                              CardPublisher cardPublisher,
                              CardCollectionService cardCollectionService,
                              AggregateLocks locks,
                              DomainEventDispatcher eventDispatcher) {
        this.cardRepository = cardRepository;
        this.collectionRepository = collectionRepository;
        this.cardPublisher = cardPublisher;
        this.cardCollectionService = cardCollectionService;
        this.locks = locks;
        this.eventDispatcher = eventDispatcher;
    }

    public Card addCardToLibrary(Card card, CuratorId curatorId) {
        return addCardToLibrary(card, curatorId, LibraryPublishOptions.publish());
    }

    public Card addCardToLibrary(Card card, CuratorId curatorId, LibraryPublishOptions options) {
        LibraryPublishOptions opts = LibraryPublishOptions.orDefault(options);
        return locks.withLock(card.getId(), () -> {
            Optional<LibraryMembership> membership = card.findMembership(curatorId);
            if (membership.isPresent()) {
                // already in the library: only adopt a replayed record for an unpublished membership
                PublishedRecordId provided = opts.skipPublishing() ? opts.publishedRecordId() : null;
                if (provided == null || membership.get().isPublished()) {
                    return card;
                }
                card.markCardInLibraryAsPublished(curatorId, provided);
                return persist(card);
            }

            PublishedRecordId recordId = opts.skipPublishing()
                    ? opts.publishedRecordId()
                    : publishToLibrary(card, curatorId);
            card.addToLibrary(curatorId);
            if (recordId != null) {
                card.markCardInLibraryAsPublished(curatorId, recordId);
            }
            log.debug("Card {} added to library of {}", card.getId(), curatorId);
            return persist(card);
        });
    }

    public Card updateCardInLibrary(Card card, CuratorId curatorId) {
        return updateCardInLibrary(card, curatorId, LibraryPublishOptions.publish());
    }

    public Card updateCardInLibrary(Card card, CuratorId curatorId, LibraryPublishOptions options) {
        LibraryPublishOptions opts = LibraryPublishOptions.orDefault(options);
        return locks.withLock(card.getId(), () -> {
            LibraryMembership membership = card.findMembership(curatorId)
                    .orElseThrow(() -> new ValidationException(
                            "Card " + card.getId() + " is not in the library of " + curatorId));
            PublishedRecordId recordId = null;
            if (opts.skipPublishing()) {
                recordId = opts.publishedRecordId();
            } else if (membership.isPublished()) {
                recordId = publishToLibrary(card, curatorId);
            }
            if (recordId != null) {
                card.markCardInLibraryAsPublished(curatorId, recordId);
            }
            return persist(card);
        });
    }

    public Card removeCardFromLibrary(Card card, CuratorId curatorId) {
        return removeCardFromLibrary(card, curatorId, LibraryPublishOptions.publish());
    }

    public Card removeCardFromLibrary(Card card, CuratorId curatorId, LibraryPublishOptions options) {
        LibraryPublishOptions opts = LibraryPublishOptions.orDefault(options);
        if (!card.isInLibrary(curatorId)) {
            return card;
        }

        CollectionPublishOptions collectionOptions = opts.skipPublishing()
                ? CollectionPublishOptions.skip()
                : CollectionPublishOptions.publish();
        // not atomic across aggregates: a failure part way is rethrown and earlier steps stay
        List<Collection> collections = collectionRepository.findByCuratorContainingCard(curatorId, card.getId());
        for (Collection collection : collections) {
            cardCollectionService.removeCardFromCollection(card.getId(), collection.getId(), curatorId, collectionOptions);
        }

        // child before parent
        if (card.isUrlCard()) {
            cardRepository.findUsersNoteCardByUrl(card.getUrl(), curatorId)
                    .filter(note -> !note.getId().equals(card.getId()))
                    .filter(note -> note.isInLibrary(curatorId))
                    .ifPresent(note -> removeCardFromLibrary(note, curatorId, opts));
        }

        return locks.withLock(card.getId(), () -> {
            Optional<LibraryMembership> membership = card.findMembership(curatorId);
            if (membership.isEmpty()) {
                return card;
            }
            if (membership.get().isPublished() && !opts.skipPublishing()) {
                cardPublisher.unpublishCardFromLibrary(membership.get().getPublishedRecordId(), curatorId);
            }
            card.removeFromLibrary(curatorId);
            if (card.getLibraryCount() == 0) {
                cardRepository.delete(card.getId());
                log.debug("Card {} deleted after leaving the last library", card.getId());
                return card;
            }
            return persist(card);
        });
    }

    private PublishedRecordId publishToLibrary(Card card, CuratorId curatorId) {
        return cardPublisher.publishCardToLibrary(card, curatorId, parentRecordId(card, curatorId));
    }

    // the curator's own record of the parent wins over the parent's first record
    private PublishedRecordId parentRecordId(Card card, CuratorId curatorId) {
        if (card.getParentCardId() == null) {
            return null;
        }
        Card parent = cardRepository.findById(card.getParentCardId())
                .orElseThrow(() -> new ValidationException("Parent card not found: " + card.getParentCardId()));
        return parent.findMembership(curatorId)
                .map(LibraryMembership::getPublishedRecordId)
                .orElse(parent.getPublishedRecordId());
    }

    private Card persist(Card card) {
        List<Object> events = card.pullDomainEvents();
        Card saved = cardRepository.save(card);
        eventDispatcher.dispatch(events);
        return saved;
    }
}
