package app.semble.core.card.service;

import app.semble.core.card.api.CollectionPublisher;
import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.model.CardLink;
import app.semble.core.card.domain.model.Collection;
import app.semble.core.card.domain.request.CollectionPublishOptions;
import app.semble.core.card.domain.request.CreateCollectionRequest;
import app.semble.core.card.domain.request.OperationContext;
import app.semble.core.card.domain.request.UpdateCollectionRequest;
import app.semble.core.card.domain.type.CollectionAccessType;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CollectionDescription;
import app.semble.core.card.domain.value.CollectionId;
import app.semble.core.card.domain.value.CollectionName;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.card.repository.CardRepository;
import app.semble.core.card.repository.CollectionRepository;
import app.semble.core.common.error.ValidationException;
import app.semble.core.common.lock.AggregateLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Consumer;

@Service
public class CollectionCommandService {

    private static final Logger log = LoggerFactory.getLogger(CollectionCommandService.class);

    private final CollectionRepository collectionRepository;
    private final CardRepository cardRepository;
    private final CollectionPublisher collectionPublisher;
    private final CardCollectionService cardCollectionService;
    private final AggregateLocks locks;

    public CollectionCommandService(CollectionRepository collectionRepository,
                                    CardRepository cardRepository,
                                    CollectionPublisher collectionPublisher,
                                    CardCollectionService cardCollectionService,
                                    AggregateLocks locks) {
        this.collectionRepository = collectionRepository;
        this.cardRepository = cardRepository;
        this.collectionPublisher = collectionPublisher;
        this.cardCollectionService = cardCollectionService;
        this.locks = locks;
    }

    public Collection createCollection(CreateCollectionRequest request) {
        CuratorId author = CuratorId.of(request.curatorId());
        CollectionName name = CollectionName.of(request.name());
        CollectionDescription description = CollectionDescription.ofNullable(request.description());
        List<CuratorId> collaborators = request.collaboratorIds().stream().map(CuratorId::of).toList();

        Collection collection = Collection.create(author, name, description, request.accessType(), collaborators);
        PublishedRecordId recordId = request.context().skipsPublishing()
                ? request.publishedRecordId()
                : collectionPublisher.publish(collection);
        if (recordId != null) {
            collection.markAsPublished(recordId);
        }
        Collection saved = collectionRepository.save(collection);
        log.debug("Collection {} created by {}", saved.getId(), author);
        return saved;
    }

    public Collection updateCollection(UpdateCollectionRequest request) {
        CuratorId actor = CuratorId.of(request.curatorId());
        CollectionName name = CollectionName.of(request.name());
        CollectionDescription description = CollectionDescription.ofNullable(request.description());
        return mutate(CollectionId.parse(request.collectionId()), request.context(), request.publishedRecordId(),
                collection -> collection.updateDetails(name, description, actor));
    }

    public Collection changeAccessType(String collectionId, String curatorId, CollectionAccessType accessType) {
        CuratorId actor = CuratorId.of(curatorId);
        return mutate(CollectionId.parse(collectionId), OperationContext.USER_INITIATED, null,
                collection -> collection.changeAccessType(accessType, actor));
    }

    public Collection addCollaborator(String collectionId, String curatorId, String collaboratorId) {
        CuratorId actor = CuratorId.of(curatorId);
        CuratorId collaborator = CuratorId.of(collaboratorId);
        return mutate(CollectionId.parse(collectionId), OperationContext.USER_INITIATED, null,
                collection -> collection.addCollaborator(collaborator, actor));
    }

    public Collection removeCollaborator(String collectionId, String curatorId, String collaboratorId) {
        CuratorId actor = CuratorId.of(curatorId);
        CuratorId collaborator = CuratorId.of(collaboratorId);
        return mutate(CollectionId.parse(collectionId), OperationContext.USER_INITIATED, null,
                collection -> collection.removeCollaborator(collaborator, actor));
    }

    public CollectionId deleteCollection(String collectionId, String curatorId, OperationContext context) {
        CuratorId actor = CuratorId.of(curatorId);
        CollectionId id = CollectionId.parse(collectionId);
        boolean skipPublishing = context != null && context.skipsPublishing();
        locks.runWithLock(id, () -> {
            Collection collection = load(id);
            collection.ensureCanDelete(actor);
            if (!skipPublishing) {
                for (CardLink link : collection.getCardLinks()) {
                    if (link.isPublished()) {
                        collectionPublisher.unpublishCardAddedToCollection(link.getPublishedRecordId());
                    }
                }
                if (collection.getPublishedRecordId() != null) {
                    collectionPublisher.unpublish(collection.getPublishedRecordId());
                }
            }
            collectionRepository.delete(id);
            log.debug("Collection {} deleted by {}", id, actor);
        });
        return id;
    }

    public List<Collection> addCardToCollections(String cardId, List<String> collectionIds, String curatorId) {
        CuratorId curator = CuratorId.of(curatorId);
        Card card = loadCard(CardId.parse(cardId));
        return cardCollectionService.addCardToCollections(card, UrlLibraryService.parseCollectionIds(collectionIds),
                curator, CollectionPublishOptions.publish());
    }

    public List<Collection> removeCardFromCollections(String cardId, List<String> collectionIds, String curatorId) {
        CuratorId curator = CuratorId.of(curatorId);
        Card card = loadCard(CardId.parse(cardId));
        return cardCollectionService.removeCardFromCollections(card, UrlLibraryService.parseCollectionIds(collectionIds),
                curator, CollectionPublishOptions.publish());
    }

    private Collection mutate(CollectionId id,
                              OperationContext context,
                              PublishedRecordId providedRecordId,
                              Consumer<Collection> change) {
        boolean skipPublishing = context != null && context.skipsPublishing();
        return locks.withLock(id, () -> {
            Collection collection = load(id);
            change.accept(collection);
            PublishedRecordId recordId = null;
            if (skipPublishing) {
                recordId = providedRecordId;
            } else if (collection.getPublishedRecordId() != null) {
                recordId = collectionPublisher.publish(collection);
            }
            if (recordId != null) {
                collection.markAsPublished(recordId);
            }
            return collectionRepository.save(collection);
        });
    }

    private Collection load(CollectionId id) {
        return collectionRepository.findById(id)
                .orElseThrow(() -> new ValidationException("Collection not found: " + id));
    }

    private Card loadCard(CardId id) {
        return cardRepository.findById(id)
                .orElseThrow(() -> new ValidationException("Card not found: " + id));
    }
}
