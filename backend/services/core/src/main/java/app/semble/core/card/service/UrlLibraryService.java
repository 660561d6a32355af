package app.semble.core.card.service;

import app.semble.core.card.api.UrlMetadataService;
import app.semble.core.card.domain.content.UrlMetadata;
import app.semble.core.card.domain.dto.AddUrlToLibraryResult;
import app.semble.core.card.domain.dto.UrlCardAssociationsResult;
import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.model.CardFactory;
import app.semble.core.card.domain.model.Collection;
import app.semble.core.card.domain.request.AddUrlToLibraryRequest;
import app.semble.core.card.domain.request.CollectionPublishOptions;
import app.semble.core.card.domain.request.LibraryPublishOptions;
import app.semble.core.card.domain.request.UpdateUrlCardAssociationsRequest;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CollectionId;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.Url;
import app.semble.core.card.repository.CardRepository;
import app.semble.core.common.error.ValidationException;
import app.semble.core.common.lock.AggregateLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class UrlLibraryService {

    private static final Logger log = LoggerFactory.getLogger(UrlLibraryService.class);

    private final CardRepository cardRepository;
    private final CardLibraryService cardLibraryService;
    private final CardCollectionService cardCollectionService;
    private final UrlMetadataService urlMetadataService;
    private final AggregateLocks locks;

    public UrlLibraryService(CardRepository cardRepository,
                             CardLibraryService cardLibraryService,
                             CardCollectionService cardCollectionService,
                             UrlMetadataService urlMetadataService,
                             AggregateLocks locks) {
        this.cardRepository = cardRepository;
        this.cardLibraryService = cardLibraryService;
        this.cardCollectionService = cardCollectionService;
        this.urlMetadataService = urlMetadataService;
        this.locks = locks;
    }

    public AddUrlToLibraryResult addUrlToLibrary(AddUrlToLibraryRequest request) {
        CuratorId curatorId = CuratorId.of(request.curatorId());
        Url url = Url.of(request.url());
        List<CollectionId> collectionIds = parseCollectionIds(request.collectionIds());
        boolean skipPublishing = request.context().skipsPublishing();

        LibraryPublishOptions urlCardOptions = skipPublishing
                ? LibraryPublishOptions.alreadyPublished(request.publishedRecordId())
                : LibraryPublishOptions.publish();

        Card existing = cardRepository.findUsersUrlCardByUrl(url, curatorId)
                .orElseGet(() -> cardRepository.save(CardFactory.urlCard(curatorId, url, fetchMetadata(url))));
        Card urlCard = cardLibraryService.addCardToLibrary(existing, curatorId, urlCardOptions);

        CardId noteCardId = null;
        if (request.note() != null && !request.note().isBlank()) {
            LibraryPublishOptions noteOptions = skipPublishing
                    ? LibraryPublishOptions.skip()
                    : LibraryPublishOptions.publish();
            noteCardId = upsertNote(urlCard, curatorId, request.note(), noteOptions).getId();
        }

        if (!collectionIds.isEmpty()) {
            CollectionPublishOptions collectionOptions = skipPublishing
                    ? CollectionPublishOptions.skip()
                    : CollectionPublishOptions.publish();
            cardCollectionService.addCardToCollections(urlCard, collectionIds, curatorId, collectionOptions);
        }

        return new AddUrlToLibraryResult(urlCard.getId(), noteCardId);
    }

    public UrlCardAssociationsResult updateUrlCardAssociations(UpdateUrlCardAssociationsRequest request) {
        CuratorId curatorId = CuratorId.of(request.curatorId());
        CardId cardId = CardId.parse(request.cardId());
        List<CollectionId> addTo = parseCollectionIds(request.addToCollections());
        List<CollectionId> removeFrom = parseCollectionIds(request.removeFromCollections());
        boolean skipPublishing = request.context().skipsPublishing();

        Card urlCard = cardRepository.findById(cardId)
                .orElseThrow(() -> new ValidationException("Card not found: " + cardId));
        if (!urlCard.isUrlCard()) {
            throw new ValidationException("Card " + cardId + " is not a URL card");
        }
        if (!urlCard.isInLibrary(curatorId)) {
            throw new ValidationException("URL card " + cardId + " is not in the library of " + curatorId);
        }

        CardId noteCardId;
        if (request.note() != null) {
            LibraryPublishOptions noteOptions = skipPublishing
                    ? LibraryPublishOptions.alreadyPublished(request.noteCardRecordId())
                    : LibraryPublishOptions.publish();
            noteCardId = upsertNote(urlCard, curatorId, request.note(), noteOptions).getId();
        } else {
            noteCardId = cardRepository.findUsersNoteCardByUrl(urlCard.getUrl(), curatorId)
                    .map(Card::getId)
                    .orElse(null);
        }

        CollectionPublishOptions collectionOptions = skipPublishing
                ? new CollectionPublishOptions(true, request.collectionLinkRecordIds())
                : CollectionPublishOptions.publish();
        List<CollectionId> added = cardCollectionService
                .addCardToCollections(urlCard, addTo, curatorId, collectionOptions)
                .stream()
                .map(Collection::getId)
                .toList();
        List<CollectionId> removed = cardCollectionService
                .removeCardFromCollections(urlCard, removeFrom, curatorId, collectionOptions)
                .stream()
                .map(Collection::getId)
                .toList();

        return new UrlCardAssociationsResult(urlCard.getId(), noteCardId, added, removed);
    }

    // one note per curator and URL
    private Card upsertNote(Card urlCard, CuratorId curatorId, String text, LibraryPublishOptions options) {
        Optional<Card> existing = cardRepository.findUsersNoteCardByUrl(urlCard.getUrl(), curatorId);
        if (existing.isPresent()) {
            Card note = existing.get();
            return locks.withLock(note.getId(), () -> {
                note.updateNoteText(text);
                if (note.isInLibrary(curatorId)) {
                    return cardLibraryService.updateCardInLibrary(note, curatorId, options);
                }
                return cardLibraryService.addCardToLibrary(note, curatorId, options);
            });
        }
        Card note = cardRepository.save(CardFactory.noteCard(curatorId, text, urlCard.getId(), urlCard.getUrl()));
        return cardLibraryService.addCardToLibrary(note, curatorId, options);
    }

    private UrlMetadata fetchMetadata(Url url) {
        try {
            return urlMetadataService.fetchMetadata(url).orElse(null);
        } catch (RuntimeException ex) {
            log.warn("Metadata fetch failed for {}, saving card without metadata: {}", url, ex.getMessage());
            return null;
        }
    }

    static List<CollectionId> parseCollectionIds(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        return raw.stream()
                .map(CollectionId::parse)
                .distinct()
                .toList();
    }
}
