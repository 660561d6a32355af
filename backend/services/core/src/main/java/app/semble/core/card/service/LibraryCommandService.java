package app.semble.core.card.service;

import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.request.CollectionPublishOptions;
import app.semble.core.card.domain.request.LibraryPublishOptions;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CollectionId;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.repository.CardRepository;
import app.semble.core.common.error.ValidationException;
import app.semble.core.common.lock.AggregateLocks;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class LibraryCommandService {

    private final CardRepository cardRepository;
    private final CardLibraryService cardLibraryService;
    private final CardCollectionService cardCollectionService;
    private final AggregateLocks locks;

    public LibraryCommandService(CardRepository cardRepository,
                                 CardLibraryService cardLibraryService,
                                 CardCollectionService cardCollectionService,
                                 AggregateLocks locks) {
        this.cardRepository = cardRepository;
        this.cardLibraryService = cardLibraryService;
        this.cardCollectionService = cardCollectionService;
        this.locks = locks;
    }

    public Card addCardToLibrary(String cardId, String curatorId, List<String> collectionIds) {
        CuratorId curator = CuratorId.of(curatorId);
        List<CollectionId> collections = UrlLibraryService.parseCollectionIds(collectionIds);
        Card card = load(CardId.parse(cardId));

        Card updated = cardLibraryService.addCardToLibrary(card, curator);
        if (!collections.isEmpty()) {
            cardCollectionService.addCardToCollections(updated, collections, curator, CollectionPublishOptions.publish());
        }
        return updated;
    }

    public CardId removeCardFromLibrary(String cardId, String curatorId, LibraryPublishOptions options) {
        CuratorId curator = CuratorId.of(curatorId);
        Card card = load(CardId.parse(cardId));
        cardLibraryService.removeCardFromLibrary(card, curator, options);
        return card.getId();
    }

    // only the note's author may edit it
    public Card updateNoteCard(String cardId, String curatorId, String text, LibraryPublishOptions options) {
        CuratorId curator = CuratorId.of(curatorId);
        Card card = load(CardId.parse(cardId));
        if (!card.isNoteCard()) {
            throw new ValidationException("Card " + card.getId() + " is not a note card");
        }
        if (!card.isAuthoredBy(curator)) {
            throw new ValidationException("Only the author can update note card " + card.getId());
        }
        return locks.withLock(card.getId(), () -> {
            card.updateNoteText(text);
            return cardLibraryService.updateCardInLibrary(card, curator, options);
        });
    }

    private Card load(CardId cardId) {
        return cardRepository.findById(cardId)
                .orElseThrow(() -> new ValidationException("Card not found: " + cardId));
    }
}
