package app.semble.core.card.service;

import app.semble.core.card.domain.dto.ResolvedAtUri;
import app.semble.core.card.domain.model.CardLink;
import app.semble.core.card.domain.model.Collection;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CollectionId;
import app.semble.core.card.domain.value.CollectionLinkId;
import app.semble.core.card.repository.CardRepository;
import app.semble.core.card.repository.CollectionRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class AtUriResolutionService {

    private final CardRepository cardRepository;
    private final CollectionRepository collectionRepository;

    public AtUriResolutionService(CardRepository cardRepository, CollectionRepository collectionRepository) {
        this.cardRepository = cardRepository;
        this.collectionRepository = collectionRepository;
    }

    public Optional<ResolvedAtUri> resolveAtUri(String uri) {
        if (uri == null || uri.isBlank()) {
            return Optional.empty();
        }

        Optional<ResolvedAtUri> card = cardRepository.findByPublishedRecordUri(uri)
                .map(c -> new ResolvedAtUri.CardRef(c.getId()));
        if (card.isPresent()) {
            return card;
        }

        Optional<ResolvedAtUri> collection = collectionRepository.findByPublishedRecordUri(uri)
                .map(c -> new ResolvedAtUri.CollectionRef(c.getId()));
        if (collection.isPresent()) {
            return collection;
        }

        return collectionRepository.findByCardLinkPublishedRecordUri(uri)
                .flatMap(c -> findLink(c, uri));
    }

    public Optional<CardId> resolveCardId(String uri) {
        return resolveAtUri(uri)
                .filter(ResolvedAtUri.CardRef.class::isInstance)
                .map(r -> ((ResolvedAtUri.CardRef) r).cardId());
    }

    public Optional<CollectionId> resolveCollectionId(String uri) {
        return resolveAtUri(uri)
                .filter(ResolvedAtUri.CollectionRef.class::isInstance)
                .map(r -> ((ResolvedAtUri.CollectionRef) r).collectionId());
    }

    public Optional<CollectionLinkId> resolveCollectionLinkId(String uri) {
        return resolveAtUri(uri)
                .filter(ResolvedAtUri.CollectionLinkRef.class::isInstance)
                .map(r -> ((ResolvedAtUri.CollectionLinkRef) r).linkId());
    }

    private Optional<ResolvedAtUri> findLink(Collection collection, String uri) {
        for (CardLink link : collection.getCardLinks()) {
            if (link.getPublishedRecordId() != null && uri.equals(link.getPublishedRecordId().uri())) {
                return Optional.of(new ResolvedAtUri.CollectionLinkRef(
                        new CollectionLinkId(collection.getId(), link.getCardId())));
            }
        }
        return Optional.empty();
    }
}
