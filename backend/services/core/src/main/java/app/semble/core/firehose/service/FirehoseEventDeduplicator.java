package app.semble.core.firehose.service;

import app.semble.core.card.domain.dto.ResolvedAtUri;
import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.model.CardLink;
import app.semble.core.card.domain.model.LibraryMembership;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.card.repository.CardRepository;
import app.semble.core.card.repository.CollectionRepository;
import app.semble.core.card.service.AtUriResolutionService;
import app.semble.core.firehose.domain.FirehoseEvent;
import app.semble.core.firehose.domain.FirehoseEventType;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

@Component
public class FirehoseEventDeduplicator {

    private final AtUriResolutionService resolutionService;
    private final CardRepository cardRepository;
    private final CollectionRepository collectionRepository;

    public FirehoseEventDeduplicator(AtUriResolutionService resolutionService,
                                     CardRepository cardRepository,
                                     CollectionRepository collectionRepository) {
        this.resolutionService = resolutionService;
        this.cardRepository = cardRepository;
        this.collectionRepository = collectionRepository;
    }

    public boolean isAlreadyApplied(FirehoseEvent event) {
        Optional<ResolvedAtUri> resolved = resolutionService.resolveAtUri(event.atUri());
        if (event.eventType() == FirehoseEventType.DELETE) {
            return resolved.isEmpty();
        }
        if (resolved.isEmpty() || event.cid() == null) {
            return false;
        }
        PublishedRecordId expected = new PublishedRecordId(event.atUri(), event.cid());
        ResolvedAtUri target = resolved.get();
        if (target instanceof ResolvedAtUri.CardRef ref) {
            return cardRepository.findById(ref.cardId())
                    .map(card -> cardCarries(card, expected))
                    .orElse(false);
        }
        if (target instanceof ResolvedAtUri.CollectionRef ref) {
            return collectionRepository.findById(ref.collectionId())
                    .map(collection -> expected.equals(collection.getPublishedRecordId()))
                    .orElse(false);
        }
        ResolvedAtUri.CollectionLinkRef ref = (ResolvedAtUri.CollectionLinkRef) target;
        return collectionRepository.findById(ref.linkId().collectionId())
                .flatMap(collection -> collection.findCardLink(ref.linkId().cardId()))
                .map(CardLink::getPublishedRecordId)
                .map(expected::equals)
                .orElse(false);
    }

    private static boolean cardCarries(Card card, PublishedRecordId expected) {
        if (expected.equals(card.getPublishedRecordId())) {
            return true;
        }
        return card.getLibraryMemberships().stream()
                .map(LibraryMembership::getPublishedRecordId)
                .anyMatch(id -> Objects.equals(id, expected));
    }
}
