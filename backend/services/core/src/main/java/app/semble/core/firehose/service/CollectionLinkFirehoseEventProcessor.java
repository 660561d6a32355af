package app.semble.core.firehose.service;

import app.semble.core.atproto.domain.AtUri;
import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.request.CollectionPublishOptions;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CollectionId;
import app.semble.core.card.domain.value.CollectionLinkId;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.card.repository.CardRepository;
import app.semble.core.card.service.AtUriResolutionService;
import app.semble.core.card.service.CardCollectionService;
import app.semble.core.common.error.CoreException;
import app.semble.core.common.error.UnexpectedException;
import app.semble.core.firehose.domain.CollectionLinkRecord;
import app.semble.core.firehose.domain.FirehoseEvent;
import app.semble.core.firehose.domain.FirehoseProcessingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class CollectionLinkFirehoseEventProcessor {

    private static final Logger log = LoggerFactory.getLogger(CollectionLinkFirehoseEventProcessor.class);

    private final AtUriResolutionService resolutionService;
    private final CardCollectionService cardCollectionService;
    private final CardRepository cardRepository;
    private final FirehoseRecordReader recordReader;

    public CollectionLinkFirehoseEventProcessor(AtUriResolutionService resolutionService,
                                                CardCollectionService cardCollectionService,
                                                CardRepository cardRepository,
                                                FirehoseRecordReader recordReader) {
        this.resolutionService = resolutionService;
        this.cardCollectionService = cardCollectionService;
        this.cardRepository = cardRepository;
        this.recordReader = recordReader;
    }

    public FirehoseProcessingResult process(FirehoseEvent event) {
        try {
            return switch (event.eventType()) {
                case CREATE -> handleCreate(event);
                case UPDATE -> FirehoseProcessingResult.IGNORED;
                case DELETE -> handleDelete(event);
            };
        } catch (UnexpectedException ex) {
            log.error("Collection link {} event for {} failed unexpectedly", event.eventType(), event.atUri(), ex);
            return FirehoseProcessingResult.IGNORED;
        } catch (CoreException ex) {
            log.warn("Ignoring collection link {} event for {}: {}", event.eventType(), event.atUri(), ex.getMessage());
            return FirehoseProcessingResult.IGNORED;
        } catch (RuntimeException ex) {
            log.error("Collection link {} event for {} failed with an internal error", event.eventType(), event.atUri(), ex);
            return FirehoseProcessingResult.IGNORED;
        }
    }

    private FirehoseProcessingResult handleCreate(FirehoseEvent event) {
        CuratorId curatorId = AtUri.parse(event.atUri()).curatorId();
        Optional<CollectionLinkRecord> record = recordReader.read(event, CollectionLinkRecord.class);
        if (record.isEmpty() || event.cid() == null
                || record.get().collection() == null || record.get().card() == null) {
            return FirehoseProcessingResult.IGNORED;
        }

        Optional<CollectionId> collectionId = resolutionService.resolveCollectionId(record.get().collection().uri());
        Optional<CardId> cardId = resolutionService.resolveCardId(record.get().card().uri());
        if (collectionId.isEmpty() || cardId.isEmpty()) {
            log.debug("Link {} references an unknown collection or card", event.atUri());
            return FirehoseProcessingResult.IGNORED;
        }
        Optional<Card> card = cardRepository.findById(cardId.get());
        if (card.isEmpty()) {
            return FirehoseProcessingResult.IGNORED;
        }

        PublishedRecordId recordId = new PublishedRecordId(event.atUri(), event.cid());
        cardCollectionService.addCardToCollection(card.get(), collectionId.get(), curatorId,
                CollectionPublishOptions.alreadyPublished(collectionId.get(), recordId));
        return FirehoseProcessingResult.APPLIED;
    }

    private FirehoseProcessingResult handleDelete(FirehoseEvent event) {
        CuratorId curatorId = AtUri.parse(event.atUri()).curatorId();
        Optional<CollectionLinkId> linkId = resolutionService.resolveCollectionLinkId(event.atUri());
        if (linkId.isEmpty()) {
            return FirehoseProcessingResult.IGNORED;
        }
        cardCollectionService.removeCardFromCollection(linkId.get().cardId(), linkId.get().collectionId(), curatorId,
                CollectionPublishOptions.skip());
        return FirehoseProcessingResult.APPLIED;
    }
}
