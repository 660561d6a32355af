package app.semble.core.firehose.service;

import app.semble.core.atproto.domain.AtUri;
import app.semble.core.card.domain.request.AddUrlToLibraryRequest;
import app.semble.core.card.domain.request.LibraryPublishOptions;
import app.semble.core.card.domain.request.OperationContext;
import app.semble.core.card.domain.request.UpdateUrlCardAssociationsRequest;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.card.service.AtUriResolutionService;
import app.semble.core.card.service.LibraryCommandService;
import app.semble.core.card.service.UrlLibraryService;
import app.semble.core.common.error.CoreException;
import app.semble.core.common.error.UnexpectedException;
import app.semble.core.firehose.domain.CardRecord;
import app.semble.core.firehose.domain.FirehoseEvent;
import app.semble.core.firehose.domain.FirehoseProcessingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class CardFirehoseEventProcessor {

    private static final Logger log = LoggerFactory.getLogger(CardFirehoseEventProcessor.class);
    private static final String URL = "URL";
    private static final String NOTE = "NOTE";

    private final AtUriResolutionService resolutionService;
    private final UrlLibraryService urlLibraryService;
    private final LibraryCommandService libraryCommandService;
    private final FirehoseRecordReader recordReader;

    public CardFirehoseEventProcessor(AtUriResolutionService resolutionService,
                                      UrlLibraryService urlLibraryService,
                                      LibraryCommandService libraryCommandService,
                                      FirehoseRecordReader recordReader) {
        this.resolutionService = resolutionService;
        this.urlLibraryService = urlLibraryService;
        this.libraryCommandService = libraryCommandService;
        this.recordReader = recordReader;
    }

    public FirehoseProcessingResult process(FirehoseEvent event) {
        try {
            return switch (event.eventType()) {
                case CREATE -> handleCreate(event);
                case UPDATE -> handleUpdate(event);
                case DELETE -> handleDelete(event);
            };
        } catch (UnexpectedException ex) {
            log.error("Card {} event for {} failed unexpectedly", event.eventType(), event.atUri(), ex);
            return FirehoseProcessingResult.IGNORED;
        } catch (CoreException ex) {
            log.warn("Ignoring card {} event for {}: {}", event.eventType(), event.atUri(), ex.getMessage());
            return FirehoseProcessingResult.IGNORED;
        } catch (RuntimeException ex) {
            log.error("Card {} event for {} failed with an internal error", event.eventType(), event.atUri(), ex);
            return FirehoseProcessingResult.IGNORED;
        }
    }

    private FirehoseProcessingResult handleCreate(FirehoseEvent event) {
        CuratorId curatorId = AtUri.parse(event.atUri()).curatorId();
        if (event.cid() == null) {
            log.debug("Card create for {} has no cid", event.atUri());
            return FirehoseProcessingResult.IGNORED;
        }
        Optional<CardRecord> record = recordReader.read(event, CardRecord.class);
        if (record.isEmpty()) {
            return FirehoseProcessingResult.IGNORED;
        }
        PublishedRecordId recordId = new PublishedRecordId(event.atUri(), event.cid());

        String type = record.get().type();
        if (URL.equals(type)) {
            String url = record.get().resolvedUrl();
            if (url == null || url.isBlank()) {
                return FirehoseProcessingResult.IGNORED;
            }
            urlLibraryService.addUrlToLibrary(new AddUrlToLibraryRequest(
                    url, null, List.of(), curatorId.value(), OperationContext.FIREHOSE_EVENT, recordId));
            return FirehoseProcessingResult.APPLIED;
        }
        if (NOTE.equals(type)) {
            String text = record.get().text();
            String parentUri = record.get().parentCard() == null ? null : record.get().parentCard().uri();
            if (parentUri == null || text == null || text.isBlank()) {
                return FirehoseProcessingResult.IGNORED;
            }
            Optional<CardId> parentId = resolutionService.resolveCardId(parentUri);
            if (parentId.isEmpty()) {
                log.debug("Parent {} of note {} is unknown", parentUri, event.atUri());
                return FirehoseProcessingResult.IGNORED;
            }
            urlLibraryService.updateUrlCardAssociations(new UpdateUrlCardAssociationsRequest(
                    parentId.get().toString(), curatorId.value(), text, List.of(), List.of(),
                    OperationContext.FIREHOSE_EVENT, recordId, Map.of()));
            return FirehoseProcessingResult.APPLIED;
        }
        return FirehoseProcessingResult.IGNORED;
    }

    // only note text can change through an update
    private FirehoseProcessingResult handleUpdate(FirehoseEvent event) {
        CuratorId curatorId = AtUri.parse(event.atUri()).curatorId();
        Optional<CardRecord> record = recordReader.read(event, CardRecord.class);
        if (record.isEmpty() || event.cid() == null || !NOTE.equals(record.get().type())) {
            return FirehoseProcessingResult.IGNORED;
        }
        String text = record.get().text();
        if (text == null || text.isBlank()) {
            return FirehoseProcessingResult.IGNORED;
        }
        Optional<CardId> cardId = resolutionService.resolveCardId(event.atUri());
        if (cardId.isEmpty()) {
            return FirehoseProcessingResult.IGNORED;
        }
        libraryCommandService.updateNoteCard(cardId.get().toString(), curatorId.value(), text,
                LibraryPublishOptions.alreadyPublished(new PublishedRecordId(event.atUri(), event.cid())));
        return FirehoseProcessingResult.APPLIED;
    }

    private FirehoseProcessingResult handleDelete(FirehoseEvent event) {
        CuratorId curatorId = AtUri.parse(event.atUri()).curatorId();
        Optional<CardId> cardId = resolutionService.resolveCardId(event.atUri());
        if (cardId.isEmpty()) {
            return FirehoseProcessingResult.IGNORED;
        }
        libraryCommandService.removeCardFromLibrary(cardId.get().toString(), curatorId.value(),
                LibraryPublishOptions.skip());
        return FirehoseProcessingResult.APPLIED;
    }
}
