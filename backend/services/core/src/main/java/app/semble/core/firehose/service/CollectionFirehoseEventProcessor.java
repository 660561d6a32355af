package app.semble.core.firehose.service;

import app.semble.core.atproto.domain.AtUri;
import app.semble.core.card.domain.request.CreateCollectionRequest;
import app.semble.core.card.domain.request.OperationContext;
import app.semble.core.card.domain.request.UpdateCollectionRequest;
import app.semble.core.card.domain.type.CollectionAccessType;
import app.semble.core.card.domain.value.CollectionId;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.card.service.AtUriResolutionService;
import app.semble.core.card.service.CollectionCommandService;
import app.semble.core.common.error.CoreException;
import app.semble.core.common.error.UnexpectedException;
import app.semble.core.firehose.domain.CollectionRecord;
import app.semble.core.firehose.domain.FirehoseEvent;
import app.semble.core.firehose.domain.FirehoseProcessingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

@Service
public class CollectionFirehoseEventProcessor {

    private static final Logger log = LoggerFactory.getLogger(CollectionFirehoseEventProcessor.class);

    private final AtUriResolutionService resolutionService;
    private final CollectionCommandService collectionCommandService;
    private final FirehoseRecordReader recordReader;

    public CollectionFirehoseEventProcessor(AtUriResolutionService resolutionService,
                                            CollectionCommandService collectionCommandService,
                                            FirehoseRecordReader recordReader) {
        this.resolutionService = resolutionService;
        this.collectionCommandService = collectionCommandService;
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
            log.error("Collection {} event for {} failed unexpectedly", event.eventType(), event.atUri(), ex);
            return FirehoseProcessingResult.IGNORED;
        } catch (CoreException ex) {
            log.warn("Ignoring collection {} event for {}: {}", event.eventType(), event.atUri(), ex.getMessage());
            return FirehoseProcessingResult.IGNORED;
        } catch (RuntimeException ex) {
            log.error("Collection {} event for {} failed with an internal error", event.eventType(), event.atUri(), ex);
            return FirehoseProcessingResult.IGNORED;
        }
    }

    private FirehoseProcessingResult handleCreate(FirehoseEvent event) {
        CuratorId curatorId = AtUri.parse(event.atUri()).curatorId();
        Optional<CollectionRecord> record = recordReader.read(event, CollectionRecord.class);
        if (record.isEmpty() || event.cid() == null) {
            return FirehoseProcessingResult.IGNORED;
        }
        if (resolutionService.resolveCollectionId(event.atUri()).isPresent()) {
            log.debug("Collection {} already known", event.atUri());
            return FirehoseProcessingResult.IGNORED;
        }
        collectionCommandService.createCollection(new CreateCollectionRequest(
                curatorId.value(),
                record.get().name(),
                record.get().description(),
                accessType(record.get().accessType()),
                record.get().collaborators(),
                OperationContext.FIREHOSE_EVENT,
                new PublishedRecordId(event.atUri(), event.cid())));
        return FirehoseProcessingResult.APPLIED;
    }

    private FirehoseProcessingResult handleUpdate(FirehoseEvent event) {
        CuratorId curatorId = AtUri.parse(event.atUri()).curatorId();
        Optional<CollectionRecord> record = recordReader.read(event, CollectionRecord.class);
        if (record.isEmpty() || event.cid() == null) {
            return FirehoseProcessingResult.IGNORED;
        }
        Optional<CollectionId> collectionId = resolutionService.resolveCollectionId(event.atUri());
        if (collectionId.isEmpty()) {
            return FirehoseProcessingResult.IGNORED;
        }
        collectionCommandService.updateCollection(new UpdateCollectionRequest(
                collectionId.get().toString(),
                curatorId.value(),
                record.get().name(),
                record.get().description(),
                OperationContext.FIREHOSE_EVENT,
                new PublishedRecordId(event.atUri(), event.cid())));
        return FirehoseProcessingResult.APPLIED;
    }

    private FirehoseProcessingResult handleDelete(FirehoseEvent event) {
        CuratorId curatorId = AtUri.parse(event.atUri()).curatorId();
        Optional<CollectionId> collectionId = resolutionService.resolveCollectionId(event.atUri());
        if (collectionId.isEmpty()) {
            return FirehoseProcessingResult.IGNORED;
        }
        collectionCommandService.deleteCollection(collectionId.get().toString(), curatorId.value(),
                OperationContext.FIREHOSE_EVENT);
        return FirehoseProcessingResult.APPLIED;
    }

    private static CollectionAccessType accessType(String raw) {
        if (raw == null) {
            return CollectionAccessType.CLOSED;
        }
        return "OPEN".equals(raw.trim().toUpperCase(Locale.ROOT))
                ? CollectionAccessType.OPEN
                : CollectionAccessType.CLOSED;
    }
}
