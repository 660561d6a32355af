package app.semble.core.firehose.service;

import app.semble.core.atproto.config.AtprotoProps;
import app.semble.core.atproto.domain.AtUri;
import app.semble.core.firehose.config.FirehoseProps;
import app.semble.core.firehose.domain.FirehoseEvent;
import app.semble.core.firehose.domain.FirehoseProcessingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class FirehoseEventRouter {

    private static final Logger log = LoggerFactory.getLogger(FirehoseEventRouter.class);

    private final AtprotoProps atprotoProps;
    private final FirehoseProps firehoseProps;
    private final FirehoseEventDeduplicator deduplicator;
    private final CardFirehoseEventProcessor cardProcessor;
    private final CollectionFirehoseEventProcessor collectionProcessor;
    private final CollectionLinkFirehoseEventProcessor collectionLinkProcessor;

    public FirehoseEventRouter(AtprotoProps atprotoProps,
                               FirehoseProps firehoseProps,
                               FirehoseEventDeduplicator deduplicator,
                               CardFirehoseEventProcessor cardProcessor,
                               CollectionFirehoseEventProcessor collectionProcessor,
                               CollectionLinkFirehoseEventProcessor collectionLinkProcessor) {
        this.atprotoProps = atprotoProps;
        this.firehoseProps = firehoseProps;
        this.deduplicator = deduplicator;
        this.cardProcessor = cardProcessor;
        this.collectionProcessor = collectionProcessor;
        this.collectionLinkProcessor = collectionLinkProcessor;
    }

    public FirehoseProcessingResult route(FirehoseEvent event) {
        Optional<AtUri> atUri = AtUri.tryParse(event.atUri());
        if (atUri.isEmpty()) {
            log.debug("Dropping event with malformed AT URI {}", event.atUri());
            return FirehoseProcessingResult.IGNORED;
        }

        String nsid = atUri.get().collection();
        AtprotoProps.Collections collections = atprotoProps.collections();
        boolean known = nsid.equals(collections.card())
                || nsid.equals(collections.collection())
                || nsid.equals(collections.collectionLink());
        if (!known) {
            return FirehoseProcessingResult.IGNORED;
        }

        if (Boolean.TRUE.equals(firehoseProps.deduplicate()) && alreadyApplied(event)) {
            log.debug("Skipping duplicate {} event for {}", event.eventType(), event.atUri());
            return FirehoseProcessingResult.SKIPPED;
        }

        if (nsid.equals(collections.card())) {
            return cardProcessor.process(event);
        }
        if (nsid.equals(collections.collection())) {
            return collectionProcessor.process(event);
        }
        return collectionLinkProcessor.process(event);
    }

    private boolean alreadyApplied(FirehoseEvent event) {
        try {
            return deduplicator.isAlreadyApplied(event);
        } catch (RuntimeException ex) {
            log.warn("Duplicate check failed for {}, processing anyway: {}", event.atUri(), ex.getMessage());
            return false;
        }
    }
}
