package app.semble.core.card.service;

import app.semble.core.card.domain.event.CardAddedToCollectionEvent;
import app.semble.core.card.domain.event.CardAddedToLibraryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class CardActivityListener {

    private static final Logger log = LoggerFactory.getLogger(CardActivityListener.class);

    @EventListener
    public void onCardAddedToLibrary(CardAddedToLibraryEvent event) {
        log.info("Curator {} saved card {} at {}", event.curatorId(), event.cardId(), event.occurredAt());
    }

    @EventListener
    public void onCardAddedToCollection(CardAddedToCollectionEvent event) {
        log.info("Curator {} added card {} to collection {} at {}",
                event.addedBy(), event.cardId(), event.collectionId(), event.occurredAt());
    }
}
