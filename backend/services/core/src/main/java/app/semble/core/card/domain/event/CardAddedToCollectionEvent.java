package app.semble.core.card.domain.event;

import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CollectionId;
import app.semble.core.card.domain.value.CuratorId;

import java.time.Instant;

public record CardAddedToCollectionEvent(CardId cardId,
                                         CollectionId collectionId,
                                         CuratorId addedBy,
                                         Instant occurredAt) {
}
