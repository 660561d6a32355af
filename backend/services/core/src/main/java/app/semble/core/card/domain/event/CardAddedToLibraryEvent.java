package app.semble.core.card.domain.event;

import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CuratorId;

import java.time.Instant;

public record CardAddedToLibraryEvent(CardId cardId, CuratorId curatorId, Instant occurredAt) {
}
