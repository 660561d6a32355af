package app.semble.core.card.domain.dto;

import app.semble.core.card.domain.value.CardId;

public record AddUrlToLibraryResult(CardId urlCardId, CardId noteCardId) {
}
