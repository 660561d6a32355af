package app.semble.core.card.domain.dto;

import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CollectionId;

import java.util.List;

public record UrlCardAssociationsResult(
        CardId urlCardId,
        CardId noteCardId,
        List<CollectionId> addedToCollections,
        List<CollectionId> removedFromCollections
) {
}
