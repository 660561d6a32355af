package app.semble.core.card.domain.value;

import java.util.Objects;

public record CollectionLinkId(CollectionId collectionId, CardId cardId) {

    public CollectionLinkId {
        Objects.requireNonNull(collectionId, "collectionId");
        Objects.requireNonNull(cardId, "cardId");
    }
}
