package app.semble.core.card.domain.dto;

import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CollectionId;
import app.semble.core.card.domain.value.CollectionLinkId;

/**
 * Local entity that an AT-URI was resolved to.
 */
public sealed interface ResolvedAtUri
        permits ResolvedAtUri.CardRef, ResolvedAtUri.CollectionRef, ResolvedAtUri.CollectionLinkRef {

    AtUriResourceType type();

    record CardRef(CardId cardId) implements ResolvedAtUri {
        @Override
        public AtUriResourceType type() {
            return AtUriResourceType.CARD;
        }
    }

    record CollectionRef(CollectionId collectionId) implements ResolvedAtUri {
        @Override
        public AtUriResourceType type() {
            return AtUriResourceType.COLLECTION;
        }
    }

    record CollectionLinkRef(CollectionLinkId linkId) implements ResolvedAtUri {
        @Override
        public AtUriResourceType type() {
            return AtUriResourceType.COLLECTION_LINK;
        }
    }
}
