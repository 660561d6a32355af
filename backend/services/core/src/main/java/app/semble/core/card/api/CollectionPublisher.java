package app.semble.core.card.api;

import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.model.Collection;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;

/**
 * Writes collection and collection-link records. Failure semantics match {@link CardPublisher}.
 */
public interface CollectionPublisher {

    PublishedRecordId publish(Collection collection);

    void unpublish(PublishedRecordId recordId);

    PublishedRecordId publishCardAddedToCollection(Card card, Collection collection, CuratorId curatorId);

    void unpublishCardAddedToCollection(PublishedRecordId recordId);
}
