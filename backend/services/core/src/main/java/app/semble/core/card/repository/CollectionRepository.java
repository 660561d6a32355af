package app.semble.core.card.repository;

import app.semble.core.card.domain.model.Collection;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CollectionId;
import app.semble.core.card.domain.value.CuratorId;

import java.util.List;
import java.util.Optional;

/**
 * Persistence port for {@link Collection} aggregates.
 */
public interface CollectionRepository {

    Optional<Collection> findById(CollectionId collectionId);

    Collection save(Collection collection);

    void delete(CollectionId collectionId);

    /**
     * Collections authored by {@code curatorId} that currently link {@code cardId}.
     */
    List<Collection> findByCuratorContainingCard(CuratorId curatorId, CardId cardId);

    Optional<Collection> findByPublishedRecordUri(String uri);

    Optional<Collection> findByCardLinkPublishedRecordUri(String uri);
}
