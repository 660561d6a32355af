package app.semble.core.card.repository;

import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.Url;

import java.util.Optional;

/**
 * Persistence port for {@link Card} aggregates. Implementations report storage failures
 * as {@link app.semble.core.common.error.UnexpectedException}.
 */
public interface CardRepository {

    Optional<Card> findById(CardId cardId);

    /**
     * Persists the card and returns the stored state, which carries the new version.
     */
    Card save(Card card);

    void delete(CardId cardId);

    Optional<Card> findUsersUrlCardByUrl(Url url, CuratorId curatorId);

    Optional<Card> findUsersNoteCardByUrl(Url url, CuratorId curatorId);

    /**
     * Finds the card whose own published record, or one of whose library memberships,
     * has the given AT-URI.
     */
    Optional<Card> findByPublishedRecordUri(String uri);
}
