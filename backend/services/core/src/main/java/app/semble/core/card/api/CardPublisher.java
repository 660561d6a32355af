package app.semble.core.card.api;

import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;

/**
 * Writes library records for cards to the curator's remote repository.
 * <p>
 * Implementations throw {@link app.semble.core.common.error.PublisherAuthenticationException}
 * when the curator's credentials are rejected and
 * {@link app.semble.core.common.error.UnexpectedException} for any other failure.
 */
public interface CardPublisher {

    /**
     * Publishes the card into {@code curatorId}'s library. If the curator's membership
     * already has a record, that record is rewritten in place.
     *
     * @param parentCardRecordId record of the parent card, or {@code null} when the card has
     *                           no parent or the parent is unpublished
     */
    PublishedRecordId publishCardToLibrary(Card card, CuratorId curatorId, PublishedRecordId parentCardRecordId);

    void unpublishCardFromLibrary(PublishedRecordId recordId, CuratorId curatorId);
}
