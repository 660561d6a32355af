package app.semble.core.atproto.publisher;

import app.semble.core.atproto.config.AtprotoProps;
import app.semble.core.atproto.domain.AtUri;
import app.semble.core.atproto.domain.RecordKeys;
import app.semble.core.card.api.CardPublisher;
import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.model.LibraryMembership;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "app.atproto", name = "publishing-mode", havingValue = "local", matchIfMissing = true)
public class LocalCardPublisher implements CardPublisher {

    private static final Logger log = LoggerFactory.getLogger(LocalCardPublisher.class);

    private final AtprotoProps props;

    public LocalCardPublisher(AtprotoProps props) {
        this.props = props;
    }

    @Override
    public PublishedRecordId publishCardToLibrary(Card card, CuratorId curatorId, PublishedRecordId parentCardRecordId) {
        String rkey = card.findMembership(curatorId)
                .map(LibraryMembership::getPublishedRecordId)
                .map(existing -> AtUri.parse(existing.uri()).rkey())
                .orElseGet(RecordKeys::next);
        PublishedRecordId recordId = LocalRecordIds.mint(AtUri.of(curatorId, props.collections().card(), rkey));
        log.debug("Locally published card {} for {} as {}", card.getId(), curatorId, recordId.uri());
        return recordId;
    }

    @Override
    public void unpublishCardFromLibrary(PublishedRecordId recordId, CuratorId curatorId) {
        log.debug("Locally unpublished card record {} of {}", recordId.uri(), curatorId);
    }
}
