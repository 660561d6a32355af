package app.semble.core.atproto.publisher;

import app.semble.core.atproto.config.AtprotoProps;
import app.semble.core.atproto.domain.AtUri;
import app.semble.core.atproto.domain.RecordKeys;
import app.semble.core.card.api.CollectionPublisher;
import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.model.Collection;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "app.atproto", name = "publishing-mode", havingValue = "local", matchIfMissing = true)
public class LocalCollectionPublisher implements CollectionPublisher {

    private static final Logger log = LoggerFactory.getLogger(LocalCollectionPublisher.class);

    private final AtprotoProps props;

    public LocalCollectionPublisher(AtprotoProps props) {
        this.props = props;
    }

    @Override
    public PublishedRecordId publish(Collection collection) {
        String rkey = collection.getPublishedRecordId() == null
                ? RecordKeys.next()
                : AtUri.parse(collection.getPublishedRecordId().uri()).rkey();
        PublishedRecordId recordId = LocalRecordIds.mint(
                AtUri.of(collection.getAuthorId(), props.collections().collection(), rkey));
        log.debug("Locally published collection {} as {}", collection.getId(), recordId.uri());
        return recordId;
    }

    @Override
    public void unpublish(PublishedRecordId recordId) {
        log.debug("Locally unpublished collection record {}", recordId.uri());
    }

    @Override
    public PublishedRecordId publishCardAddedToCollection(Card card, Collection collection, CuratorId curatorId) {
        PublishedRecordId recordId = LocalRecordIds.mint(
                AtUri.of(curatorId, props.collections().collectionLink(), RecordKeys.next()));
        log.debug("Locally published link of card {} in collection {} as {}",
                card.getId(), collection.getId(), recordId.uri());
        return recordId;
    }

    @Override
    public void unpublishCardAddedToCollection(PublishedRecordId recordId) {
        log.debug("Locally unpublished link record {}", recordId.uri());
    }
}
