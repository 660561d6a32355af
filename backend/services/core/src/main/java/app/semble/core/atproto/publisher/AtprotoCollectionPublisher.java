package app.semble.core.atproto.publisher;

import app.semble.core.atproto.client.AtprotoRepoClient;
import app.semble.core.atproto.config.AtprotoProps;
import app.semble.core.atproto.domain.AtUri;
import app.semble.core.atproto.mapper.CollectionRecordMapper;
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
@ConditionalOnProperty(prefix = "app.atproto", name = "publishing-mode", havingValue = "pds")
public class AtprotoCollectionPublisher implements CollectionPublisher {

    private static final Logger log = LoggerFactory.getLogger(AtprotoCollectionPublisher.class);

    private final AtprotoRepoClient repoClient;
    private final CollectionRecordMapper recordMapper;
    private final AtprotoProps props;

    public AtprotoCollectionPublisher(AtprotoRepoClient repoClient, CollectionRecordMapper recordMapper, AtprotoProps props) {
        this.repoClient = repoClient;
        this.recordMapper = recordMapper;
        this.props = props;
    }

    @Override
    public PublishedRecordId publish(Collection collection) {
        String nsid = props.collections().collection();
        PublishedRecordId existing = collection.getPublishedRecordId();
        PublishedRecordId published = existing == null
                ? repoClient.createRecord(collection.getAuthorId(), nsid, recordMapper.toRecord(collection))
                : repoClient.putRecord(collection.getAuthorId(), nsid, AtUri.parse(existing.uri()).rkey(),
                recordMapper.toRecord(collection));
        log.debug("Published collection {} as {}", collection.getId(), published.uri());
        return published;
    }

    @Override
    public void unpublish(PublishedRecordId recordId) {
        delete(recordId);
    }

    @Override
    public PublishedRecordId publishCardAddedToCollection(Card card, Collection collection, CuratorId curatorId) {
        PublishedRecordId published = repoClient.createRecord(curatorId, props.collections().collectionLink(),
                recordMapper.toLinkRecord(collection, card, curatorId));
        log.debug("Published link of card {} in collection {} as {}", card.getId(), collection.getId(), published.uri());
        return published;
    }

    @Override
    public void unpublishCardAddedToCollection(PublishedRecordId recordId) {
        delete(recordId);
    }

    private void delete(PublishedRecordId recordId) {
        AtUri uri = AtUri.parse(recordId.uri());
        repoClient.deleteRecord(uri.curatorId(), uri.collection(), uri.rkey());
        log.debug("Deleted record {}", recordId.uri());
    }
}
