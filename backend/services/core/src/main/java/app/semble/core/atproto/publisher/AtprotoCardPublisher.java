package app.semble.core.atproto.publisher;

import app.semble.core.atproto.client.AtprotoRepoClient;
import app.semble.core.atproto.config.AtprotoProps;
import app.semble.core.atproto.domain.AtUri;
import app.semble.core.atproto.mapper.CardRecordMapper;
import app.semble.core.card.api.CardPublisher;
import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.model.LibraryMembership;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "app.atproto", name = "publishing-mode", havingValue = "pds")
public class AtprotoCardPublisher implements CardPublisher {

    private static final Logger log = LoggerFactory.getLogger(AtprotoCardPublisher.class);

    private final AtprotoRepoClient repoClient;
    private final CardRecordMapper recordMapper;
    private final AtprotoProps props;

    public AtprotoCardPublisher(AtprotoRepoClient repoClient, CardRecordMapper recordMapper, AtprotoProps props) {
        this.repoClient = repoClient;
        this.recordMapper = recordMapper;
        this.props = props;
    }

    @Override
    public PublishedRecordId publishCardToLibrary(Card card, CuratorId curatorId, PublishedRecordId parentCardRecordId) {
        ObjectNode record = recordMapper.toRecord(card, curatorId, parentCardRecordId);
        String nsid = props.collections().card();
        PublishedRecordId existing = card.findMembership(curatorId)
                .map(LibraryMembership::getPublishedRecordId)
                .orElse(null);

        PublishedRecordId published;
        if (existing != null) {
            published = repoClient.putRecord(curatorId, nsid, AtUri.parse(existing.uri()).rkey(), record);
        } else {
            published = repoClient.createRecord(curatorId, nsid, record);
        }
        log.debug("Published card {} for {} as {}", card.getId(), curatorId, published.uri());
        return published;
    }

    @Override
    public void unpublishCardFromLibrary(PublishedRecordId recordId, CuratorId curatorId) {
        AtUri uri = AtUri.parse(recordId.uri());
        repoClient.deleteRecord(curatorId, uri.collection(), uri.rkey());
        log.debug("Deleted card record {} of {}", recordId.uri(), curatorId);
    }
}
