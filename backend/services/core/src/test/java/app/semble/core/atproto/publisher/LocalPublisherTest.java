package app.semble.core.atproto.publisher;

import app.semble.core.atproto.config.AtprotoProps;
import app.semble.core.atproto.domain.AtUri;
import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.model.CardFactory;
import app.semble.core.card.domain.model.Collection;
import app.semble.core.card.domain.value.CollectionName;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.card.domain.value.Url;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LocalPublisherTest {

    private static final CuratorId ALICE = CuratorId.of("did:plc:alice");

    private final AtprotoProps props = new AtprotoProps(null, null, null, null);
    private final LocalCardPublisher cardPublisher = new LocalCardPublisher(props);
    private final LocalCollectionPublisher collectionPublisher = new LocalCollectionPublisher(props);

    @Test
    void cardRecords_liveInCuratorsRepositoryAndKeepTheirKeyOnRepublish() {
        Card card = CardFactory.urlCard(ALICE, Url.of("https://example.com/a"), null);
        PublishedRecordId first = cardPublisher.publishCardToLibrary(card, ALICE, null);
        card.addToLibrary(ALICE);
        card.markCardInLibraryAsPublished(ALICE, first);

        PublishedRecordId second = cardPublisher.publishCardToLibrary(card, ALICE, null);

        AtUri uri = AtUri.parse(first.uri());
        assertThat(uri.did()).isEqualTo(ALICE.value());
        assertThat(uri.collection()).isEqualTo("network.cosmik.card");
        assertThat(second.uri()).isEqualTo(first.uri());
        assertThat(second.cid()).isNotEqualTo(first.cid());
    }

    @Test
    void collectionRecords_useConfiguredCollections() {
        Collection collection = Collection.create(ALICE, CollectionName.of("Reading"), null, null, List.of());
        Card card = CardFactory.urlCard(ALICE, Url.of("https://example.com/a"), null);

        PublishedRecordId collectionRecord = collectionPublisher.publish(collection);
        PublishedRecordId linkRecord = collectionPublisher.publishCardAddedToCollection(card, collection, ALICE);

        assertThat(AtUri.parse(collectionRecord.uri()).collection()).isEqualTo("network.cosmik.collection");
        assertThat(AtUri.parse(linkRecord.uri()).collection()).isEqualTo("network.cosmik.collectionLink");
    }
}
