package app.semble.core.card.adapter;

import app.semble.core.card.domain.content.HighlightCardContent;
import app.semble.core.card.domain.content.HighlightSelector;
import app.semble.core.card.domain.content.UrlCardContent;
import app.semble.core.card.domain.content.UrlMetadata;
import app.semble.core.card.domain.entity.CardEntity;
import app.semble.core.card.domain.entity.CollectionEntity;
import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.model.CardFactory;
import app.semble.core.card.domain.model.Collection;
import app.semble.core.card.domain.type.CardType;
import app.semble.core.card.domain.type.CollectionAccessType;
import app.semble.core.card.domain.value.CollectionName;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.card.domain.value.Url;
import app.semble.core.common.error.UnexpectedException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardEntityMapperTest {

    private static final CuratorId ALICE = CuratorId.of("did:plc:alice");
    private static final CuratorId BOB = CuratorId.of("did:plc:bob");
    private static final Url URL = Url.of("https://example.com/a");

    private final CardContentJsonMapper contentMapper = new CardContentJsonMapper(new ObjectMapper());
    private final CardEntityMapper cardMapper = new CardEntityMapper(contentMapper);
    private final CollectionEntityMapper collectionMapper = new CollectionEntityMapper();

    @Test
    void urlCard_survivesEntityMapping() {
        UrlMetadata metadata = new UrlMetadata(URL, "Title", "Desc", "Author",
                Instant.parse("2024-01-02T03:04:05Z"), "Example", null, "article", Instant.parse("2024-05-01T00:00:00Z"));
        Card card = CardFactory.urlCard(ALICE, URL, metadata);
        card.addToLibrary(ALICE);
        card.addToLibrary(BOB);
        card.markCardInLibraryAsPublished(BOB, PublishedRecordId.of("at://did:plc:bob/network.cosmik.card/b", "cidB"));

        CardEntity entity = new CardEntity();
        cardMapper.copyToEntity(card, entity);
        Card restored = cardMapper.toDomain(entity);

        assertThat(entity.getLibraryCount()).isEqualTo(2);
        assertThat(entity.getContent().get("type").asText()).isEqualTo("URL");
        assertThat(restored.getId()).isEqualTo(card.getId());
        assertThat(restored.getType()).isEqualTo(CardType.URL);
        assertThat(((UrlCardContent) restored.getContent()).metadata()).isEqualTo(metadata);
        assertThat(restored.getPublishedRecordId()).isEqualTo(card.getPublishedRecordId());
        assertThat(restored.findMembership(ALICE).get().isPublished()).isFalse();
        assertThat(restored.findMembership(BOB).get().getPublishedRecordId().cid()).isEqualTo("cidB");
    }

    @Test
    void highlightSelectors_keepTheirKinds() {
        HighlightCardContent content = new HighlightCardContent("quoted",
                List.of(new HighlightSelector.TextQuote("quoted", "a", "b"),
                        new HighlightSelector.TextPosition(3, 9),
                        new HighlightSelector.Range("/p[1]", 0, "/p[2]", 4)),
                "context", URL.value(), "Doc");
        Card card = CardFactory.highlightCard(ALICE, content, CardFactory.urlCard(ALICE, URL, null).getId(), URL);

        CardEntity entity = new CardEntity();
        cardMapper.copyToEntity(card, entity);

        assertThat(cardMapper.toDomain(entity).getContent()).isEqualTo(content);
    }

    @Test
    void corruptContent_isReportedAsUnexpected() {
        CardEntity entity = new CardEntity();
        cardMapper.copyToEntity(CardFactory.urlCard(ALICE, URL, null), entity);
        entity.setContent(TextNode.valueOf("garbage"));

        assertThatThrownBy(() -> cardMapper.toDomain(entity)).isInstanceOf(UnexpectedException.class);
    }

    @Test
    void collection_survivesEntityMapping() {
        Collection collection = Collection.create(ALICE, CollectionName.of("Reading"), null,
                CollectionAccessType.OPEN, List.of(BOB));
        Card card = CardFactory.urlCard(ALICE, URL, null);
        collection.addCard(card.getId(), BOB);
        collection.markCardLinkAsPublished(card.getId(),
                PublishedRecordId.of("at://did:plc:bob/network.cosmik.collectionLink/l", "cidL"));

        CollectionEntity entity = new CollectionEntity();
        collectionMapper.copyToEntity(collection, entity);
        Collection restored = collectionMapper.toDomain(entity);

        assertThat(restored.getId()).isEqualTo(collection.getId());
        assertThat(restored.getAccessType()).isEqualTo(CollectionAccessType.OPEN);
        assertThat(restored.getCollaborators()).containsExactly(BOB);
        assertThat(restored.getDescription()).isNull();
        assertThat(restored.findCardLink(card.getId()).get().getAddedBy()).isEqualTo(BOB);
        assertThat(restored.findCardLink(card.getId()).get().getPublishedRecordId().cid()).isEqualTo("cidL");
    }
}
