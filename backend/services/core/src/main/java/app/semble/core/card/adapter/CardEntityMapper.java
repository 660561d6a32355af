package app.semble.core.card.adapter;

import app.semble.core.card.domain.entity.CardEntity;
import app.semble.core.card.domain.entity.LibraryMembershipEmbeddable;
import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.model.LibraryMembership;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.card.domain.value.Url;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class CardEntityMapper {

    private final CardContentJsonMapper contentMapper;

    public CardEntityMapper(CardContentJsonMapper contentMapper) {
        this.contentMapper = contentMapper;
    }

    public Card toDomain(CardEntity entity) {
        List<LibraryMembership> memberships = entity.getLibraryMemberships().stream()
                .map(m -> new LibraryMembership(
                        CuratorId.of(m.getCuratorId()),
                        m.getAddedAt(),
                        recordId(m.getPublishedRecordUri(), m.getPublishedRecordCid())))
                .toList();
        return Card.restore(
                new CardId(entity.getCardId()),
                CuratorId.of(entity.getCuratorId()),
                contentMapper.fromJson(entity.getCardType(), entity.getContent()),
                entity.getParentCardId() == null ? null : new CardId(entity.getParentCardId()),
                entity.getUrl() == null ? null : Url.of(entity.getUrl()),
                memberships,
                entity.getLibraryCount(),
                recordId(entity.getPublishedRecordUri(), entity.getPublishedRecordCid()),
                entity.getCreatedAt(),
                entity.getUpdatedAt(),
                entity.getVersion());
    }

    // copies aggregate state onto a new or managed entity
    public void copyToEntity(Card card, CardEntity entity) {
        entity.setCardId(card.getId().value());
        entity.setCuratorId(card.getCuratorId().value());
        entity.setCardType(card.getType());
        entity.setContent(contentMapper.toJson(card.getContent()));
        entity.setUrl(card.getUrl() == null ? null : card.getUrl().value());
        entity.setParentCardId(card.getParentCardId() == null ? null : card.getParentCardId().value());
        entity.setLibraryCount(card.getLibraryCount());
        entity.setPublishedRecordUri(card.getPublishedRecordId() == null ? null : card.getPublishedRecordId().uri());
        entity.setPublishedRecordCid(card.getPublishedRecordId() == null ? null : card.getPublishedRecordId().cid());
        entity.setCreatedAt(card.getCreatedAt());
        entity.setUpdatedAt(card.getUpdatedAt());

        List<LibraryMembershipEmbeddable> memberships = new ArrayList<>();
        for (LibraryMembership membership : card.getLibraryMemberships()) {
            PublishedRecordId recordId = membership.getPublishedRecordId();
            memberships.add(new LibraryMembershipEmbeddable(
                    membership.getCuratorId().value(),
                    membership.getAddedAt(),
                    recordId == null ? null : recordId.uri(),
                    recordId == null ? null : recordId.cid()));
        }
        entity.getLibraryMemberships().clear();
        entity.getLibraryMemberships().addAll(memberships);
    }

    static PublishedRecordId recordId(String uri, String cid) {
        if (uri == null || cid == null) {
            return null;
        }
        return new PublishedRecordId(uri, cid);
    }
}
