package app.semble.core.card.adapter;

import app.semble.core.card.domain.entity.CardLinkEmbeddable;
import app.semble.core.card.domain.entity.CollectionEntity;
import app.semble.core.card.domain.model.CardLink;
import app.semble.core.card.domain.model.Collection;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CollectionDescription;
import app.semble.core.card.domain.value.CollectionId;
import app.semble.core.card.domain.value.CollectionName;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class CollectionEntityMapper {

    public Collection toDomain(CollectionEntity entity) {
        List<CuratorId> collaborators = entity.getCollaborators().stream()
                .map(CuratorId::of)
                .toList();
        List<CardLink> links = entity.getCardLinks().stream()
                .map(l -> new CardLink(
                        new CardId(l.getCardId()),
                        CuratorId.of(l.getAddedBy()),
                        l.getAddedAt(),
                        CardEntityMapper.recordId(l.getPublishedRecordUri(), l.getPublishedRecordCid())))
                .toList();
        return Collection.restore(
                new CollectionId(entity.getCollectionId()),
                CuratorId.of(entity.getAuthorId()),
                CollectionName.of(entity.getName()),
                CollectionDescription.ofNullable(entity.getDescription()),
                entity.getAccessType(),
                collaborators,
                links,
                CardEntityMapper.recordId(entity.getPublishedRecordUri(), entity.getPublishedRecordCid()),
                entity.getCreatedAt(),
                entity.getUpdatedAt(),
                entity.getVersion());
    }

    public void copyToEntity(Collection collection, CollectionEntity entity) {
        PublishedRecordId recordId = collection.getPublishedRecordId();
        entity.setCollectionId(collection.getId().value());
        entity.setAuthorId(collection.getAuthorId().value());
        entity.setName(collection.getName().value());
        entity.setDescription(collection.getDescription() == null ? null : collection.getDescription().value());
        entity.setAccessType(collection.getAccessType());
        entity.setPublishedRecordUri(recordId == null ? null : recordId.uri());
        entity.setPublishedRecordCid(recordId == null ? null : recordId.cid());
        entity.setCreatedAt(collection.getCreatedAt());
        entity.setUpdatedAt(collection.getUpdatedAt());

        entity.getCollaborators().clear();
        collection.getCollaborators().forEach(c -> entity.getCollaborators().add(c.value()));

        entity.getCardLinks().clear();
        for (CardLink link : collection.getCardLinks()) {
            PublishedRecordId linkRecord = link.getPublishedRecordId();
            entity.getCardLinks().add(new CardLinkEmbeddable(
                    link.getCardId().value(),
                    link.getAddedBy().value(),
                    link.getAddedAt(),
                    linkRecord == null ? null : linkRecord.uri(),
                    linkRecord == null ? null : linkRecord.cid()));
        }
    }
}
