package app.semble.core.atproto.mapper;

import app.semble.core.atproto.config.AtprotoProps;
import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.model.CardLink;
import app.semble.core.card.domain.model.Collection;
import app.semble.core.card.domain.model.LibraryMembership;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.common.error.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
public class CollectionRecordMapper {

    private final ObjectMapper objectMapper;
    private final AtprotoProps props;

    public CollectionRecordMapper(ObjectMapper objectMapper, AtprotoProps props) {
        this.objectMapper = objectMapper;
        this.props = props;
    }

    public ObjectNode toRecord(Collection collection) {
        ObjectNode record = objectMapper.createObjectNode();
        record.put("$type", props.collections().collection());
        record.put("name", collection.getName().value());
        if (collection.getDescription() != null) {
            record.put("description", collection.getDescription().value());
        }
        record.put("accessType", collection.getAccessType().name());
        ArrayNode collaborators = record.putArray("collaborators");
        collection.getCollaborators().forEach(c -> collaborators.add(c.value()));
        record.put("createdAt", collection.getCreatedAt().toString());
        record.put("updatedAt", collection.getUpdatedAt().toString());
        return record;
    }

    public ObjectNode toLinkRecord(Collection collection, Card card, CuratorId addedBy) {
        PublishedRecordId collectionRecord = collection.getPublishedRecordId();
        if (collectionRecord == null) {
            throw new ValidationException("Collection " + collection.getId() + " has not been published");
        }
        PublishedRecordId cardRecord = card.findMembership(addedBy)
                .map(LibraryMembership::getPublishedRecordId)
                .orElse(card.getPublishedRecordId());
        if (cardRecord == null) {
            throw new ValidationException("Card " + card.getId() + " has not been published");
        }
        Instant addedAt = collection.findCardLink(card.getId())
                .map(CardLink::getAddedAt)
                .orElse(Instant.now());

        ObjectNode record = objectMapper.createObjectNode();
        record.put("$type", props.collections().collectionLink());
        record.set("collection", StrongRefs.toJson(objectMapper, collectionRecord));
        record.set("card", StrongRefs.toJson(objectMapper, cardRecord));
        record.put("addedBy", addedBy.value());
        record.put("addedAt", addedAt.toString());
        record.put("createdAt", Instant.now().toString());
        return record;
    }
}
