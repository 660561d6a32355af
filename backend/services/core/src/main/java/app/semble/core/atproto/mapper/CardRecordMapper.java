package app.semble.core.atproto.mapper;

import app.semble.core.atproto.config.AtprotoProps;
import app.semble.core.card.adapter.CardContentJsonMapper;
import app.semble.core.card.domain.content.CardContent;
import app.semble.core.card.domain.content.HighlightCardContent;
import app.semble.core.card.domain.content.NoteCardContent;
import app.semble.core.card.domain.content.UrlCardContent;
import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

@Component
public class CardRecordMapper {

    private final ObjectMapper objectMapper;
    private final CardContentJsonMapper contentMapper;
    private final AtprotoProps props;

    public CardRecordMapper(ObjectMapper objectMapper, CardContentJsonMapper contentMapper, AtprotoProps props) {
        this.objectMapper = objectMapper;
        this.contentMapper = contentMapper;
        this.props = props;
    }

    public ObjectNode toRecord(Card card, CuratorId curatorId, PublishedRecordId parentRecordId) {
        String nsid = props.collections().card();
        ObjectNode record = objectMapper.createObjectNode();
        record.put("$type", nsid);
        record.put("type", card.getType().name());
        record.set("content", content(nsid, card.getContent()));
        if (card.getUrl() != null) {
            record.put("url", card.getUrl().value());
        }
        if (parentRecordId != null) {
            record.set("parentCard", StrongRefs.toJson(objectMapper, parentRecordId));
        }
        // a curator saving someone else's card points back at the original record
        if (!card.isAuthoredBy(curatorId) && card.getPublishedRecordId() != null) {
            record.set("originalCard", StrongRefs.toJson(objectMapper, card.getPublishedRecordId()));
        }
        record.put("createdAt", card.getCreatedAt().toString());
        return record;
    }

    private ObjectNode content(String nsid, CardContent content) {
        ObjectNode node = objectMapper.createObjectNode();
        if (content instanceof UrlCardContent url) {
            node.put("$type", nsid + "#urlContent");
            node.put("url", url.url().value());
            if (url.metadata() != null) {
                ObjectNode metadata = contentMapper.metadataToJson(url.metadata());
                metadata.put("$type", nsid + "#urlMetadata");
                node.set("metadata", metadata);
            }
        } else if (content instanceof NoteCardContent note) {
            node.put("$type", nsid + "#noteContent");
            node.put("text", note.text());
        } else if (content instanceof HighlightCardContent highlight) {
            node.put("$type", nsid + "#highlightContent");
            node.put("text", highlight.text());
            node.set("selectors", contentMapper.selectorsToJson(highlight.selectors()));
            if (highlight.context() != null) {
                node.put("context", highlight.context());
            }
        }
        return node;
    }
}
