package app.semble.core.atproto.mapper;

import app.semble.core.card.domain.value.PublishedRecordId;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

final class StrongRefs {

    private StrongRefs() {
    }

    static ObjectNode toJson(ObjectMapper objectMapper, PublishedRecordId recordId) {
        ObjectNode ref = objectMapper.createObjectNode();
        ref.put("uri", recordId.uri());
        ref.put("cid", recordId.cid());
        return ref;
    }
}
