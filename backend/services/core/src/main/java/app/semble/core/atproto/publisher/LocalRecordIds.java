package app.semble.core.atproto.publisher;

import app.semble.core.atproto.domain.AtUri;
import app.semble.core.card.domain.value.PublishedRecordId;

import java.util.UUID;

final class LocalRecordIds {

    private LocalRecordIds() {
    }

    static PublishedRecordId mint(AtUri uri) {
        return new PublishedRecordId(uri.value(), "local-" + UUID.randomUUID().toString().replace("-", ""));
    }
}
