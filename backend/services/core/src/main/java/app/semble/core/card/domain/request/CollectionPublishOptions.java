package app.semble.core.card.domain.request;

import app.semble.core.card.domain.value.CollectionId;
import app.semble.core.card.domain.value.PublishedRecordId;

import java.util.Map;

public record CollectionPublishOptions(boolean skipPublishing, Map<CollectionId, PublishedRecordId> publishedRecordIds) {

    private static final CollectionPublishOptions PUBLISH = new CollectionPublishOptions(false, Map.of());
    private static final CollectionPublishOptions SKIP = new CollectionPublishOptions(true, Map.of());

    public CollectionPublishOptions {
        publishedRecordIds = publishedRecordIds == null ? Map.of() : Map.copyOf(publishedRecordIds);
    }

    public static CollectionPublishOptions publish() {
        return PUBLISH;
    }

    public static CollectionPublishOptions skip() {
        return SKIP;
    }

    public static CollectionPublishOptions alreadyPublished(CollectionId collectionId, PublishedRecordId recordId) {
        return new CollectionPublishOptions(true, Map.of(collectionId, recordId));
    }

    public static CollectionPublishOptions orDefault(CollectionPublishOptions options) {
        return options == null ? PUBLISH : options;
    }

    public PublishedRecordId recordIdFor(CollectionId collectionId) {
        return publishedRecordIds.get(collectionId);
    }
}
