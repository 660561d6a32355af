package app.semble.core.card.domain.request;

import app.semble.core.card.domain.value.PublishedRecordId;

public record UpdateCollectionRequest(
        String collectionId,
        String curatorId,
        String name,
        String description,
        OperationContext context,
        PublishedRecordId publishedRecordId
) {

    public UpdateCollectionRequest {
        context = context == null ? OperationContext.USER_INITIATED : context;
    }
}
