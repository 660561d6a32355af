package app.semble.core.card.domain.request;

import app.semble.core.card.domain.type.CollectionAccessType;
import app.semble.core.card.domain.value.PublishedRecordId;

import java.util.List;

public record CreateCollectionRequest(
        String curatorId,
        String name,
        String description,
        CollectionAccessType accessType,
        List<String> collaboratorIds,
        OperationContext context,
        PublishedRecordId publishedRecordId
) {

    public CreateCollectionRequest {
        collaboratorIds = collaboratorIds == null ? List.of() : List.copyOf(collaboratorIds);
        context = context == null ? OperationContext.USER_INITIATED : context;
    }

    public static CreateCollectionRequest userInitiated(String curatorId, String name, String description) {
        return new CreateCollectionRequest(curatorId, name, description, CollectionAccessType.CLOSED,
                List.of(), OperationContext.USER_INITIATED, null);
    }
}
