package app.semble.core.card.domain.request;

import app.semble.core.card.domain.value.CollectionId;
import app.semble.core.card.domain.value.PublishedRecordId;

import java.util.List;
import java.util.Map;

public record UpdateUrlCardAssociationsRequest(
        String cardId,
        String curatorId,
        String note,
        List<String> addToCollections,
        List<String> removeFromCollections,
        OperationContext context,
        PublishedRecordId noteCardRecordId,
        Map<CollectionId, PublishedRecordId> collectionLinkRecordIds
) {

    public UpdateUrlCardAssociationsRequest {
        addToCollections = addToCollections == null ? List.of() : List.copyOf(addToCollections);
        removeFromCollections = removeFromCollections == null ? List.of() : List.copyOf(removeFromCollections);
        context = context == null ? OperationContext.USER_INITIATED : context;
        collectionLinkRecordIds = collectionLinkRecordIds == null ? Map.of() : Map.copyOf(collectionLinkRecordIds);
    }

    public static UpdateUrlCardAssociationsRequest userInitiated(String cardId,
                                                                 String curatorId,
                                                                 String note,
                                                                 List<String> addToCollections,
                                                                 List<String> removeFromCollections) {
        return new UpdateUrlCardAssociationsRequest(cardId, curatorId, note, addToCollections,
                removeFromCollections, OperationContext.USER_INITIATED, null, Map.of());
    }
}
