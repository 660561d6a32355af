package app.semble.core.card.domain.request;

import app.semble.core.card.domain.value.PublishedRecordId;

import java.util.List;

/**
 * @param publishedRecordId record already written for the URL card; only honoured outside
 *                          {@link OperationContext#USER_INITIATED}
 */
public record AddUrlToLibraryRequest(
        String url,
        String note,
        List<String> collectionIds,
        String curatorId,
        OperationContext context,
        PublishedRecordId publishedRecordId
) {

    public AddUrlToLibraryRequest {
        collectionIds = collectionIds == null ? List.of() : List.copyOf(collectionIds);
        context = context == null ? OperationContext.USER_INITIATED : context;
    }

    public static AddUrlToLibraryRequest userInitiated(String url, String note, List<String> collectionIds, String curatorId) {
        return new AddUrlToLibraryRequest(url, note, collectionIds, curatorId, OperationContext.USER_INITIATED, null);
    }
}
