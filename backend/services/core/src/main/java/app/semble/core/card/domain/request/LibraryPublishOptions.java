package app.semble.core.card.domain.request;

import app.semble.core.card.domain.value.PublishedRecordId;

/**
 * Controls outbound publication of a library change.
 *
 * @param skipPublishing    do not call the publisher
 * @param publishedRecordId record that already exists remotely; stamped instead of publishing
 */
public record LibraryPublishOptions(boolean skipPublishing, PublishedRecordId publishedRecordId) {

    private static final LibraryPublishOptions PUBLISH = new LibraryPublishOptions(false, null);
    private static final LibraryPublishOptions SKIP = new LibraryPublishOptions(true, null);

    public static LibraryPublishOptions publish() {
        return PUBLISH;
    }

    public static LibraryPublishOptions skip() {
        return SKIP;
    }

    public static LibraryPublishOptions alreadyPublished(PublishedRecordId recordId) {
        return recordId == null ? SKIP : new LibraryPublishOptions(true, recordId);
    }

    public static LibraryPublishOptions orDefault(LibraryPublishOptions options) {
        return options == null ? PUBLISH : options;
    }
}
