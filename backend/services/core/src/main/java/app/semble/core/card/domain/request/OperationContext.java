package app.semble.core.card.domain.request;

public enum OperationContext {
    USER_INITIATED,
    FIREHOSE_EVENT,
    SYSTEM_MIGRATION;

    public boolean skipsPublishing() {
        return this != USER_INITIATED;
    }
}
